package app.fieldbridge.importer.client.catalog;

import app.fieldbridge.importer.service.catalog.CanonicalField;
import app.fieldbridge.importer.service.catalog.CanonicalFieldCatalog;
import app.fieldbridge.importer.service.catalog.CatalogUnavailableException;
import app.fieldbridge.importer.service.catalog.DuplicateFieldKeyException;
import app.fieldbridge.importer.service.catalog.FieldType;
import app.fieldbridge.importer.service.catalog.NewFieldRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class FieldCatalogApiClient implements CanonicalFieldCatalog {

    private static final Logger log = LoggerFactory.getLogger(FieldCatalogApiClient.class);

    private static final String CREATED_BY = "bulk-import";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public FieldCatalogApiClient(@Qualifier("catalogRestClient") RestClient catalogRestClient,
                                 ObjectMapper objectMapper) {
        this.restClient = catalogRestClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<CanonicalField> list() {
        List<CatalogFieldResponse> response;
        try {
            response = restClient.get()
                    .uri("/field-library")
                    .retrieve()
                    .body(new ParameterizedTypeReference<List<CatalogFieldResponse>>() {});
        } catch (RestClientException ex) {
            throw new CatalogUnavailableException("Failed to load field library", ex);
        }
        if (response == null) {
            return List.of();
        }
        List<CanonicalField> fields = new ArrayList<>(response.size());
        for (CatalogFieldResponse entry : response) {
            if (entry == null || entry.fieldKey() == null || entry.fieldKey().isBlank()) {
                continue;
            }
            fields.add(toField(entry));
        }
        return fields;
    }

    @Override
    public CanonicalField create(NewFieldRequest request) {
        CatalogFieldRequest body = new CatalogFieldRequest(
                request.fieldKey(),
                request.label(),
                request.type().name(),
                request.category(),
                request.aliases(),
                CREATED_BY
        );
        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/fields/create")
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (HttpClientErrorException ex) {
            if (isDuplicate(ex)) {
                throw new DuplicateFieldKeyException(request.fieldKey());
            }
            throw new CatalogUnavailableException("Field library rejected field '" + request.fieldKey() + "': " + ex.getStatusCode(), ex);
        } catch (RestClientException ex) {
            throw new CatalogUnavailableException("Failed to create field '" + request.fieldKey() + "'", ex);
        }

        CanonicalField created = parseCreated(response, request);
        log.info("Field library entry created: fieldKey={}, type={}, category={}", created.fieldKey(), created.type(), created.category());
        return created;
    }

    CanonicalField toField(CatalogFieldResponse entry) {
        Set<String> aliases = new LinkedHashSet<>();
        aliases.addAll(readAliases(entry.aliases()));
        aliases.addAll(readAliases(entry.commonAliases()));
        return new CanonicalField(
                entry.fieldKey(),
                firstNonBlank(entry.label(), entry.canonicalName()),
                FieldType.fromWire(firstNonBlank(entry.type(), entry.fieldType())),
                entry.category(),
                aliases,
                entry.usageCount() == null ? 0 : entry.usageCount()
        );
    }

    private CanonicalField parseCreated(JsonNode response, NewFieldRequest request) {
        JsonNode node = response != null && response.has("field") ? response.get("field") : response;
        if (node == null || node.isNull() || !node.hasNonNull("field_key")) {
            return new CanonicalField(
                    request.fieldKey(),
                    request.label(),
                    request.type(),
                    request.category(),
                    Set.copyOf(request.aliases()),
                    0
            );
        }
        CatalogFieldResponse entry = objectMapper.convertValue(node, CatalogFieldResponse.class);
        CanonicalField field = toField(entry);
        if (field.aliases().isEmpty() && !request.aliases().isEmpty()) {
            return new CanonicalField(field.fieldKey(), field.label(), field.type(), field.category(), Set.copyOf(request.aliases()), field.usageCount());
        }
        return field;
    }

    private List<String> readAliases(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        JsonNode array = node;
        if (node.isTextual()) {
            String text = node.asText();
            if (text.isBlank()) {
                return List.of();
            }
            try {
                array = objectMapper.readTree(text);
            } catch (JsonProcessingException ex) {
                log.warn("Ignoring unreadable field aliases: value={}", text);
                return List.of();
            }
        }
        if (!array.isArray()) {
            return List.of();
        }
        List<String> aliases = new ArrayList<>();
        for (JsonNode alias : array) {
            if (alias.isTextual() && !alias.asText().isBlank()) {
                aliases.add(alias.asText().trim());
            }
        }
        return aliases;
    }

    private boolean isDuplicate(HttpClientErrorException ex) {
        if (ex.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
            return true;
        }
        return ex.getStatusCode().value() == HttpStatus.BAD_REQUEST.value()
                && ex.getResponseBodyAsString().toLowerCase(Locale.ROOT).contains("already exists");
    }

    private String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second;
    }
}
