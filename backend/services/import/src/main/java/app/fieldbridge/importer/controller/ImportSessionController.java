package app.fieldbridge.importer.controller;

import app.fieldbridge.importer.controller.dto.CreateFieldRequest;
import app.fieldbridge.importer.controller.dto.ImportSessionResponse;
import app.fieldbridge.importer.controller.dto.PreviewRequest;
import app.fieldbridge.importer.controller.dto.PreviewResponse;
import app.fieldbridge.importer.controller.dto.SessionSourceRequest;
import app.fieldbridge.importer.controller.dto.UpdateMappingsRequest;
import app.fieldbridge.importer.service.ImportSessionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.UUID;

@RestController
@RequestMapping("/sessions")
public class ImportSessionController {

    private final ImportSessionService sessionService;

    public ImportSessionController(ImportSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ImportSessionResponse create(@Valid @RequestBody SessionSourceRequest request) {
        return sessionService.createSession(request.sourceName(), request.sourceText());
    }

    @PostMapping(value = "/uploads", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public ImportSessionResponse upload(@RequestPart("file") MultipartFile file) {
        return sessionService.uploadSession(file);
    }

    @GetMapping("/{sessionId}")
    public ImportSessionResponse get(@PathVariable UUID sessionId) {
        return sessionService.getSession(sessionId);
    }

    @PutMapping("/{sessionId}/source")
    public ImportSessionResponse replaceSource(@PathVariable UUID sessionId,
                                               @Valid @RequestBody SessionSourceRequest request) {
        return sessionService.replaceSource(sessionId, request.sourceName(), request.sourceText());
    }

    @PutMapping("/{sessionId}/mappings")
    public ImportSessionResponse updateMappings(@PathVariable UUID sessionId,
                                                @Valid @RequestBody UpdateMappingsRequest request) {
        return sessionService.updateMappings(sessionId, request);
    }

    @PostMapping("/{sessionId}/fields")
    public ImportSessionResponse createField(@PathVariable UUID sessionId,
                                             @Valid @RequestBody CreateFieldRequest request) {
        return sessionService.createField(sessionId, request);
    }

    @PostMapping("/{sessionId}/preview")
    public PreviewResponse preview(@PathVariable UUID sessionId,
                                   @Valid @RequestBody(required = false) PreviewRequest request) {
        return sessionService.preview(sessionId, request == null ? null : request.sampleSize());
    }

    @PostMapping("/{sessionId}/import")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ImportSessionResponse startImport(@PathVariable UUID sessionId) {
        return sessionService.startImport(sessionId);
    }

    @PostMapping("/{sessionId}/cancel")
    public ImportSessionResponse cancel(@PathVariable UUID sessionId) {
        return sessionService.cancel(sessionId);
    }
}
