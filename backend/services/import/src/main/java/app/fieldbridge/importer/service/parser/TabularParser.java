package app.fieldbridge.importer.service.parser;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits delimited text into a header row and positional row maps.
 * Quoting and escaping are disabled: a delimiter inside a value always splits it.
 */
@Component
public class TabularParser {

    private final char delimiter;

    public TabularParser() {
        this(',');
    }

    public TabularParser(char delimiter) {
        this.delimiter = delimiter;
    }

    public TabularData parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new MalformedSourceException("Source is empty");
        }
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setQuote(null)
                .setEscape(null)
                .setTrim(true)
                .setIgnoreSurroundingSpaces(true)
                .setIgnoreEmptyLines(true)
                .build();

        List<String> headers = null;
        List<Map<String, String>> rows = new ArrayList<>();
        try (CSVParser parser = format.parse(new StringReader(rawText))) {
            for (CSVRecord record : parser) {
                List<String> values = recordToList(record);
                if (isBlankLine(values)) {
                    continue;
                }
                if (headers == null) {
                    headers = List.copyOf(values);
                    continue;
                }
                rows.add(zip(headers, values));
            }
        } catch (IOException | UncheckedIOException ex) {
            throw new MalformedSourceException("Failed to read source", ex);
        }

        if (headers == null || headers.stream().allMatch(String::isBlank)) {
            throw new MalformedSourceException("Source has no header row");
        }
        return new TabularData(headers, Collections.unmodifiableList(rows));
    }

    public List<SourceColumn> columns(TabularData data) {
        Map<String, String> sample = data.rows().isEmpty() ? Map.of() : data.rows().get(0);
        List<SourceColumn> columns = new ArrayList<>();
        for (String header : data.headers()) {
            if (header.isBlank()) {
                continue;
            }
            columns.add(new SourceColumn(header, sample.get(header)));
        }
        return columns;
    }

    private Map<String, String> zip(List<String> headers, List<String> values) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            if (header.isBlank()) {
                continue;
            }
            row.put(header, i < values.size() ? values.get(i) : "");
        }
        return Collections.unmodifiableMap(row);
    }

    private List<String> recordToList(CSVRecord record) {
        List<String> values = new ArrayList<>(record.size());
        for (int i = 0; i < record.size(); i++) {
            String value = record.get(i);
            values.add(value == null ? "" : value.trim());
        }
        return values;
    }

    private boolean isBlankLine(List<String> values) {
        return values.isEmpty() || (values.size() == 1 && values.get(0).isBlank());
    }
}
