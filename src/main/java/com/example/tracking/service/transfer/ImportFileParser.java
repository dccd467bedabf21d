package com.example.tracking.service.transfer;

import com.example.tracking.model.ImportRecord;
import com.example.tracking.service.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads import files into records.
 *
 * JSON: an array of objects with "number" (or "tracking_number"/"trackingNumber") and optional "carrier".
 * CSV:  a header row naming "number" or "tracking_number", and optionally "carrier".
 *
 * A record that cannot be read is returned as a failed line; only a file that
 * cannot be read at all fails the whole parse.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ImportFileParser {

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;

    /**
     * One parsed record, or the reason it could not be parsed.
     */
    public record ParsedLine(int index, ImportRecord record, String error) {

        static ParsedLine ok(int index, ImportRecord record) {
            return new ParsedLine(index, record, null);
        }

        static ParsedLine failed(int index, String error) {
            return new ParsedLine(index, null, error);
        }

        public boolean isValid() {
            return error == null;
        }
    }

    public List<ParsedLine> parse(InputStream in, ImportFormat format) {
        try {
            return switch (format) {
                case JSON -> parseJson(in);
                case CSV -> parseCsv(in);
            };
        } catch (IOException e) {
            throw new ValidationException("Unreadable " + format + " import file: " + e.getMessage(), e);
        }
    }

    private List<ParsedLine> parseJson(InputStream in) throws IOException {
        JsonNode root = objectMapper.readTree(in);
        if (root == null || !root.isArray()) {
            throw new ValidationException("JSON import file must contain an array of records");
        }

        List<ParsedLine> lines = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            if (!node.isObject()) {
                lines.add(ParsedLine.failed(index, "record is not an object"));
            } else {
                try {
                    lines.add(ParsedLine.ok(index, objectMapper.treeToValue(node, ImportRecord.class)));
                } catch (JsonProcessingException e) {
                    lines.add(ParsedLine.failed(index, e.getOriginalMessage()));
                }
            }
            index++;
        }
        return lines;
    }

    private List<ParsedLine> parseCsv(InputStream in) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<ParsedLine> lines = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows =
                     csvMapper.readerFor(Map.class).with(schema).readValues(in)) {
            int index = 0;
            while (hasNext(rows, index, lines)) {
                try {
                    Map<String, String> row = rows.nextValue();
                    lines.add(ParsedLine.ok(index, toRecord(row)));
                } catch (IOException | RuntimeException e) {
                    log.debug("Unreadable CSV row {}: {}", index, e.getMessage());
                    lines.add(ParsedLine.failed(index, "unreadable row: " + e.getMessage()));
                }
                index++;
            }
        }
        return lines;
    }

    /**
     * hasNextValue can itself fail on a broken row; that row is recorded and reading stops.
     */
    private static boolean hasNext(MappingIterator<?> rows, int index, List<ParsedLine> lines) {
        try {
            return rows.hasNextValue();
        } catch (IOException | RuntimeException e) {
            lines.add(ParsedLine.failed(index, "unreadable row: " + e.getMessage()));
            return false;
        }
    }

    private static ImportRecord toRecord(Map<String, String> row) {
        String number = row.get("number");
        if (number == null) {
            number = row.get("tracking_number");
        }
        if (number == null) {
            number = row.get("trackingNumber");
        }
        return new ImportRecord(number, row.get("carrier"));
    }
}
