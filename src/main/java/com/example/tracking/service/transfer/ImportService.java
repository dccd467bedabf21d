package com.example.tracking.service.transfer;

import com.example.tracking.config.TrackingMetrics;
import com.example.tracking.model.ImportRecord;
import com.example.tracking.model.ImportResult;
import com.example.tracking.model.ImportResult.ImportFailure;
import com.example.tracking.model.ImportResult.Reason;
import com.example.tracking.service.DuplicatePackageException;
import com.example.tracking.service.PackageService;
import com.example.tracking.service.ValidationException;
import com.example.tracking.service.transfer.ImportFileParser.ParsedLine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Bulk load of tracking numbers.
 *
 * Each record is added on its own; a duplicate (already tracked, or repeated in
 * the same batch) or an invalid record is reported and skipped, never fatal.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ImportService {

    private final PackageService packageService;
    private final ImportFileParser parser;
    private final TrackingMetrics metrics;

    public ImportResult importFile(Path file) {
        ImportFormat format = ImportFormat.fromFileName(file.getFileName().toString());
        try (InputStream in = Files.newInputStream(file)) {
            return importStream(in, format);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read import file " + file, e);
        }
    }

    public ImportResult importStream(InputStream in, ImportFormat format) {
        List<ParsedLine> lines = parser.parse(in, format);
        log.info("Importing {} records from {} input", lines.size(), format);

        List<ImportFailure> errors = new ArrayList<>();
        int imported = 0;
        for (ParsedLine line : lines) {
            if (!line.isValid()) {
                errors.add(new ImportFailure(line.index(), null, Reason.INVALID, line.error()));
            } else if (importOne(line.index(), line.record(), errors)) {
                imported++;
            }
        }
        return finish(imported, errors);
    }

    public ImportResult importRecords(List<ImportRecord> records) {
        List<ImportFailure> errors = new ArrayList<>();
        int imported = 0;
        for (int i = 0; i < records.size(); i++) {
            if (importOne(i, records.get(i), errors)) {
                imported++;
            }
        }
        return finish(imported, errors);
    }

    private boolean importOne(int index, ImportRecord record, List<ImportFailure> errors) {
        String number = record == null ? null : record.number();
        try {
            packageService.add(number, record == null ? null : record.carrier());
            return true;
        } catch (DuplicatePackageException e) {
            errors.add(new ImportFailure(index, e.getTrackingNumber(), Reason.DUPLICATE, e.getMessage()));
        } catch (ValidationException e) {
            errors.add(new ImportFailure(index, number, Reason.INVALID, e.getMessage()));
        }
        return false;
    }

    private ImportResult finish(int imported, List<ImportFailure> errors) {
        metrics.recordImport(imported, errors.size());
        log.info("Import complete | imported: {} | skipped: {}", imported, errors.size());
        return new ImportResult(imported, errors.size(), List.copyOf(errors));
    }
}
