package com.example.tracking.service.transfer;

import com.example.tracking.model.PackageSnapshot;
import com.example.tracking.service.PackageService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Full dump of the store, package by package.
 *
 * Each package and its ledger are read together under that package's lock, so no
 * snapshot shows a half-applied merge. The export as a whole is not one transaction:
 * packages deleted while it runs are left out.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExportService {

    private final PackageService packageService;
    private final ObjectMapper objectMapper;

    public List<PackageSnapshot> export() {
        List<PackageSnapshot> snapshots = new ArrayList<>();
        for (String number : packageService.trackingNumbers()) {
            packageService.snapshot(number)
                    .map(PackageSnapshot::of)
                    .ifPresent(snapshots::add);
        }
        log.info("Exported {} packages", snapshots.size());
        return snapshots;
    }

    /**
     * Write the export as pretty-printed JSON.
     *
     * @return number of packages written
     */
    public int exportTo(Path output) {
        List<PackageSnapshot> snapshots = export();
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), snapshots);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write export to " + output, e);
        }
        log.info("Wrote export of {} packages to {}", snapshots.size(), output);
        return snapshots.size();
    }
}
