package com.example.tracking.controller;

import com.example.tracking.model.ImportRecord;
import com.example.tracking.model.ImportResult;
import com.example.tracking.model.PackageDetails;
import com.example.tracking.model.PackageSnapshot;
import com.example.tracking.model.PackageStatus;
import com.example.tracking.model.TrackedPackage;
import com.example.tracking.service.PackageService;
import com.example.tracking.service.ValidationException;
import com.example.tracking.service.transfer.ExportService;
import com.example.tracking.service.transfer.ImportFormat;
import com.example.tracking.service.transfer.ImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * REST endpoints over the package store.
 *
 * POST   /api/packages                  add
 * GET    /api/packages?status=          list
 * GET    /api/packages/{trackingNumber} get with events
 * DELETE /api/packages/{trackingNumber} delete with events
 * POST   /api/packages/import           bulk load (.json/.csv upload or JSON array body)
 * GET    /api/packages/export           full snapshot
 */
@RestController
@RequestMapping("/api/packages")
@Slf4j
@RequiredArgsConstructor
public class PackageController {

    private static final String ALL = "all";

    private final PackageService packageService;
    private final ImportService importService;
    private final ExportService exportService;

    public record AddPackageRequest(String trackingNumber, String carrier) {}

    public record PackageListResponse(int count, String statusFilter, List<TrackedPackage> packages) {}

    @PostMapping
    public ResponseEntity<TrackedPackage> add(@RequestBody AddPackageRequest request) {
        TrackedPackage created = packageService.add(request.trackingNumber(), request.carrier());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public PackageListResponse list(@RequestParam(name = "status", defaultValue = ALL) String status) {
        PackageStatus filter = ALL.equalsIgnoreCase(status.trim()) ? null : PackageStatus.requireCode(status);
        List<TrackedPackage> packages = packageService.list(filter);
        return new PackageListResponse(packages.size(), filter == null ? ALL : filter.code(), packages);
    }

    @GetMapping("/{trackingNumber}")
    public PackageDetails get(@PathVariable String trackingNumber) {
        return packageService.get(trackingNumber);
    }

    @DeleteMapping("/{trackingNumber}")
    public ResponseEntity<Void> delete(@PathVariable String trackingNumber) {
        packageService.delete(trackingNumber);
        return ResponseEntity.noContent().build();
    }

    /**
     * Example: curl -F file=@packages.csv http://localhost:8080/api/packages/import
     */
    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ImportResult importFile(@RequestPart("file") MultipartFile file) {
        if (file.isEmpty()) {
            throw new ValidationException("Import file is empty");
        }
        ImportFormat format = ImportFormat.fromFileName(file.getOriginalFilename());
        log.info("Import upload received: {} ({} bytes)", file.getOriginalFilename(), file.getSize());
        try (InputStream in = file.getInputStream()) {
            return importService.importStream(in, format);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded file", e);
        }
    }

    @PostMapping(value = "/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ImportResult importRecords(@RequestBody List<ImportRecord> records) {
        return importService.importRecords(records);
    }

    @GetMapping("/export")
    public List<PackageSnapshot> export() {
        return exportService.export();
    }
}
