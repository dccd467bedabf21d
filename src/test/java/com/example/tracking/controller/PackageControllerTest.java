package com.example.tracking.controller;

import com.example.tracking.config.JacksonConfig;
import com.example.tracking.model.ImportRecord;
import com.example.tracking.model.ImportResult;
import com.example.tracking.model.PackageDetails;
import com.example.tracking.model.PackageStatus;
import com.example.tracking.model.SyncResult;
import com.example.tracking.model.TrackedPackage;
import com.example.tracking.model.TrackingEvent;
import com.example.tracking.service.CarrierTransportException;
import com.example.tracking.service.DuplicatePackageException;
import com.example.tracking.service.PackageNotFoundException;
import com.example.tracking.service.PackageService;
import com.example.tracking.service.sync.ReconciliationService;
import com.example.tracking.service.transfer.ExportService;
import com.example.tracking.service.transfer.ImportFormat;
import com.example.tracking.service.transfer.ImportService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PackageControllerTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T08:00:00Z");

    private PackageService packageService;
    private ImportService importService;
    private ExportService exportService;
    private ReconciliationService reconciliationService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        packageService = mock(PackageService.class);
        importService = mock(ImportService.class);
        exportService = mock(ExportService.class);
        reconciliationService = mock(ReconciliationService.class);
        ObjectMapper mapper = JacksonConfig.configure(new ObjectMapper());

        mockMvc = MockMvcBuilders
                .standaloneSetup(
                        new PackageController(packageService, importService, exportService),
                        new SyncController(reconciliationService))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new StringHttpMessageConverter(), new MappingJackson2HttpMessageConverter(mapper))
                .build();
    }

    @Test
    void add_returnsCreatedPackage() throws Exception {
        when(packageService.add("1Z999AA1", "ups"))
                .thenReturn(new TrackedPackage(1, "1Z999AA1", "ups", PackageStatus.PENDING, null, CREATED));

        mockMvc.perform(post("/api/packages").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"trackingNumber\":\"1Z999AA1\",\"carrier\":\"ups\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.trackingNumber").value("1Z999AA1"))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.createdAt").value("2024-05-01T08:00:00Z"));
    }

    @Test
    void add_duplicateIsConflict() throws Exception {
        when(packageService.add(eq("1Z999AA1"), any())).thenThrow(new DuplicatePackageException("1Z999AA1"));

        mockMvc.perform(post("/api/packages").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"trackingNumber\":\"1Z999AA1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DUPLICATE"));
    }

    @Test
    void list_filtersByStatus() throws Exception {
        when(packageService.list(PackageStatus.IN_TRANSIT)).thenReturn(List.of(
                new TrackedPackage(2, "B", null, PackageStatus.IN_TRANSIT, CREATED, CREATED)));

        mockMvc.perform(get("/api/packages").param("status", "in_transit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.statusFilter").value("in_transit"))
                .andExpect(jsonPath("$.packages[0].trackingNumber").value("B"));
    }

    @Test
    void list_defaultsToAll() throws Exception {
        when(packageService.list(null)).thenReturn(List.of());

        mockMvc.perform(get("/api/packages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.statusFilter").value("all"))
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void list_unknownFilterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/packages").param("status", "lost_in_space"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION"));
    }

    @Test
    void get_returnsPackageWithEvents() throws Exception {
        TrackedPackage p = new TrackedPackage(1, "1Z999AA1", "ups", PackageStatus.DELIVERED, CREATED, CREATED);
        when(packageService.get("1Z999AA1")).thenReturn(new PackageDetails(p, List.of(
                new TrackingEvent(Instant.parse("2024-05-02T10:00:00Z"), "Home", "Delivered"))));

        mockMvc.perform(get("/api/packages/1Z999AA1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trackedPackage.status").value("delivered"))
                .andExpect(jsonPath("$.events[0].description").value("Delivered"))
                .andExpect(jsonPath("$.events[0].time").value("2024-05-02T10:00:00Z"));
    }

    @Test
    void get_unknownIsNotFound() throws Exception {
        when(packageService.get("NOPE")).thenThrow(new PackageNotFoundException("NOPE"));

        mockMvc.perform(get("/api/packages/NOPE"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void delete_returnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/packages/1Z999AA1"))
                .andExpect(status().isNoContent());

        verify(packageService).delete("1Z999AA1");
    }

    @Test
    void delete_unknownIsNotFound() throws Exception {
        doThrow(new PackageNotFoundException("NOPE")).when(packageService).delete("NOPE");

        mockMvc.perform(delete("/api/packages/NOPE"))
                .andExpect(status().isNotFound());
    }

    @Test
    void import_uploadedCsvFile() throws Exception {
        when(importService.importStream(any(), eq(ImportFormat.CSV)))
                .thenReturn(new ImportResult(2, 0, List.of()));
        MockMultipartFile file = new MockMultipartFile(
                "file", "packages.csv", "text/csv", "number,carrier\nA,ups\nB,\n".getBytes());

        mockMvc.perform(multipart("/api/packages/import").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.imported").value(2))
                .andExpect(jsonPath("$.skipped").value(0));
    }

    @Test
    void import_uploadWithUnsupportedExtensionIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "packages.xml", "text/xml", "<a/>".getBytes());

        mockMvc.perform(multipart("/api/packages/import").file(file))
                .andExpect(status().isBadRequest());
    }

    @Test
    void import_jsonBody() throws Exception {
        when(importService.importRecords(List.of(new ImportRecord("A", "ups"), new ImportRecord("A", null))))
                .thenReturn(new ImportResult(1, 1, List.of(
                        new ImportResult.ImportFailure(1, "A", ImportResult.Reason.DUPLICATE, "already tracked"))));

        mockMvc.perform(post("/api/packages/import").contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"number\":\"A\",\"carrier\":\"ups\"},{\"tracking_number\":\"A\"}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.imported").value(1))
                .andExpect(jsonPath("$.errors[0].reason").value("DUPLICATE"));
    }

    @Test
    void export_returnsSnapshots() throws Exception {
        when(exportService.export()).thenReturn(List.of());

        mockMvc.perform(get("/api/packages/export"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }

    @Test
    void sync_carrierFailureIsBadGateway() throws Exception {
        when(reconciliationService.sync(null)).thenThrow(new CarrierTransportException("Carrier API returned 503"));

        mockMvc.perform(post("/api/sync"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("CARRIER_TRANSPORT"));
    }

    @Test
    void sync_oneNumber() throws Exception {
        when(reconciliationService.sync("A")).thenReturn(new SyncResult(1, 1, List.of(), List.of()));

        mockMvc.perform(post("/api/sync").param("number", "A"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.synced").value(1))
                .andExpect(jsonPath("$.unreported").isEmpty());
    }
}
