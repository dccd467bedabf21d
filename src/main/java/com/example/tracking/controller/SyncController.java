package com.example.tracking.controller;

import com.example.tracking.model.SyncResult;
import com.example.tracking.service.sync.ReconciliationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual trigger for reconciliation.
 *
 * Example: POST /api/sync            (all packages)
 *          POST /api/sync?number=1Z9 (one package)
 */
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {

    private final ReconciliationService reconciliationService;

    @PostMapping
    public SyncResult sync(@RequestParam(name = "number", required = false) String trackingNumber) {
        return reconciliationService.sync(trackingNumber);
    }
}
