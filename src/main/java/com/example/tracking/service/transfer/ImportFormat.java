package com.example.tracking.service.transfer;

import com.example.tracking.service.ValidationException;

import java.util.Locale;

/**
 * Supported import file formats, chosen by file extension.
 */
public enum ImportFormat {
    JSON,
    CSV;

    public static ImportFormat fromFileName(String fileName) {
        String name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return JSON;
        }
        if (name.endsWith(".csv")) {
            return CSV;
        }
        throw new ValidationException("Unsupported import file (expected .json or .csv): " + fileName);
    }
}
