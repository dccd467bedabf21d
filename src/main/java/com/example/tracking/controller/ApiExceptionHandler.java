package com.example.tracking.controller;

import com.example.tracking.model.ErrorResponse;
import com.example.tracking.service.CarrierDecodeException;
import com.example.tracking.service.CarrierTransportException;
import com.example.tracking.service.DuplicatePackageException;
import com.example.tracking.service.PackageNotFoundException;
import com.example.tracking.service.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps store and sync failures to HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(DuplicatePackageException.class)
    public ResponseEntity<ErrorResponse> duplicate(DuplicatePackageException e) {
        return respond(HttpStatus.CONFLICT, "DUPLICATE", e.getMessage());
    }

    @ExceptionHandler(PackageNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(PackageNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> invalid(ValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION", e.getMessage());
    }

    @ExceptionHandler(CarrierTransportException.class)
    public ResponseEntity<ErrorResponse> transport(CarrierTransportException e) {
        log.error("Carrier transport failure: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "CARRIER_TRANSPORT", e.getMessage());
    }

    @ExceptionHandler(CarrierDecodeException.class)
    public ResponseEntity<ErrorResponse> decode(CarrierDecodeException e) {
        log.error("Carrier decode failure: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "CARRIER_DECODE", e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(error, message));
    }
}
