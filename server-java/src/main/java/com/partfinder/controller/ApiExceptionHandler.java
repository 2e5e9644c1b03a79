package com.partfinder.controller;

import com.partfinder.model.StoreSearchResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<StoreSearchResponse> unreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable store search body: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(StoreSearchResponse.builder()
                .success(false)
                .error("Malformed request body")
                .build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<StoreSearchResponse> badRequest(IllegalArgumentException ex) {
        log.warn("Rejected store search: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(StoreSearchResponse.builder()
                .success(false)
                .error(ex.getMessage())
                .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<StoreSearchResponse> internal(Exception ex) {
        log.error("Error finding stores", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(StoreSearchResponse.builder()
                .success(false)
                .error(ex.getMessage() != null ? ex.getMessage() : "Failed to find stores")
                .build());
    }
}
