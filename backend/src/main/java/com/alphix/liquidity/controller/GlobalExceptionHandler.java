// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.controller;

import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.common.DomainErrorException;
import com.alphix.liquidity.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Global exception handler for all REST controllers.
 *
 * Provides standardized error responses across all endpoints:
 * - DomainErrorException (taxonomy errors, status from DomainErrorStatusMapper)
 * - Validation errors (400 Bad Request)
 * - Generic exceptions (500 Internal Server Error)
 * - CompletionException unwrapping (async errors)
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DomainErrorException.class)
    public ResponseEntity<ErrorResponse> handleDomainError(
            DomainErrorException ex,
            HttpServletRequest request
    ) {
        DomainError error = ex.error();
        HttpStatus status = DomainErrorStatusMapper.map(error);
        ErrorResponse errorResponse = ErrorResponse.of(error, status.value(), request.getRequestURI(),
            request.getHeader("X-Request-ID"));

        logger.warn("{} {} - {}: {}", status.value(), request.getRequestURI(), error.code(), error.message());

        return ResponseEntity.status(status).body(errorResponse);
    }

    /**
     * Handle validation errors (e.g., @Valid annotation failures).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        Map<String, String> validationErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
            validationErrors.put(error.getField(), error.getDefaultMessage())
        );

        ErrorResponse errorResponse = ErrorResponse.of(
            "VALIDATION_ERROR",
            "Request validation failed",
            HttpStatus.BAD_REQUEST.value(),
            request.getRequestURI()
        ).withDetails(validationErrors);

        logger.warn("Validation error on {}: {}", request.getRequestURI(), validationErrors);

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        ErrorResponse errorResponse = ErrorResponse.of(
            "VALIDATION_ERROR",
            "Malformed request body",
            HttpStatus.BAD_REQUEST.value(),
            request.getRequestURI()
        );
        return ResponseEntity.badRequest().body(errorResponse);
    }

    /**
     * Handle CompletionException (wraps async exceptions from CompletableFuture).
     * Unwraps and delegates to appropriate handler.
     */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<ErrorResponse> handleCompletionException(
            CompletionException ex,
            HttpServletRequest request
    ) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof DomainErrorException domainError) {
            return handleDomainError(domainError, request);
        }
        return handleGenericException(cause, request);
    }

    /**
     * Handle all other uncaught exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Throwable ex,
            HttpServletRequest request
    ) {
        String message = ex.getMessage();
        ErrorResponse errorResponse = ErrorResponse.of(
            "INTERNAL_SERVER_ERROR",
            message != null ? message : "An unexpected error occurred",
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            request.getRequestURI()
        );

        logger.error("Unhandled exception on {}: {}", request.getRequestURI(), message, ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }
}
