package com.visionrelay.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;

import com.visionrelay.dto.ErrorResponse;
import com.visionrelay.exception.ProtocolViolationException;

/**
 * Maps exceptions raised by the status API to {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ProtocolViolationException.class)
    public ResponseEntity<ErrorResponse> handleProtocolViolation(ProtocolViolationException e,
                                                                 ServerWebExchange exchange) {
        logger.debug("Rejected request {}: {}", exchange.getRequest().getPath(), e.getMessage());
        ErrorResponse body = ErrorResponse.of(e.getErrorCode(), e.getDetails());
        body.setPath(exchange.getRequest().getPath().value());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
}
