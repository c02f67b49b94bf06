package com.gt.recall.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.time.Instant;

@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    private final Clock clock;

    public RestExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    public record ErrorResponse(Instant timestamp, int status, String error, String message) { }

    // Operations issued out of order, e.g. answering before an item is presented
    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ErrorResponse handleConflict(IllegalStateException ex) {
        log.warn("Rejected review operation: {}", ex.getMessage());
        return new ErrorResponse(clock.instant(), HttpStatus.CONFLICT.value(), "Conflict", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleBadRequest(IllegalArgumentException ex) {
        return new ErrorResponse(clock.instant(), HttpStatus.BAD_REQUEST.value(), "Bad request", ex.getMessage());
    }
}
