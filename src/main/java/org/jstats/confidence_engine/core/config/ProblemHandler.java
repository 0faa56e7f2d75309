package org.jstats.confidence_engine.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.util.stream.Collectors;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestControllerAdvice
public class ProblemHandler {

    private static final Logger log = LoggerFactory.getLogger(ProblemHandler.class);

    private static final String PROBLEM_BASE = "https://api.jstats.org/problems/";

    @ExceptionHandler(ResponseStatusException.class)
    public ProblemDetail handle(ResponseStatusException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(ex.getStatusCode(), ex.getReason());
        pd.setType(URI.create(PROBLEM_BASE + ex.getStatusCode().value()));
        var status = HttpStatus.resolve(ex.getStatusCode().value());
        pd.setTitle(status == NOT_FOUND ? "Resource Not Found"
                : status == BAD_REQUEST ? "Bad Request"
                : "Request Failed");
        return pd;
    }

    // Unknown category, confidence out of range, PENDING as a settled outcome, odds that cannot size a stake
    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail invalidInput(IllegalArgumentException ex) {
        return badRequest("Invalid Input", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail invalidBody(MethodArgumentNotValidException ex) {
        var detail = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return badRequest("Validation Failed", detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail unreadable(HttpMessageNotReadableException ex) {
        var cause = ex.getMostSpecificCause();
        return badRequest("Malformed Request", cause.getMessage());
    }

    // Catch any other unexpected exception as a 500 Problem (avoid leaking internals)
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected error. If this persists, contact support.");
        pd.setType(URI.create(PROBLEM_BASE + "internal-error"));
        pd.setTitle("Internal Server Error");
        return pd;
    }

    private static ProblemDetail badRequest(String title, String detail) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(BAD_REQUEST, detail);
        pd.setType(URI.create(PROBLEM_BASE + "invalid-input"));
        pd.setTitle(title);
        return pd;
    }
}
