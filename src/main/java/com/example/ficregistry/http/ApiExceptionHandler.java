package com.example.ficregistry.http;

import com.example.ficregistry.service.PersonRegistryException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> missingParam(MissingServletRequestParameterException ex) {
        return ResponseEntity.badRequest().body(Map.of(
                "code", PersonRegistryException.Code.INVALID_INPUT.name(),
                "message", "Missing parameter " + ex.getParameterName()));
    }

    @ExceptionHandler(PersonRegistryException.class)
    public ResponseEntity<Map<String, Object>> domainError(PersonRegistryException ex) {
        HttpStatus status;
        switch (ex.getCode()) {
            case INVALID_INPUT -> status = HttpStatus.BAD_REQUEST;
            case AMBIGUOUS_MATCH -> status = HttpStatus.CONFLICT;
            case SECURITY_VIOLATION -> status = HttpStatus.FORBIDDEN;
            case SOURCE_NOT_FOUND -> status = HttpStatus.NOT_FOUND;
            case FETCH_FAILED -> status = HttpStatus.BAD_GATEWAY;
            default -> status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (status.is5xxServerError() || ex.getCode() == PersonRegistryException.Code.SECURITY_VIOLATION) {
            log.warn("{}: {}", ex.getCode(), ex.getAdminDetail());
        } else {
            log.debug("{}: {}", ex.getCode(), ex.getAdminDetail());
        }

        return ResponseEntity.status(status)
                .body(Map.of(
                        "code", ex.getCode().name(),
                        "message", ex.getMessage()
                ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        log.error("Unexpected error handling request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("code", "INTERNAL_ERROR", "message", "Unexpected error"));
    }
}
