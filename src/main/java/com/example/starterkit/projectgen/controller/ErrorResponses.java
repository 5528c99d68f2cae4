package com.example.starterkit.projectgen.controller;

import com.example.starterkit.projectgen.exception.CatalogUnavailableException;
import com.example.starterkit.projectgen.exception.DependencyCycleException;
import com.example.starterkit.projectgen.exception.DuplicateModelException;
import com.example.starterkit.projectgen.exception.GenerationException;
import com.example.starterkit.projectgen.exception.UnknownFeatureException;
import com.example.starterkit.projectgen.service.GenerationJobService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps generation errors to HTTP responses with a {code, description, identifiers} body
 */
final class ErrorResponses {
    private ErrorResponses() {
    }

    static ResponseEntity<Map<String, Object>> of(GenerationException e) {
        return body(statusOf(e.getCode()), e.getCode(), e.getDescription(), e.getIdentifiers());
    }

    static ResponseEntity<Map<String, Object>> of(String code, String description, List<String> identifiers) {
        return body(statusOf(code), code, description, identifiers);
    }

    static ResponseEntity<Map<String, Object>> badRequest(String description) {
        return body(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", description, List.of());
    }

    static HttpStatus statusOf(String code) {
        if (code == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        switch (code) {
            case UnknownFeatureException.CODE:
            case DependencyCycleException.CODE:
                return HttpStatus.BAD_REQUEST;
            case DuplicateModelException.CODE:
                return HttpStatus.CONFLICT;
            case CatalogUnavailableException.CODE:
            case GenerationJobService.JOB_REJECTED:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String description,
                                                            List<String> identifiers) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("description", description);
        body.put("identifiers", identifiers != null ? identifiers : List.of());
        return new ResponseEntity<>(body, status);
    }
}
