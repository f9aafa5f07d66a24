package com.williamcallahan.literature_search_engine.controller.support;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Small helper for producing consistent error payloads across controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, Object> errorBody(HttpStatus status, String message) {
        return errorBody(status, message, null);
    }

    public static Map<String, Object> errorBody(HttpStatus status, String message, String detail) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", message);
        if (detail != null && !detail.isBlank()) {
            body.put("message", detail);
        }
        return body;
    }

    public static ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message, String detail) {
        return ResponseEntity.status(status).body(errorBody(status, message, detail));
    }
}
