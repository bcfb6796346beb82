package com.williamcallahan.ratchet.web;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Builds the JSON bodies returned by the HTTP endpoints.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * @param status HTTP status
     * @param message error message shown to the caller
     * @return error response
     */
    public ResponseEntity<Map<String, Object>> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("status", "error", "message", message));
    }

    /**
     * @param data fields merged into the success body
     * @return success response
     */
    public ResponseEntity<Map<String, Object>> buildSuccessResponse(Map<String, Object> data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.putAll(data);
        return ResponseEntity.ok(body);
    }
}
