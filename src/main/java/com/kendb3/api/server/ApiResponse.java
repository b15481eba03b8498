package com.kendb3.api.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response envelope of the data manager endpoint.
 *
 * <p>The body is {@code {"status": ..., "payload": ...}}; {@code status} is
 * {@code OK} on success and the error message otherwise.
 *
 * @param status     {@code OK} or an error message
 * @param payload    data of a successful response, {@code null} on failure
 * @param statusCode HTTP status code
 */
public record ApiResponse(String status, Object payload, int statusCode) {

    public static final String OK = "OK";

    public static ApiResponse success(Object payload) {
        return new ApiResponse(OK, payload, 200);
    }

    public static ApiResponse failure(String message) {
        return failure(message, 400);
    }

    public static ApiResponse failure(String message, int code) {
        return new ApiResponse(message, null, code);
    }

    public boolean isSuccess() {
        return OK.equals(status) && statusCode == 200;
    }

    public Map<String, Object> body() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("payload", payload);
        return body;
    }

    public String toJson(ObjectMapper mapper) {
        try {
            return mapper.writeValueAsString(body());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot write response body as JSON", e);
        }
    }
}
