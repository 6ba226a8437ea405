package de.bsommerfeld.labreport.server.http;

import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Map;

/**
 * Status plus a body that is serialized to JSON by the request handler.
 */
public record ApiResponse(HttpResponseStatus status, Object body) {

    public static ApiResponse ok(Object body) {
        return new ApiResponse(HttpResponseStatus.OK, body);
    }

    public static ApiResponse created(Object body) {
        return new ApiResponse(HttpResponseStatus.CREATED, body);
    }

    public static ApiResponse message(String message) {
        return ok(Map.of("message", message));
    }

    public static ApiResponse error(HttpResponseStatus status, String message) {
        return new ApiResponse(status, Map.of("error", message == null ? status.reasonPhrase() : message));
    }
}
