package de.bsommerfeld.labreport.server.http;

import io.netty.handler.codec.http.HttpMethod;

import java.util.Map;

/**
 * A routed request as seen by a {@link RouteHandler}.
 *
 * @param method     HTTP method
 * @param path       decoded path without query string
 * @param pathParams values bound to the route template's {@code {name}}
 *                   segments
 * @param actor      authenticated username, {@code null} on public routes
 * @param body       raw request body, empty when none was sent
 */
public record ApiRequest(HttpMethod method, String path, Map<String, String> pathParams, String actor,
        byte[] body) {

    public ApiRequest {
        pathParams = Map.copyOf(pathParams);
    }

    public String param(String name) {
        String value = pathParams.get(name);
        if (value == null)
            throw new IllegalArgumentException("Route has no parameter " + name);
        return value;
    }
}
