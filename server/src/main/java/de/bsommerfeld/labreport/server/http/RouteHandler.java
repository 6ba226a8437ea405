package de.bsommerfeld.labreport.server.http;

@FunctionalInterface
public interface RouteHandler {

    ApiResponse handle(ApiRequest request);
}
