package de.bsommerfeld.labreport.server.http;

/**
 * The path matched a route but not with the requested method.
 */
public class MethodNotAllowedException extends RuntimeException {

    public MethodNotAllowedException(String message) {
        super(message);
    }
}
