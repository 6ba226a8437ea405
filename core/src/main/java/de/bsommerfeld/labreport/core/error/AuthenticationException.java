package de.bsommerfeld.labreport.core.error;

/**
 * Thrown when credentials or a bearer token cannot be verified.
 */
public class AuthenticationException extends LabReportException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
