package de.bsommerfeld.labreport.core.error;

/**
 * Thrown when a required field is missing or a request body is malformed.
 */
public class ValidationException extends LabReportException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
