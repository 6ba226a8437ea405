package de.bsommerfeld.labreport.core.error;

/**
 * Thrown by the store when a write would break referential integrity or
 * collide with an existing key.
 */
public class ConstraintViolationException extends LabReportException {

    public ConstraintViolationException(String message) {
        super(message);
    }

    public ConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
