package de.bsommerfeld.labreport.core.error;

/**
 * Root of the application's error taxonomy. All subtypes are unchecked and
 * travel unchanged from the layer that detects them up to the transport,
 * which maps each subtype to a response status.
 */
public abstract class LabReportException extends RuntimeException {

    protected LabReportException(String message) {
        super(message);
    }

    protected LabReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
