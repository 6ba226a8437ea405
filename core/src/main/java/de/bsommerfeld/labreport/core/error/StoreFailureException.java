package de.bsommerfeld.labreport.core.error;

/**
 * Thrown when the underlying storage is unavailable or a transaction was
 * aborted. A failed write has been rolled back when this surfaces.
 */
public class StoreFailureException extends LabReportException {

    public StoreFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
