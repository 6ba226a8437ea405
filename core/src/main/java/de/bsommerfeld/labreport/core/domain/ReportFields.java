package de.bsommerfeld.labreport.core.domain;

import de.bsommerfeld.labreport.core.error.ValidationException;

/**
 * Scalar fields of a report as supplied by a caller for create and update.
 * All three fields are required.
 */
public record ReportFields(String number, String statement, String authors) {

    /**
     * @throws ValidationException if any field is missing or blank
     */
    public ReportFields validate() {
        Fields.require("number", number);
        Fields.require("statement", statement);
        Fields.require("authors", authors);
        return this;
    }
}
