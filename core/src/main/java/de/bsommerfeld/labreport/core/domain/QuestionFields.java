package de.bsommerfeld.labreport.core.domain;

/**
 * Scalar fields of a question. Both fields are required.
 */
public record QuestionFields(String number, String statement) {

    public QuestionFields validate() {
        Fields.require("number", number);
        Fields.require("statement", statement);
        return this;
    }
}
