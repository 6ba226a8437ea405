package de.bsommerfeld.labreport.core.domain;

import java.time.Instant;

/**
 * Flat row of the {@code questions} table. Belongs to exactly one
 * {@link LabReport}.
 *
 * @param id        opaque identifier
 * @param reportId  identifier of the owning report
 * @param number    question number within the report (e.g. {@code "Q1"})
 * @param statement question text
 * @param createdAt creation instant, defines the order inside the report
 */
public record Question(
        String id,
        String reportId,
        String number,
        String statement,
        Instant createdAt) {

    public Question withFields(QuestionFields fields) {
        return new Question(id, reportId, fields.number(), fields.statement(), createdAt);
    }
}
