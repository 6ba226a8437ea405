package de.bsommerfeld.labreport.core.domain;

import java.time.Instant;

/**
 * Flat row of the {@code lab_reports} table. The root of the document
 * hierarchy; its questions are loaded separately and assembled into a
 * {@link ReportDocument}.
 *
 * @param id        opaque identifier, immutable once assigned
 * @param number    report number as entered by the author (e.g. {@code "L1"})
 * @param statement problem statement of the report
 * @param authors   free-form author list
 * @param createdBy username of the user who created the report
 * @param createdAt creation instant, drives ordering in report listings
 */
public record LabReport(
        String id,
        String number,
        String statement,
        String authors,
        String createdBy,
        Instant createdAt) {

    /**
     * Returns a copy carrying the scalar fields of {@code fields}. Identity,
     * ownership and creation time are preserved.
     */
    public LabReport withFields(ReportFields fields) {
        return new LabReport(id, fields.number(), fields.statement(), fields.authors(), createdBy, createdAt);
    }
}
