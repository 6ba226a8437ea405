package de.bsommerfeld.labreport.core.domain;

import java.time.Instant;
import java.util.List;

/**
 * Fully nested view of a report: the report's scalar fields plus its
 * questions, each carrying its subtopics. Both lists are in creation order.
 */
public record ReportDocument(
        String id,
        String number,
        String statement,
        String authors,
        String createdBy,
        Instant createdAt,
        List<QuestionDocument> questions) {

    public ReportDocument {
        questions = List.copyOf(questions);
    }

    public static ReportDocument of(LabReport report, List<QuestionDocument> questions) {
        return new ReportDocument(report.id(), report.number(), report.statement(), report.authors(),
                report.createdBy(), report.createdAt(), questions);
    }
}
