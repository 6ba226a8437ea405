package de.bsommerfeld.labreport.core.domain;

import java.time.Instant;
import java.util.List;

/**
 * A question together with its subtopics in creation order.
 */
public record QuestionDocument(
        String id,
        String reportId,
        String number,
        String statement,
        Instant createdAt,
        List<Subtopic> subtopics) {

    public QuestionDocument {
        subtopics = List.copyOf(subtopics);
    }

    public static QuestionDocument of(Question question, List<Subtopic> subtopics) {
        return new QuestionDocument(question.id(), question.reportId(), question.number(),
                question.statement(), question.createdAt(), subtopics);
    }
}
