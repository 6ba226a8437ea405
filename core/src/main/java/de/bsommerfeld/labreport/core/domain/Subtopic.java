package de.bsommerfeld.labreport.core.domain;

import java.time.Instant;

/**
 * Flat row of the {@code subtopics} table. Belongs to exactly one
 * {@link Question}. All optional text columns are stored as empty strings
 * rather than {@code null}.
 *
 * @param id                opaque identifier
 * @param questionId        identifier of the owning question
 * @param title             subtopic title, required
 * @param procedures        experimental procedure text
 * @param explanation       explanation or discussion text
 * @param citations         free-form citation list
 * @param imageUrl          URL of an attached figure, empty if none
 * @param figureDescription caption for the attached figure
 * @param createdAt         creation instant, defines the order inside the
 *                          question
 */
public record Subtopic(
        String id,
        String questionId,
        String title,
        String procedures,
        String explanation,
        String citations,
        String imageUrl,
        String figureDescription,
        Instant createdAt) {

    /**
     * Creates a new subtopic row from normalized input fields.
     */
    public static Subtopic create(String id, String questionId, SubtopicFields fields, Instant createdAt) {
        SubtopicFields f = fields.normalized();
        return new Subtopic(id, questionId, f.title(), f.procedures(), f.explanation(),
                f.citations(), f.imageUrl(), f.figureDescription(), createdAt);
    }

    public Subtopic withFields(SubtopicFields fields) {
        return create(id, questionId, fields, createdAt);
    }
}
