package de.bsommerfeld.labreport.core.event;

import de.bsommerfeld.labreport.core.domain.Subtopic;

/**
 * Payload shapes for change events that do not carry a bare nested document.
 */
public class ChangePayloads {

    public record ReportDeleted(String reportId) {
    }

    public record QuestionDeleted(String reportId, String questionId) {
    }

    /**
     * Sent for both added and updated subtopics so that clients can locate
     * the owning question without a lookup.
     */
    public record SubtopicChanged(String questionId, Subtopic subtopic) {
    }

    public record SubtopicDeleted(String questionId, String subtopicId) {
    }
}
