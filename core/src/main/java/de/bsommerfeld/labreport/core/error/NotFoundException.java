package de.bsommerfeld.labreport.core.error;

/**
 * Thrown when an entity is missing or when the addressed ancestry
 * (report → question → subtopic) does not match the stored hierarchy.
 */
public class NotFoundException extends LabReportException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException report(String reportId) {
        return new NotFoundException("Lab report not found: " + reportId);
    }

    public static NotFoundException question(String questionId) {
        return new NotFoundException("Question not found: " + questionId);
    }

    public static NotFoundException subtopic(String subtopicId) {
        return new NotFoundException("Subtopic not found: " + subtopicId);
    }
}
