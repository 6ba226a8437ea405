package de.bsommerfeld.labreport.core.event;

/**
 * Kinds of change broadcast on a report's topic. The event name is the wire
 * identifier seen by realtime clients.
 */
public enum ChangeType {

    REPORT_UPDATED("lab_report_updated"),
    REPORT_DELETED("lab_report_deleted"),
    QUESTION_ADDED("question_added"),
    QUESTION_UPDATED("question_updated"),
    QUESTION_DELETED("question_deleted"),
    SUBTOPIC_ADDED("subtopic_added"),
    SUBTOPIC_UPDATED("subtopic_updated"),
    SUBTOPIC_DELETED("subtopic_deleted");

    private final String eventName;

    ChangeType(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
