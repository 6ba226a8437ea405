package de.bsommerfeld.labreport.core.domain;

/**
 * Content fields of a subtopic. Only {@code title} is required; every other
 * field falls back to the empty string when absent.
 */
public record SubtopicFields(
        String title,
        String procedures,
        String explanation,
        String citations,
        String imageUrl,
        String figureDescription) {

    public static SubtopicFields titled(String title) {
        return new SubtopicFields(title, null, null, null, null, null);
    }

    public SubtopicFields validate() {
        Fields.require("title", title);
        return this;
    }

    /**
     * Returns a copy with every {@code null} optional field replaced by
     * {@code ""}.
     */
    public SubtopicFields normalized() {
        return new SubtopicFields(title,
                Fields.orEmpty(procedures),
                Fields.orEmpty(explanation),
                Fields.orEmpty(citations),
                Fields.orEmpty(imageUrl),
                Fields.orEmpty(figureDescription));
    }
}
