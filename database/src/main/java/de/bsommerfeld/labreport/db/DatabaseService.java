package de.bsommerfeld.labreport.db;

import de.bsommerfeld.labreport.core.domain.LabReport;
import de.bsommerfeld.labreport.core.domain.Question;
import de.bsommerfeld.labreport.core.domain.QuestionFields;
import de.bsommerfeld.labreport.core.domain.ReportFields;
import de.bsommerfeld.labreport.core.domain.Subtopic;
import de.bsommerfeld.labreport.core.domain.SubtopicFields;
import de.bsommerfeld.labreport.core.domain.User;
import de.bsommerfeld.labreport.core.error.ConstraintViolationException;
import de.bsommerfeld.labreport.core.error.NotFoundException;
import de.bsommerfeld.labreport.core.error.StoreFailureException;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for users and the report → question → subtopic
 * hierarchy. All implementations must be thread-safe: the document service
 * calls in from many request threads at once.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlDatabaseService}: production persistence via SQLite</li>
 * <li>{@link InMemoryDatabaseService}: in-memory store for TEST mode and
 * unit tests, no disk I/O</li>
 * </ul>
 *
 * <p>
 * The store enforces referential integrity on its own: inserting a child
 * whose parent is missing fails with {@link ConstraintViolationException}
 * even if the caller skipped its existence check. Any failure of the
 * underlying storage surfaces as {@link StoreFailureException}, after the
 * failed operation has been rolled back.
 */
public interface DatabaseService {

    // -- Users --

    /**
     * @throws ConstraintViolationException if the username is taken
     */
    void insertUser(User user);

    Optional<User> findUser(String username);

    // -- Reports --

    /**
     * @throws ConstraintViolationException if the id collides or
     *                                      {@code createdBy} is not a known user
     */
    void insertReport(LabReport report);

    /**
     * @throws NotFoundException if no report has this id
     */
    LabReport getReport(String reportId);

    /**
     * Returns the reports created by {@code username}, oldest first.
     */
    List<LabReport> listReports(String username);

    /**
     * Replaces number, statement and authors.
     *
     * @throws NotFoundException if no report has this id
     */
    void updateReport(String reportId, ReportFields fields);

    /**
     * Deletes the report's subtopics, then its questions, then the report,
     * as one atomic unit. Either everything is gone afterwards or nothing
     * changed.
     *
     * @throws NotFoundException if no report has this id
     */
    void deleteReportCascade(String reportId);

    // -- Questions --

    /**
     * @throws ConstraintViolationException if the id collides or the parent
     *                                      report does not exist
     */
    void insertQuestion(Question question);

    /**
     * @throws NotFoundException if no question has this id
     */
    Question getQuestion(String questionId);

    /**
     * Returns the report's questions ordered by creation time, ties in
     * insertion order. Empty if the report has none.
     */
    List<Question> listQuestions(String reportId);

    /**
     * Returns {@code true} only if the question exists and belongs to the
     * report.
     */
    boolean questionBelongsTo(String reportId, String questionId);

    /**
     * @throws NotFoundException if no question has this id
     */
    void updateQuestion(String questionId, QuestionFields fields);

    /**
     * Deletes the question and its subtopics atomically. Siblings and the
     * parent report are untouched.
     *
     * @throws NotFoundException if no question has this id
     */
    void deleteQuestion(String questionId);

    // -- Subtopics --

    /**
     * @throws ConstraintViolationException if the id collides or the parent
     *                                      question does not exist
     */
    void insertSubtopic(Subtopic subtopic);

    /**
     * @throws NotFoundException if no subtopic has this id
     */
    Subtopic getSubtopic(String subtopicId);

    List<Subtopic> listSubtopics(String questionId);

    /**
     * Returns {@code true} only if the full chain report → question →
     * subtopic exists as addressed.
     */
    boolean subtopicBelongsTo(String reportId, String questionId, String subtopicId);

    /**
     * Replaces all content fields. {@code null} optional fields are stored as
     * empty strings.
     *
     * @throws NotFoundException if no subtopic has this id
     */
    void updateSubtopic(String subtopicId, SubtopicFields fields);

    /**
     * @throws NotFoundException if no subtopic has this id
     */
    void deleteSubtopic(String subtopicId);
}
