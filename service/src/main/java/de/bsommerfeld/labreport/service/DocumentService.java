package de.bsommerfeld.labreport.service;

import com.google.common.util.concurrent.Striped;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.labreport.core.domain.LabReport;
import de.bsommerfeld.labreport.core.domain.Question;
import de.bsommerfeld.labreport.core.domain.QuestionDocument;
import de.bsommerfeld.labreport.core.domain.QuestionFields;
import de.bsommerfeld.labreport.core.domain.ReportDocument;
import de.bsommerfeld.labreport.core.domain.ReportFields;
import de.bsommerfeld.labreport.core.domain.Subtopic;
import de.bsommerfeld.labreport.core.domain.SubtopicFields;
import de.bsommerfeld.labreport.core.error.NotFoundException;
import de.bsommerfeld.labreport.core.error.ValidationException;
import de.bsommerfeld.labreport.core.event.ChangeNotifier;
import de.bsommerfeld.labreport.core.event.ChangePayloads;
import de.bsommerfeld.labreport.core.event.ChangeType;
import de.bsommerfeld.labreport.db.DatabaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Application API over the report → question → subtopic hierarchy.
 *
 * <p>
 * Every operation checks the addressed ancestor chain before anything else,
 * then validates the supplied fields, then writes. A broken chain surfaces as
 * {@link NotFoundException} even when the individual entities exist
 * elsewhere in the store.
 *
 * <h3>Ordering</h3>
 * All work on one report runs under that report's lock from a
 * {@link Striped} set: the write, the reassembly of the changed document and
 * the publish. Two mutations on the same report therefore reach subscribers
 * in the order the store applied them. Reports never wait on each other
 * unless they hash to the same stripe.
 *
 * <h3>Notifications</h3>
 * Each successful mutation publishes exactly one change on the report's
 * topic. Publishing is best-effort: a failure is logged and the mutation
 * still succeeds.
 */
@Singleton
public class DocumentService {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentService.class);

    private static final int LOCK_STRIPES = 64;

    private final DatabaseService store;
    private final ChangeNotifier notifier;
    private final Clock clock;
    private final Striped<Lock> reportLocks = Striped.lock(LOCK_STRIPES);

    @Inject
    public DocumentService(DatabaseService store, ChangeNotifier notifier, Clock clock) {
        this.store = store;
        this.notifier = notifier;
        this.clock = clock;
    }

    // =====================================================================
    // Reports
    // =====================================================================

    /**
     * Creates an empty report owned by {@code actor}. Emits no change: nobody
     * can be subscribed to a topic whose identifier has not been handed out.
     */
    public ReportDocument createReport(ReportFields fields, String actor) {
        fields.validate();
        if (actor == null || actor.isBlank())
            throw new ValidationException("Missing required field: created_by");

        LabReport report = new LabReport(newId(), fields.number(), fields.statement(), fields.authors(),
                actor, now());
        store.insertReport(report);
        LOG.info("Created lab report {} ({}) for {}", report.id(), report.number(), actor);
        return ReportDocument.of(report, List.of());
    }

    /**
     * Returns the reports created by {@code actor} as nested documents, oldest
     * first. A report deleted while the listing runs is left out.
     */
    public List<ReportDocument> listReports(String actor) {
        List<ReportDocument> documents = new ArrayList<>();
        for (LabReport report : store.listReports(actor)) {
            try {
                documents.add(getReport(report.id()));
            } catch (NotFoundException e) {
                LOG.debug("Report {} vanished during listing", report.id());
            }
        }
        return documents;
    }

    public ReportDocument getReport(String reportId) {
        return locked(reportId, () -> assemble(store.getReport(reportId)));
    }

    /**
     * Replaces the scalar fields. Questions and subtopics are untouched.
     *
     * @return the refreshed nested document
     */
    public ReportDocument updateReport(String reportId, ReportFields fields) {
        return locked(reportId, () -> {
            store.getReport(reportId);
            fields.validate();
            store.updateReport(reportId, fields);
            ReportDocument document = assemble(store.getReport(reportId));
            publish(reportId, ChangeType.REPORT_UPDATED, document);
            LOG.info("Updated lab report {}", reportId);
            return document;
        });
    }

    /**
     * Deletes the report with all questions and subtopics in one store
     * transaction.
     */
    public void deleteReport(String reportId) {
        locked(reportId, () -> {
            store.deleteReportCascade(reportId);
            publish(reportId, ChangeType.REPORT_DELETED, new ChangePayloads.ReportDeleted(reportId));
            LOG.info("Deleted lab report {}", reportId);
            return null;
        });
    }

    // =====================================================================
    // Questions
    // =====================================================================

    public QuestionDocument addQuestion(String reportId, QuestionFields fields) {
        return locked(reportId, () -> {
            store.getReport(reportId);
            fields.validate();
            Question question = new Question(newId(), reportId, fields.number(), fields.statement(), now());
            store.insertQuestion(question);
            QuestionDocument document = QuestionDocument.of(question, List.of());
            publish(reportId, ChangeType.QUESTION_ADDED, document);
            LOG.info("Added question {} to report {}", question.id(), reportId);
            return document;
        });
    }

    public QuestionDocument updateQuestion(String reportId, String questionId, QuestionFields fields) {
        return locked(reportId, () -> {
            requireQuestion(reportId, questionId);
            fields.validate();
            store.updateQuestion(questionId, fields);
            QuestionDocument document = assemble(store.getQuestion(questionId));
            publish(reportId, ChangeType.QUESTION_UPDATED, document);
            LOG.info("Updated question {} in report {}", questionId, reportId);
            return document;
        });
    }

    /**
     * Deletes the question and its subtopics. Sibling questions keep their
     * content and order.
     */
    public void deleteQuestion(String reportId, String questionId) {
        locked(reportId, () -> {
            requireQuestion(reportId, questionId);
            store.deleteQuestion(questionId);
            publish(reportId, ChangeType.QUESTION_DELETED,
                    new ChangePayloads.QuestionDeleted(reportId, questionId));
            LOG.info("Deleted question {} from report {}", questionId, reportId);
            return null;
        });
    }

    // =====================================================================
    // Subtopics
    // =====================================================================

    /**
     * Adds a subtopic. Optional fields left {@code null} are stored as empty
     * strings.
     */
    public Subtopic addSubtopic(String reportId, String questionId, SubtopicFields fields) {
        return locked(reportId, () -> {
            requireQuestion(reportId, questionId);
            fields.validate();
            Subtopic subtopic = Subtopic.create(newId(), questionId, fields, now());
            store.insertSubtopic(subtopic);
            publish(reportId, ChangeType.SUBTOPIC_ADDED, new ChangePayloads.SubtopicChanged(questionId, subtopic));
            LOG.info("Added subtopic {} to question {}", subtopic.id(), questionId);
            return subtopic;
        });
    }

    public Subtopic updateSubtopic(String reportId, String questionId, String subtopicId, SubtopicFields fields) {
        return locked(reportId, () -> {
            requireSubtopic(reportId, questionId, subtopicId);
            fields.validate();
            store.updateSubtopic(subtopicId, fields);
            Subtopic subtopic = store.getSubtopic(subtopicId);
            publish(reportId, ChangeType.SUBTOPIC_UPDATED, new ChangePayloads.SubtopicChanged(questionId, subtopic));
            LOG.info("Updated subtopic {} in question {}", subtopicId, questionId);
            return subtopic;
        });
    }

    public void deleteSubtopic(String reportId, String questionId, String subtopicId) {
        locked(reportId, () -> {
            requireSubtopic(reportId, questionId, subtopicId);
            store.deleteSubtopic(subtopicId);
            publish(reportId, ChangeType.SUBTOPIC_DELETED,
                    new ChangePayloads.SubtopicDeleted(questionId, subtopicId));
            LOG.info("Deleted subtopic {} from question {}", subtopicId, questionId);
            return null;
        });
    }

    // =====================================================================
    // Internals
    // =====================================================================

    private void requireQuestion(String reportId, String questionId) {
        store.getReport(reportId);
        if (!store.questionBelongsTo(reportId, questionId))
            throw NotFoundException.question(questionId);
    }

    private void requireSubtopic(String reportId, String questionId, String subtopicId) {
        requireQuestion(reportId, questionId);
        if (!store.subtopicBelongsTo(reportId, questionId, subtopicId))
            throw NotFoundException.subtopic(subtopicId);
    }

    private ReportDocument assemble(LabReport report) {
        List<QuestionDocument> questions = new ArrayList<>();
        for (Question question : store.listQuestions(report.id())) {
            questions.add(assemble(question));
        }
        return ReportDocument.of(report, questions);
    }

    private QuestionDocument assemble(Question question) {
        return QuestionDocument.of(question, store.listSubtopics(question.id()));
    }

    private void publish(String reportId, ChangeType type, Object payload) {
        try {
            notifier.publish(reportId, type, payload);
        } catch (RuntimeException e) {
            LOG.warn("Failed to publish {} for report {}", type.eventName(), reportId, e);
        }
    }

    private <T> T locked(String reportId, Supplier<T> action) {
        Lock lock = reportLocks.get(reportId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private String newId() {
        return UUID.randomUUID().toString();
    }

    // the store keeps millisecond precision
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
