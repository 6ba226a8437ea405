package de.bsommerfeld.labreport.db;

import com.google.inject.Singleton;
import de.bsommerfeld.labreport.core.domain.LabReport;
import de.bsommerfeld.labreport.core.domain.Question;
import de.bsommerfeld.labreport.core.domain.QuestionFields;
import de.bsommerfeld.labreport.core.domain.ReportFields;
import de.bsommerfeld.labreport.core.domain.Subtopic;
import de.bsommerfeld.labreport.core.domain.SubtopicFields;
import de.bsommerfeld.labreport.core.domain.User;
import de.bsommerfeld.labreport.core.error.ConstraintViolationException;
import de.bsommerfeld.labreport.core.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-memory {@link DatabaseService} for TEST mode and unit tests. No disk
 * I/O, nothing survives a restart. Bound by Guice when the application runs
 * in {@code TEST} mode.
 *
 * <p>
 * Mirrors the constraints of the SQLite schema so both implementations are
 * interchangeable behind the interface: unknown parents and duplicate keys
 * raise {@link ConstraintViolationException}, cascades remove the whole
 * subtree, and children come back ordered by creation time with insertion
 * order as tie-breaker (the {@code rowid} of the SQL variant).
 *
 * <p>
 * A single read/write lock guards all maps. Multi-map operations such as the
 * cascade delete therefore appear atomic to concurrent readers.
 */
@Singleton
public class InMemoryDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryDatabaseService.class);

    private final Map<String, User> users = new HashMap<>();
    private final Map<String, Row<LabReport>> reports = new HashMap<>();
    private final Map<String, Row<Question>> questions = new HashMap<>();
    private final Map<String, Row<Subtopic>> subtopics = new HashMap<>();

    private final AtomicLong sequence = new AtomicLong();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryDatabaseService() {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Database persistence is DISABLED #");
        LOG.warn("#######################################################");
    }

    /** Stored value plus its insertion sequence, the equivalent of a rowid. */
    private record Row<T>(T value, long seq) {
        Row<T> with(T newValue) {
            return new Row<>(newValue, seq);
        }
    }

    // -- Users --

    @Override
    public void insertUser(User user) {
        write(() -> {
            if (users.containsKey(user.username()))
                throw new ConstraintViolationException("Username already exists: " + user.username());
            users.put(user.username(), user);
            return null;
        });
    }

    @Override
    public Optional<User> findUser(String username) {
        return read(() -> Optional.ofNullable(users.get(username)));
    }

    // -- Reports --

    @Override
    public void insertReport(LabReport report) {
        write(() -> {
            if (reports.containsKey(report.id()))
                throw new ConstraintViolationException("Duplicate lab report id: " + report.id());
            if (!users.containsKey(report.createdBy()))
                throw new ConstraintViolationException("Unknown user: " + report.createdBy());
            reports.put(report.id(), newRow(report));
            return null;
        });
    }

    @Override
    public LabReport getReport(String reportId) {
        return read(() -> {
            Row<LabReport> row = reports.get(reportId);
            if (row == null)
                throw NotFoundException.report(reportId);
            return row.value();
        });
    }

    @Override
    public List<LabReport> listReports(String username) {
        return read(() -> ordered(reports, r -> r.createdBy().equals(username), LabReport::createdAt));
    }

    @Override
    public void updateReport(String reportId, ReportFields fields) {
        write(() -> {
            Row<LabReport> row = reports.get(reportId);
            if (row == null)
                throw NotFoundException.report(reportId);
            reports.put(reportId, row.with(row.value().withFields(fields)));
            return null;
        });
    }

    @Override
    public void deleteReportCascade(String reportId) {
        write(() -> {
            if (!reports.containsKey(reportId))
                throw NotFoundException.report(reportId);
            List<String> questionIds = questions.values().stream()
                    .map(Row::value)
                    .filter(q -> q.reportId().equals(reportId))
                    .map(Question::id)
                    .collect(Collectors.toList());
            questionIds.forEach(this::removeQuestionSubtree);
            reports.remove(reportId);
            LOG.debug("[MEM] Deleted report {} with {} questions.", reportId, questionIds.size());
            return null;
        });
    }

    // -- Questions --

    @Override
    public void insertQuestion(Question question) {
        write(() -> {
            if (questions.containsKey(question.id()))
                throw new ConstraintViolationException("Duplicate question id: " + question.id());
            if (!reports.containsKey(question.reportId()))
                throw new ConstraintViolationException("Unknown lab report: " + question.reportId());
            questions.put(question.id(), newRow(question));
            return null;
        });
    }

    @Override
    public Question getQuestion(String questionId) {
        return read(() -> {
            Row<Question> row = questions.get(questionId);
            if (row == null)
                throw NotFoundException.question(questionId);
            return row.value();
        });
    }

    @Override
    public List<Question> listQuestions(String reportId) {
        return read(() -> ordered(questions, q -> q.reportId().equals(reportId), Question::createdAt));
    }

    @Override
    public boolean questionBelongsTo(String reportId, String questionId) {
        return read(() -> {
            Row<Question> row = questions.get(questionId);
            return row != null && row.value().reportId().equals(reportId) && reports.containsKey(reportId);
        });
    }

    @Override
    public void updateQuestion(String questionId, QuestionFields fields) {
        write(() -> {
            Row<Question> row = questions.get(questionId);
            if (row == null)
                throw NotFoundException.question(questionId);
            questions.put(questionId, row.with(row.value().withFields(fields)));
            return null;
        });
    }

    @Override
    public void deleteQuestion(String questionId) {
        write(() -> {
            if (!questions.containsKey(questionId))
                throw NotFoundException.question(questionId);
            removeQuestionSubtree(questionId);
            return null;
        });
    }

    // -- Subtopics --

    @Override
    public void insertSubtopic(Subtopic subtopic) {
        write(() -> {
            if (subtopics.containsKey(subtopic.id()))
                throw new ConstraintViolationException("Duplicate subtopic id: " + subtopic.id());
            if (!questions.containsKey(subtopic.questionId()))
                throw new ConstraintViolationException("Unknown question: " + subtopic.questionId());
            subtopics.put(subtopic.id(), newRow(subtopic));
            return null;
        });
    }

    @Override
    public Subtopic getSubtopic(String subtopicId) {
        return read(() -> {
            Row<Subtopic> row = subtopics.get(subtopicId);
            if (row == null)
                throw NotFoundException.subtopic(subtopicId);
            return row.value();
        });
    }

    @Override
    public List<Subtopic> listSubtopics(String questionId) {
        return read(() -> ordered(subtopics, s -> s.questionId().equals(questionId), Subtopic::createdAt));
    }

    @Override
    public boolean subtopicBelongsTo(String reportId, String questionId, String subtopicId) {
        return read(() -> {
            Row<Subtopic> row = subtopics.get(subtopicId);
            return row != null && row.value().questionId().equals(questionId)
                    && questionBelongsTo(reportId, questionId);
        });
    }

    @Override
    public void updateSubtopic(String subtopicId, SubtopicFields fields) {
        write(() -> {
            Row<Subtopic> row = subtopics.get(subtopicId);
            if (row == null)
                throw NotFoundException.subtopic(subtopicId);
            subtopics.put(subtopicId, row.with(row.value().withFields(fields)));
            return null;
        });
    }

    @Override
    public void deleteSubtopic(String subtopicId) {
        write(() -> {
            if (subtopics.remove(subtopicId) == null)
                throw NotFoundException.subtopic(subtopicId);
            return null;
        });
    }

    // -- Internals --

    private <T> Row<T> newRow(T value) {
        return new Row<>(value, sequence.incrementAndGet());
    }

    /** Caller must hold the write lock. */
    private void removeQuestionSubtree(String questionId) {
        subtopics.values().removeIf(row -> row.value().questionId().equals(questionId));
        questions.remove(questionId);
    }

    private static <T> List<T> ordered(Map<String, Row<T>> table,
            Predicate<T> filter,
            Function<T, Instant> createdAt) {
        return table.values().stream()
                .filter(row -> filter.test(row.value()))
                .sorted(Comparator.<Row<T>, Instant>comparing(row -> createdAt.apply(row.value()))
                        .thenComparingLong(Row::seq))
                .map(Row::value)
                .collect(Collectors.toList());
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
