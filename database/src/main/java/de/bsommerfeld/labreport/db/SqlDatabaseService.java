package de.bsommerfeld.labreport.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.labreport.core.config.DatabaseConfig;
import de.bsommerfeld.labreport.core.domain.LabReport;
import de.bsommerfeld.labreport.core.domain.Question;
import de.bsommerfeld.labreport.core.domain.QuestionFields;
import de.bsommerfeld.labreport.core.domain.ReportFields;
import de.bsommerfeld.labreport.core.domain.Subtopic;
import de.bsommerfeld.labreport.core.domain.SubtopicFields;
import de.bsommerfeld.labreport.core.domain.User;
import de.bsommerfeld.labreport.core.error.ConstraintViolationException;
import de.bsommerfeld.labreport.core.error.LabReportException;
import de.bsommerfeld.labreport.core.error.NotFoundException;
import de.bsommerfeld.labreport.core.error.StoreFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * SQLite-backed {@link DatabaseService} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on every startup. Every DDL
 * statement uses {@code IF NOT EXISTS}.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. Every connection is opened with foreign key enforcement switched on
 * (SQLite defaults to off) and a busy timeout, so concurrent writers wait for
 * the file lock instead of failing immediately.
 *
 * <h3>Transaction boundaries</h3>
 * Cascade deletes use explicit transactions with rollback-on-failure.
 * Single-statement writes use auto-commit.
 *
 * <h3>Error translation</h3>
 * SQLite constraint failures (result code 19, including the extended
 * foreign key and primary key variants) become
 * {@link ConstraintViolationException}. Every other {@link SQLException}
 * becomes {@link StoreFailureException}.
 *
 * @see SqlLoader
 */
@Singleton
public class SqlDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDatabaseService.class);

    private static final int SQLITE_CONSTRAINT = 19;

    private static final List<String> STATEMENTS = List.of(
            "insert-user", "select-user",
            "insert-report", "select-report", "select-reports-by-creator", "update-report", "delete-report",
            "insert-question", "select-question", "select-questions-for-report", "update-question",
            "delete-question", "delete-questions-for-report", "check-question-ancestry",
            "insert-subtopic", "select-subtopic", "select-subtopics-for-question", "update-subtopic",
            "delete-subtopic", "delete-subtopics-for-question", "delete-subtopics-for-report",
            "check-subtopic-ancestry");

    private final String dbUrl;
    private final Properties connectionProperties;

    @Inject
    public SqlDatabaseService(DatabaseConfig config) {
        this(toJdbcUrl(config.getPath()), config.getBusyTimeoutMillis());
    }

    SqlDatabaseService(String dbUrl, int busyTimeoutMillis) {
        this.dbUrl = dbUrl;
        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.enforceForeignKeys(true);
        sqliteConfig.setBusyTimeout(busyTimeoutMillis);
        this.connectionProperties = sqliteConfig.toProperties();
        initialize();
    }

    private static String toJdbcUrl(String path) {
        Path dbFile = Paths.get(path).toAbsolutePath();
        try {
            if (dbFile.getParent() != null && !Files.exists(dbFile.getParent()))
                Files.createDirectories(dbFile.getParent());
        } catch (Exception e) {
            LOG.error("Failed to create database directory {}", dbFile.getParent(), e);
        }
        return "jdbc:sqlite:" + dbFile;
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl, connectionProperties);
    }

    private void initialize() {
        LOG.info("Initializing Database at {}", dbUrl);
        LOG.debug("Preloaded {} SQL statements", SqlLoader.preload(STATEMENTS));
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new StoreFailureException("Database initialization failed", e);
        }
    }

    /**
     * Applies the full DDL from {@code schema.sql} in one transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        List<String> statements = SqlLoader.loadScript("schema.sql");
        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
            conn.commit();
            LOG.info("Database schema applied ({} statements).", statements.size());
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        }
    }

    // =====================================================================
    // Users
    // =====================================================================

    @Override
    public void insertUser(User user) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-user"))) {
            ps.setString(1, user.username());
            ps.setString(2, user.passwordHash());
            ps.setLong(3, user.createdAt().toEpochMilli());
            ps.executeUpdate();
            LOG.debug("[DB] Inserted user {}", user.username());
        } catch (SQLException e) {
            throw translate("insert user " + user.username(), e);
        }
    }

    @Override
    public Optional<User> findUser(String username) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-user"))) {
            ps.setString(1, username);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new User(rs.getString("username"), rs.getString("password_hash"),
                            Instant.ofEpochMilli(rs.getLong("created_at"))));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw translate("find user " + username, e);
        }
    }

    // =====================================================================
    // Reports
    // =====================================================================

    @Override
    public void insertReport(LabReport report) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-report"))) {
            ps.setString(1, report.id());
            ps.setString(2, report.number());
            ps.setString(3, report.statement());
            ps.setString(4, report.authors());
            ps.setString(5, report.createdBy());
            ps.setLong(6, report.createdAt().toEpochMilli());
            ps.executeUpdate();
            LOG.debug("[DB] Inserted report {}", report.id());
        } catch (SQLException e) {
            throw translate("insert report " + report.id(), e);
        }
    }

    @Override
    public LabReport getReport(String reportId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-report"))) {
            ps.setString(1, reportId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next())
                    return mapReport(rs);
            }
        } catch (SQLException e) {
            throw translate("get report " + reportId, e);
        }
        throw NotFoundException.report(reportId);
    }

    @Override
    public List<LabReport> listReports(String username) {
        List<LabReport> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-reports-by-creator"))) {
            ps.setString(1, username);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    result.add(mapReport(rs));
            }
        } catch (SQLException e) {
            throw translate("list reports of " + username, e);
        }
        return result;
    }

    @Override
    public void updateReport(String reportId, ReportFields fields) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-report"))) {
            ps.setString(1, fields.number());
            ps.setString(2, fields.statement());
            ps.setString(3, fields.authors());
            ps.setString(4, reportId);
            if (ps.executeUpdate() == 0)
                throw NotFoundException.report(reportId);
        } catch (SQLException e) {
            throw translate("update report " + reportId, e);
        }
    }

    /**
     * Removes the report's subtree in dependency order: subtopics → questions
     * → report in one transaction. A missing report rolls back and surfaces
     * as {@link NotFoundException}.
     */
    @Override
    public void deleteReportCascade(String reportId) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                int subtopics = executeUpdate(conn, "delete-subtopics-for-report", reportId);
                int questions = executeUpdate(conn, "delete-questions-for-report", reportId);
                int reports = executeUpdate(conn, "delete-report", reportId);
                if (reports == 0)
                    throw NotFoundException.report(reportId);
                conn.commit();
                LOG.info("[DB] Deleted report {} with {} questions and {} subtopics.",
                        reportId, questions, subtopics);
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw translate("delete report " + reportId, e);
        }
    }

    // =====================================================================
    // Questions
    // =====================================================================

    @Override
    public void insertQuestion(Question question) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-question"))) {
            ps.setString(1, question.id());
            ps.setString(2, question.reportId());
            ps.setString(3, question.number());
            ps.setString(4, question.statement());
            ps.setLong(5, question.createdAt().toEpochMilli());
            ps.executeUpdate();
            LOG.debug("[DB] Inserted question {} into report {}", question.id(), question.reportId());
        } catch (SQLException e) {
            throw translate("insert question " + question.id(), e);
        }
    }

    @Override
    public Question getQuestion(String questionId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-question"))) {
            ps.setString(1, questionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next())
                    return mapQuestion(rs);
            }
        } catch (SQLException e) {
            throw translate("get question " + questionId, e);
        }
        throw NotFoundException.question(questionId);
    }

    @Override
    public List<Question> listQuestions(String reportId) {
        List<Question> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-questions-for-report"))) {
            ps.setString(1, reportId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    result.add(mapQuestion(rs));
            }
        } catch (SQLException e) {
            throw translate("list questions of " + reportId, e);
        }
        return result;
    }

    @Override
    public boolean questionBelongsTo(String reportId, String questionId) {
        return exists("check-question-ancestry", questionId, reportId);
    }

    @Override
    public void updateQuestion(String questionId, QuestionFields fields) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-question"))) {
            ps.setString(1, fields.number());
            ps.setString(2, fields.statement());
            ps.setString(3, questionId);
            if (ps.executeUpdate() == 0)
                throw NotFoundException.question(questionId);
        } catch (SQLException e) {
            throw translate("update question " + questionId, e);
        }
    }

    @Override
    public void deleteQuestion(String questionId) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                int subtopics = executeUpdate(conn, "delete-subtopics-for-question", questionId);
                if (executeUpdate(conn, "delete-question", questionId) == 0)
                    throw NotFoundException.question(questionId);
                conn.commit();
                LOG.debug("[DB] Deleted question {} with {} subtopics.", questionId, subtopics);
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw translate("delete question " + questionId, e);
        }
    }

    // =====================================================================
    // Subtopics
    // =====================================================================

    @Override
    public void insertSubtopic(Subtopic subtopic) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-subtopic"))) {
            ps.setString(1, subtopic.id());
            ps.setString(2, subtopic.questionId());
            ps.setString(3, subtopic.title());
            ps.setString(4, subtopic.procedures());
            ps.setString(5, subtopic.explanation());
            ps.setString(6, subtopic.citations());
            ps.setString(7, subtopic.imageUrl());
            ps.setString(8, subtopic.figureDescription());
            ps.setLong(9, subtopic.createdAt().toEpochMilli());
            ps.executeUpdate();
            LOG.debug("[DB] Inserted subtopic {} into question {}", subtopic.id(), subtopic.questionId());
        } catch (SQLException e) {
            throw translate("insert subtopic " + subtopic.id(), e);
        }
    }

    @Override
    public Subtopic getSubtopic(String subtopicId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-subtopic"))) {
            ps.setString(1, subtopicId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next())
                    return mapSubtopic(rs);
            }
        } catch (SQLException e) {
            throw translate("get subtopic " + subtopicId, e);
        }
        throw NotFoundException.subtopic(subtopicId);
    }

    @Override
    public List<Subtopic> listSubtopics(String questionId) {
        List<Subtopic> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-subtopics-for-question"))) {
            ps.setString(1, questionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    result.add(mapSubtopic(rs));
            }
        } catch (SQLException e) {
            throw translate("list subtopics of " + questionId, e);
        }
        return result;
    }

    @Override
    public boolean subtopicBelongsTo(String reportId, String questionId, String subtopicId) {
        return exists("check-subtopic-ancestry", subtopicId, questionId, reportId);
    }

    @Override
    public void updateSubtopic(String subtopicId, SubtopicFields fields) {
        SubtopicFields f = fields.normalized();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-subtopic"))) {
            ps.setString(1, f.title());
            ps.setString(2, f.procedures());
            ps.setString(3, f.explanation());
            ps.setString(4, f.citations());
            ps.setString(5, f.imageUrl());
            ps.setString(6, f.figureDescription());
            ps.setString(7, subtopicId);
            if (ps.executeUpdate() == 0)
                throw NotFoundException.subtopic(subtopicId);
        } catch (SQLException e) {
            throw translate("update subtopic " + subtopicId, e);
        }
    }

    @Override
    public void deleteSubtopic(String subtopicId) {
        try (Connection conn = getConnection()) {
            if (executeUpdate(conn, "delete-subtopic", subtopicId) == 0)
                throw NotFoundException.subtopic(subtopicId);
        } catch (SQLException e) {
            throw translate("delete subtopic " + subtopicId, e);
        }
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private int executeUpdate(Connection conn, String statement, String id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(statement))) {
            ps.setString(1, id);
            return ps.executeUpdate();
        }
    }

    private boolean exists(String statement, String... params) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load(statement))) {
            for (int i = 0; i < params.length; i++)
                ps.setString(i + 1, params[i]);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw translate(statement, e);
        }
    }

    private void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private LabReportException translate(String action, SQLException e) {
        // extended result codes keep the primary code in the low byte
        if ((e.getErrorCode() & 0xFF) == SQLITE_CONSTRAINT) {
            LOG.debug("Constraint violation during {}: {}", action, e.getMessage());
            return new ConstraintViolationException("Constraint violation during " + action, e);
        }
        LOG.error("Store failure during {}", action, e);
        return new StoreFailureException("Store failure during " + action, e);
    }

    // =====================================================================
    // ResultSet → Domain Mapping
    // =====================================================================

    private LabReport mapReport(ResultSet rs) throws SQLException {
        return new LabReport(
                rs.getString("id"), rs.getString("number"),
                rs.getString("statement"), rs.getString("authors"),
                rs.getString("created_by"), Instant.ofEpochMilli(rs.getLong("created_at")));
    }

    private Question mapQuestion(ResultSet rs) throws SQLException {
        return new Question(
                rs.getString("id"), rs.getString("lab_report_id"),
                rs.getString("number"), rs.getString("statement"),
                Instant.ofEpochMilli(rs.getLong("created_at")));
    }

    private Subtopic mapSubtopic(ResultSet rs) throws SQLException {
        return new Subtopic(
                rs.getString("id"), rs.getString("question_id"),
                rs.getString("title"), rs.getString("procedures"),
                rs.getString("explanation"), rs.getString("citations"),
                rs.getString("image_url"), rs.getString("figure_description"),
                Instant.ofEpochMilli(rs.getLong("created_at")));
    }
}
