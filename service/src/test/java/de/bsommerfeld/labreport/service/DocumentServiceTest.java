package de.bsommerfeld.labreport.service;

import de.bsommerfeld.labreport.core.domain.QuestionDocument;
import de.bsommerfeld.labreport.core.domain.QuestionFields;
import de.bsommerfeld.labreport.core.domain.ReportDocument;
import de.bsommerfeld.labreport.core.domain.ReportFields;
import de.bsommerfeld.labreport.core.domain.Subtopic;
import de.bsommerfeld.labreport.core.domain.SubtopicFields;
import de.bsommerfeld.labreport.core.domain.User;
import de.bsommerfeld.labreport.core.error.NotFoundException;
import de.bsommerfeld.labreport.core.error.ValidationException;
import de.bsommerfeld.labreport.core.event.ChangeNotifier;
import de.bsommerfeld.labreport.core.event.ChangePayloads;
import de.bsommerfeld.labreport.core.event.ChangeType;
import de.bsommerfeld.labreport.db.DatabaseService;
import de.bsommerfeld.labreport.db.InMemoryDatabaseService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests the document service against the in-memory store. The notifier is
 * mocked so every published change can be verified.
 */
@ExtendWith(MockitoExtension.class)
class DocumentServiceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private ChangeNotifier notifier;

    private DatabaseService store;
    private SteppingClock clock;
    private DocumentService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryDatabaseService();
        store.insertUser(new User("alice", "hash", T0));
        clock = new SteppingClock(T0);
        service = new DocumentService(store, notifier, clock);
    }

    // -- End-to-end scenario --

    @Test
    void scenario_createAddNestAndCascadeDelete() {
        ReportDocument report = service.createReport(new ReportFields("L1", "S", "A"), "alice");
        QuestionDocument question = service.addQuestion(report.id(), new QuestionFields("Q1", "..."));
        Subtopic subtopic = service.addSubtopic(report.id(), question.id(), SubtopicFields.titled("T1"));

        ReportDocument loaded = service.getReport(report.id());
        assertEquals(1, loaded.questions().size());
        assertEquals(1, loaded.questions().get(0).subtopics().size());
        assertEquals("T1", loaded.questions().get(0).subtopics().get(0).title());

        service.deleteReport(report.id());

        assertThrows(NotFoundException.class, () -> service.getReport(report.id()));
        assertThrows(NotFoundException.class, () -> store.getQuestion(question.id()));
        assertThrows(NotFoundException.class, () -> store.getSubtopic(subtopic.id()));
    }

    // -- Reports --

    @Test
    void createReport_shouldReturnEmptyDocumentOwnedByActor() {
        ReportDocument report = service.createReport(new ReportFields("L1", "S", "A"), "alice");

        assertNotNull(report.id());
        assertEquals("alice", report.createdBy());
        assertEquals(T0, report.createdAt());
        assertTrue(report.questions().isEmpty());
        verifyNoInteractions(notifier);
    }

    @Test
    void createReport_shouldRejectMissingField() {
        assertThrows(ValidationException.class,
                () -> service.createReport(new ReportFields("L1", null, "A"), "alice"));
        assertTrue(store.listReports("alice").isEmpty());
    }

    @Test
    void createReport_shouldRejectMissingActor() {
        assertThrows(ValidationException.class,
                () -> service.createReport(new ReportFields("L1", "S", "A"), " "));
    }

    @Test
    void getReport_shouldBeIdempotent() {
        String reportId = populatedReport();

        assertEquals(service.getReport(reportId), service.getReport(reportId));
    }

    @Test
    void getReport_shouldThrowForUnknownId() {
        assertThrows(NotFoundException.class, () -> service.getReport("missing"));
    }

    @Test
    void listReports_shouldReturnNestedDocumentsOfActor() {
        String first = populatedReport();
        String second = service.createReport(new ReportFields("L2", "S", "A"), "alice").id();

        List<ReportDocument> reports = service.listReports("alice");

        assertEquals(List.of(first, second), reports.stream().map(ReportDocument::id).collect(Collectors.toList()));
        assertEquals(2, reports.get(0).questions().size());
        assertTrue(service.listReports("bob").isEmpty());
    }

    @Test
    void updateReport_shouldKeepQuestionsAndPublishFullDocument() {
        String reportId = populatedReport();

        ReportDocument updated = service.updateReport(reportId, new ReportFields("L9", "New", "B"));

        assertEquals("L9", updated.number());
        assertEquals(2, updated.questions().size());
        verify(notifier).publish(reportId, ChangeType.REPORT_UPDATED, updated);
    }

    @Test
    void updateReport_shouldCheckExistenceBeforeFields() {
        assertThrows(NotFoundException.class,
                () -> service.updateReport("missing", new ReportFields(null, null, null)));
    }

    @Test
    void deleteReport_shouldPublishIdentifierOnly() {
        String reportId = service.createReport(new ReportFields("L1", "S", "A"), "alice").id();

        service.deleteReport(reportId);

        verify(notifier).publish(reportId, ChangeType.REPORT_DELETED, new ChangePayloads.ReportDeleted(reportId));
    }

    @Test
    void deleteReport_shouldThrowForUnknownIdWithoutPublishing() {
        assertThrows(NotFoundException.class, () -> service.deleteReport("missing"));
        verifyNoInteractions(notifier);
    }

    // -- Questions --

    @Test
    void addQuestion_shouldAppendAfterExistingQuestions() {
        String reportId = service.createReport(new ReportFields("L1", "S", "A"), "alice").id();
        QuestionDocument q1 = service.addQuestion(reportId, new QuestionFields("Q1", "a"));
        QuestionDocument q2 = service.addQuestion(reportId, new QuestionFields("Q2", "b"));

        List<QuestionDocument> questions = service.getReport(reportId).questions();

        assertEquals(List.of(q1.id(), q2.id()),
                questions.stream().map(QuestionDocument::id).collect(Collectors.toList()));
        assertTrue(questions.get(1).subtopics().isEmpty());
        verify(notifier).publish(reportId, ChangeType.QUESTION_ADDED, q2);
    }

    @Test
    void addQuestion_shouldKeepInsertionOrderWithinSameMillisecond() {
        clock.step(Duration.ZERO);
        String reportId = service.createReport(new ReportFields("L1", "S", "A"), "alice").id();
        String a = service.addQuestion(reportId, new QuestionFields("Q1", "a")).id();
        String b = service.addQuestion(reportId, new QuestionFields("Q2", "b")).id();
        String c = service.addQuestion(reportId, new QuestionFields("Q3", "c")).id();

        List<String> ids = service.getReport(reportId).questions().stream()
                .map(QuestionDocument::id).collect(Collectors.toList());
        assertEquals(List.of(a, b, c), ids);
    }

    @Test
    void addQuestion_shouldThrowForUnknownReport() {
        assertThrows(NotFoundException.class,
                () -> service.addQuestion("missing", new QuestionFields("Q1", "a")));
        verifyNoInteractions(notifier);
    }

    @Test
    void addQuestion_shouldRejectMissingStatement() {
        String reportId = service.createReport(new ReportFields("L1", "S", "A"), "alice").id();
        assertThrows(ValidationException.class,
                () -> service.addQuestion(reportId, new QuestionFields("Q1", "")));
    }

    @Test
    void updateQuestion_shouldRejectQuestionOfAnotherReport() {
        String reportId = populatedReport();
        String otherReport = service.createReport(new ReportFields("L2", "S", "A"), "alice").id();
        String questionId = service.getReport(reportId).questions().get(0).id();

        assertThrows(NotFoundException.class,
                () -> service.updateQuestion(otherReport, questionId, new QuestionFields("Q", "x")));
    }

    @Test
    void updateQuestion_shouldReturnDocumentWithSubtopics() {
        String reportId = populatedReport();
        String questionId = service.getReport(reportId).questions().get(0).id();

        QuestionDocument updated = service.updateQuestion(reportId, questionId, new QuestionFields("Q7", "x"));

        assertEquals("Q7", updated.number());
        assertEquals(1, updated.subtopics().size());
        verify(notifier).publish(reportId, ChangeType.QUESTION_UPDATED, updated);
    }

    @Test
    void deleteQuestion_shouldLeaveSiblingsUntouched() {
        String reportId = populatedReport();
        List<QuestionDocument> before = service.getReport(reportId).questions();

        service.deleteQuestion(reportId, before.get(0).id());

        List<QuestionDocument> after = service.getReport(reportId).questions();
        assertEquals(List.of(before.get(1)), after);
        verify(notifier).publish(reportId, ChangeType.QUESTION_DELETED,
                new ChangePayloads.QuestionDeleted(reportId, before.get(0).id()));
    }

    // -- Subtopics --

    @Test
    void addSubtopic_shouldDefaultOptionalFieldsToEmptyString() {
        String reportId = service.createReport(new ReportFields("L1", "S", "A"), "alice").id();
        String questionId = service.addQuestion(reportId, new QuestionFields("Q1", "a")).id();

        Subtopic subtopic = service.addSubtopic(reportId, questionId, SubtopicFields.titled("T1"));

        assertEquals("", subtopic.procedures());
        assertEquals("", subtopic.citations());
        assertEquals("", subtopic.figureDescription());
        verify(notifier).publish(reportId, ChangeType.SUBTOPIC_ADDED,
                new ChangePayloads.SubtopicChanged(questionId, subtopic));
    }

    @Test
    void addSubtopic_shouldRejectMissingTitle() {
        String reportId = service.createReport(new ReportFields("L1", "S", "A"), "alice").id();
        String questionId = service.addQuestion(reportId, new QuestionFields("Q1", "a")).id();

        assertThrows(ValidationException.class,
                () -> service.addSubtopic(reportId, questionId, SubtopicFields.titled(null)));
    }

    @Test
    void updateSubtopic_shouldRejectMismatchedQuestionEvenIfBothExist() {
        String reportId = populatedReport();
        List<QuestionDocument> questions = service.getReport(reportId).questions();
        String subtopicId = questions.get(0).subtopics().get(0).id();
        String wrongQuestion = questions.get(1).id();

        assertThrows(NotFoundException.class,
                () -> service.updateSubtopic(reportId, wrongQuestion, subtopicId, SubtopicFields.titled("x")));
        verify(notifier, never()).publish(anyString(), eq(ChangeType.SUBTOPIC_UPDATED), any());
    }

    @Test
    void updateSubtopic_shouldRejectMismatchedReport() {
        String reportId = populatedReport();
        String otherReport = service.createReport(new ReportFields("L2", "S", "A"), "alice").id();
        QuestionDocument question = service.getReport(reportId).questions().get(0);
        String subtopicId = question.subtopics().get(0).id();

        assertThrows(NotFoundException.class,
                () -> service.updateSubtopic(otherReport, question.id(), subtopicId, SubtopicFields.titled("x")));
    }

    @Test
    void updateSubtopic_shouldReplaceContent() {
        String reportId = populatedReport();
        QuestionDocument question = service.getReport(reportId).questions().get(0);
        String subtopicId = question.subtopics().get(0).id();

        Subtopic updated = service.updateSubtopic(reportId, question.id(), subtopicId,
                new SubtopicFields("New", "p", "e", "c", "http://img", "f"));

        assertEquals("New", updated.title());
        assertEquals("http://img", updated.imageUrl());
        assertEquals(updated, service.getReport(reportId).questions().get(0).subtopics().get(0));
    }

    @Test
    void deleteSubtopic_shouldPublishQuestionAndSubtopicIds() {
        String reportId = populatedReport();
        QuestionDocument question = service.getReport(reportId).questions().get(0);
        String subtopicId = question.subtopics().get(0).id();

        service.deleteSubtopic(reportId, question.id(), subtopicId);

        assertTrue(service.getReport(reportId).questions().get(0).subtopics().isEmpty());
        verify(notifier).publish(reportId, ChangeType.SUBTOPIC_DELETED,
                new ChangePayloads.SubtopicDeleted(question.id(), subtopicId));
    }

    // -- Notifications --

    @Test
    void everyMutation_shouldPublishExactlyOneEventInOrder() {
        String reportId = service.createReport(new ReportFields("L1", "S", "A"), "alice").id();
        String questionId = service.addQuestion(reportId, new QuestionFields("Q1", "a")).id();
        String subtopicId = service.addSubtopic(reportId, questionId, SubtopicFields.titled("T")).id();
        service.updateSubtopic(reportId, questionId, subtopicId, SubtopicFields.titled("T2"));
        service.updateReport(reportId, new ReportFields("L2", "S", "A"));
        service.deleteReport(reportId);

        InOrder inOrder = inOrder(notifier);
        inOrder.verify(notifier).publish(eq(reportId), eq(ChangeType.QUESTION_ADDED), any());
        inOrder.verify(notifier).publish(eq(reportId), eq(ChangeType.SUBTOPIC_ADDED), any());
        inOrder.verify(notifier).publish(eq(reportId), eq(ChangeType.SUBTOPIC_UPDATED), any());
        inOrder.verify(notifier).publish(eq(reportId), eq(ChangeType.REPORT_UPDATED), any());
        inOrder.verify(notifier).publish(eq(reportId), eq(ChangeType.REPORT_DELETED), any());
        verifyNoMoreInteractions(notifier);
    }

    @Test
    void publishFailure_shouldNotFailTheMutation() {
        String reportId = service.createReport(new ReportFields("L1", "S", "A"), "alice").id();
        doThrow(new IllegalStateException("transport down"))
                .when(notifier).publish(eq(reportId), any(), any());

        QuestionDocument question = service.addQuestion(reportId, new QuestionFields("Q1", "a"));

        assertEquals(question, service.getReport(reportId).questions().get(0));
    }

    // -- Fixtures --

    /** Report with two questions; the first one has a subtopic. */
    private String populatedReport() {
        String reportId = service.createReport(new ReportFields("L1", "S", "A"), "alice").id();
        String q1 = service.addQuestion(reportId, new QuestionFields("Q1", "first")).id();
        service.addQuestion(reportId, new QuestionFields("Q2", "second"));
        service.addSubtopic(reportId, q1, SubtopicFields.titled("Setup"));
        return reportId;
    }

    /** Clock that advances by a fixed step on every read. */
    private static final class SteppingClock extends Clock {

        private Instant current;
        private Duration step = Duration.ofMillis(1);
        private boolean started;

        SteppingClock(Instant start) {
            this.current = start;
        }

        void step(Duration step) {
            this.step = step;
        }

        @Override
        public synchronized Instant instant() {
            if (started)
                current = current.plus(step);
            started = true;
            return current;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
