package de.bsommerfeld.labreport.core.event;

import com.google.common.eventbus.DeadEvent;
import com.google.common.eventbus.Subscribe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationEventBusTest {

    private static final Instant AT = Instant.parse("2024-05-01T10:15:30Z");

    private ApplicationEventBus eventBus;
    private ChangeLog changeLog;

    @BeforeEach
    void setUp() {
        eventBus = new ApplicationEventBus();
        changeLog = new ChangeLog();
        eventBus.register(changeLog);
    }

    @Test
    void post_shouldHandChangeEventToListenerUnaltered() {
        ChangeEvent event = deleted("r1");

        eventBus.post(event);

        assertEquals(List.of(event), changeLog.changes);
    }

    @Test
    void post_shouldKeepPostingOrderAcrossTopics() {
        eventBus.post(deleted("r1"));
        eventBus.post(new ChangeEvent("r2", ChangeType.QUESTION_DELETED,
                new ChangePayloads.QuestionDeleted("r2", "q1"), AT));

        assertEquals(List.of("r1", "r2"), changeLog.topics());
        assertEquals("question_deleted", changeLog.changes.get(1).eventName());
    }

    @Test
    void unregister_shouldStopDeliveringChanges() {
        eventBus.post(deleted("r1"));
        eventBus.unregister(changeLog);
        eventBus.post(deleted("r2"));

        assertEquals(List.of("r1"), changeLog.topics());
    }

    @Test
    void post_shouldShieldPosterFromFailingListener() {
        eventBus.register(new Object() {
            @Subscribe
            public void onChange(ChangeEvent event) {
                throw new IllegalStateException("audit sink down");
            }
        });

        assertDoesNotThrow(() -> eventBus.post(deleted("r1")));
        assertEquals(1, changeLog.changes.size());
    }

    @Test
    void post_withoutMatchingListener_shouldSurfaceAsDeadEvent() {
        List<DeadEvent> dead = new ArrayList<>();
        eventBus.register(new Object() {
            @Subscribe
            public void onDead(DeadEvent event) {
                dead.add(event);
            }
        });

        eventBus.post(new ChangePayloads.ReportDeleted("r1"));

        assertEquals(1, dead.size());
        assertTrue(changeLog.changes.isEmpty());
    }

    private static ChangeEvent deleted(String reportId) {
        return new ChangeEvent(reportId, ChangeType.REPORT_DELETED, new ChangePayloads.ReportDeleted(reportId), AT);
    }

    static final class ChangeLog {

        final List<ChangeEvent> changes = new ArrayList<>();

        @Subscribe
        public void onChange(ChangeEvent event) {
            changes.add(event);
        }

        List<String> topics() {
            List<String> topics = new ArrayList<>();
            for (ChangeEvent change : changes)
                topics.add(change.topic());
            return topics;
        }
    }
}
