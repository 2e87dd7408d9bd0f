package com.todotrail.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.todotrail.core.persistence.JsonFileStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("TodoIds")
    class TodoIdsTests {

        @Test
        @DisplayName("recognises the id format of each tier")
        void tierOf() {
            assertEquals(TodoTier.FEATURE, TodoIds.tierOf("feature-checkout").orElseThrow());
            assertEquals(TodoTier.PHASE, TodoIds.tierOf("phase-2").orElseThrow());
            assertEquals(TodoTier.SESSION, TodoIds.tierOf("session-2.1").orElseThrow());
            assertEquals(TodoTier.TASK, TodoIds.tierOf("task-2.1.3").orElseThrow());
            assertTrue(TodoIds.tierOf("phase-two").isEmpty());
            assertTrue(TodoIds.tierOf(null).isEmpty());
        }

        @Test
        @DisplayName("child ids must extend the parent's number, phases sit under any feature")
        void extendsParent() {
            assertTrue(TodoIds.extendsParent("session-2.1", "phase-2"));
            assertFalse(TodoIds.extendsParent("session-3.1", "phase-2"));
            assertFalse(TodoIds.extendsParent("session-21.1", "phase-2"));
            assertTrue(TodoIds.extendsParent("task-2.1.4", "session-2.1"));
            assertTrue(TodoIds.extendsParent("phase-7", "feature-checkout"));
        }

        @Test
        @DisplayName("phase and session numbers are derived from the id")
        void numbers() {
            assertEquals("2", TodoIds.phaseNumber("task-2.1.3").orElseThrow());
            assertEquals("2.1", TodoIds.sessionNumber("task-2.1.3").orElseThrow());
            assertTrue(TodoIds.sessionNumber("phase-2").isEmpty());
            assertTrue(TodoIds.phaseNumber("feature-checkout").isEmpty());
            assertEquals("session-4.2", TodoIds.sessionId(4, 2));
        }
    }

    @Nested
    @DisplayName("TodoField")
    class TodoFieldTests {

        private final Todo base = Todo.builder()
                .id("task-1.1.1").tier(TodoTier.TASK).parentId("session-1.1")
                .title("Add card form").status(TodoStatus.PENDING)
                .createdAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build();

        @Test
        @DisplayName("diff ignores identity and timestamps")
        void diffIgnoresIdentity() {
            Todo touched = base.toBuilder().updatedAt(Instant.now()).build();
            assertTrue(TodoField.diff(base, touched).isEmpty());
        }

        @Test
        @DisplayName("diff reports changed content fields")
        void diffReportsContent() {
            Todo changed = base.toBuilder().status(TodoStatus.BLOCKED).tags(List.of("ui")).build();
            assertEquals(Set.of(TodoField.STATUS, TodoField.TAGS), TodoField.diff(base, changed));
        }

        @Test
        @DisplayName("snapshot keeps only the requested fields, keyed by JSON name")
        void snapshot() {
            Map<String, Object> snapshot = TodoField.snapshot(base, Set.of(TodoField.PARENT_ID, TodoField.TITLE));
            assertEquals(List.of("title", "parentId"), List.copyOf(snapshot.keySet()));
            assertEquals("session-1.1", snapshot.get("parentId"));
        }

        @Test
        @DisplayName("fromName accepts JSON and constant names")
        void fromName() {
            assertEquals(TodoField.PLANNING_DOC_PATH, TodoField.fromName("planningDocPath").orElseThrow());
            assertEquals(TodoField.PLANNING_DOC_PATH, TodoField.fromName("planning_doc_path").orElseThrow());
            assertTrue(TodoField.fromName("createdAt").isEmpty());
        }
    }

    @Nested
    @DisplayName("Enums and JSON")
    class JsonTests {

        private final ObjectMapper mapper = JsonFileStore.defaultMapper();

        @Test
        @DisplayName("enums are written with their lower-case wire names")
        void enumWireNames() throws Exception {
            assertEquals("\"in_progress\"", mapper.writeValueAsString(TodoStatus.IN_PROGRESS));
            assertEquals("\"session-start\"", mapper.writeValueAsString(CitationContext.SESSION_START));
            assertEquals(ChangeType.TODO_STATUS_CHANGED, mapper.readValue("\"todo_status_changed\"", ChangeType.class));
        }

        @Test
        @DisplayName("a todo with a citation survives a JSON round trip")
        void todoRoundTrip() throws Exception {
            Citation citation = new Citation("citation-1", "change-3", CitationType.STATUS_CHANGE,
                    CitationPriority.HIGH, List.of(CitationContext.PHASE_START),
                    Instant.parse("2026-03-01T10:00:00Z"), null, null, CitationMetadata.empty(), null);
            Todo todo = Todo.builder().id("phase-2").tier(TodoTier.PHASE).parentId("feature-f")
                    .title("Payments").citations(List.of(citation)).build();

            Todo read = mapper.readValue(mapper.writeValueAsString(todo), Todo.class);

            assertEquals(todo, read);
            assertFalse(read.citations().get(0).isReviewed());
        }

        @Test
        @DisplayName("unknown wire values are rejected")
        void unknownValue() {
            assertThrows(IllegalArgumentException.class, () -> TodoStatus.fromValue("done"));
            assertThrows(IllegalArgumentException.class, () -> CitationContext.fromValue("lunch-break"));
        }
    }

    @Nested
    @DisplayName("Severity and priority ordering")
    class OrderingTests {

        @Test
        void severityOrdering() {
            assertTrue(Severity.CRITICAL.atLeast(Severity.HIGH));
            assertFalse(Severity.MEDIUM.atLeast(Severity.HIGH));
            assertTrue(Severity.LOW.atLeast(null));
        }

        @Test
        void priorityMapsToSeverity() {
            assertEquals(Severity.HIGH, CitationPriority.HIGH.asSeverity());
            assertTrue(CitationPriority.CRITICAL.score() > CitationPriority.HIGH.score());
        }

        @Test
        @DisplayName("rollback conflicts block at or above the threshold until resolved")
        void conflictBlocking() {
            var conflict = new RollbackConflict(RollbackConflictType.STATE_CONFLICT, "status", "changed",
                    Severity.HIGH, "change-4", null);
            assertTrue(conflict.blocks(Severity.HIGH));
            assertFalse(conflict.resolve("overridden").blocks(Severity.HIGH));
            assertFalse(conflict.blocks(Severity.CRITICAL));
        }
    }
}
