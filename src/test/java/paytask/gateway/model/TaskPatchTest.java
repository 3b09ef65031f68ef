package paytask.gateway.model;

import paytask.gateway.model.TaskPatch.DueDateChange;
import org.junit.jupiter.api.*;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskPatchTest {

    @Test
    void emptyPatch() {
        TaskPatch patch = TaskPatch.empty();
        assertTrue(patch.isEmpty());
        assertTrue(patch.name().isEmpty());
        assertTrue(patch.description().isEmpty());
        assertEquals(DueDateChange.UNCHANGED, patch.dueDateChange());
    }

    @Test
    void clearingIsNotEmpty() {
        TaskPatch patch = TaskPatch.empty().clearingDueDate();
        assertFalse(patch.isEmpty());
        assertEquals(DueDateChange.CLEAR, patch.dueDateChange());
    }

    @Test
    void settingDueDate() {
        Instant due = Instant.parse("2026-03-01T12:00:00Z");
        TaskPatch patch = TaskPatch.empty().withDueDate(due);
        assertEquals(DueDateChange.SET, patch.dueDateChange());
        assertEquals(due, patch.newDueDate());
    }

    @Test
    void patchesAreImmutable() {
        TaskPatch base = TaskPatch.empty();
        TaskPatch named = base.withName("x");

        assertTrue(base.isEmpty());
        assertEquals("x", named.name().orElseThrow());
    }
}
