package paytask.gateway.api.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import paytask.gateway.model.TaskPatch;
import paytask.gateway.model.TaskPatch.DueDateChange;
import org.junit.jupiter.api.*;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class UpdateTaskRequestTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static TaskPatch parse(String json) throws Exception {
        return UpdateTaskRequest.toPatch(MAPPER.readTree(json));
    }

    @Test
    void emptyObjectIsEmptyPatch() throws Exception {
        assertTrue(parse("{}").isEmpty());
        assertTrue(UpdateTaskRequest.toPatch(null).isEmpty());
    }

    @Test
    void absentDueDateIsUnchanged() throws Exception {
        TaskPatch patch = parse("{\"name\":\"new\"}");

        assertEquals("new", patch.name().orElseThrow());
        assertTrue(patch.description().isEmpty());
        assertEquals(DueDateChange.UNCHANGED, patch.dueDateChange());
    }

    @Test
    void nullDueDateClears() throws Exception {
        assertEquals(DueDateChange.CLEAR, parse("{\"dueDate\":null}").dueDateChange());
    }

    @Test
    void isoDueDateSets() throws Exception {
        TaskPatch patch = parse("{\"dueDate\":\"2026-12-01T00:00:00Z\"}");

        assertEquals(DueDateChange.SET, patch.dueDateChange());
        assertEquals(Instant.parse("2026-12-01T00:00:00Z"), patch.newDueDate());
    }

    @Test
    void epochMillisDueDateSets() throws Exception {
        TaskPatch patch = parse("{\"dueDate\":1000}");
        assertEquals(Instant.ofEpochMilli(1000), patch.newDueDate());
    }

    @Test
    void nullNameIsIgnored() throws Exception {
        assertTrue(parse("{\"name\":null}").isEmpty());
    }

    @Test
    void rejectsBadValues() {
        assertThrows(IllegalArgumentException.class, () -> parse("{\"dueDate\":\"tomorrow\"}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"dueDate\":true}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"name\":\"\"}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"description\":5}"));
        assertThrows(IllegalArgumentException.class, () -> parse("[1,2]"));
    }
}
