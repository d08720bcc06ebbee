package io.skillagent.spec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.skillagent.util.Utils;
import org.junit.jupiter.api.Test;

public class TaskDeserializationTest {

    @Test
    void testTaskWithMissingHistoryAndArtifacts() throws Exception {
        String json = """
            {
                "id": "task-123",
                "contextId": "context-456",
                "status": {
                    "state": "completed"
                }
            }
            """;

        Task task = Utils.OBJECT_MAPPER.readValue(json, Task.class);

        assertNotNull(task.history(), "history should not be null");
        assertNotNull(task.artifacts(), "artifacts should not be null");
        assertTrue(task.history().isEmpty());
        assertTrue(task.artifacts().isEmpty());
        assertEquals(TaskState.COMPLETED, task.status().state());
        assertNotNull(task.status().timestamp(), "timestamp defaults to now");
    }

    @Test
    void testTaskWithExplicitNullValues() throws Exception {
        String json = """
            {
                "id": "task-123",
                "status": {
                    "state": "input-required"
                },
                "history": null,
                "artifacts": null
            }
            """;

        Task task = Utils.OBJECT_MAPPER.readValue(json, Task.class);

        assertTrue(task.history().isEmpty());
        assertTrue(task.artifacts().isEmpty());
        assertNull(task.contextId());
        assertEquals(TaskState.INPUT_REQUIRED, task.status().state());
    }

    @Test
    void testTaskWithPopulatedHistoryAndStreamingArtifact() throws Exception {
        String json = """
            {
                "id": "task-123",
                "status": {
                    "state": "working",
                    "timestamp": "2025-01-15T10:00:00Z"
                },
                "history": [
                    {
                        "role": "user",
                        "parts": [{"type": "text", "text": "hello"}],
                        "messageId": "msg-1"
                    }
                ],
                "artifacts": [
                    {
                        "parts": [{"type": "text", "text": "partial"}],
                        "index": 0,
                        "append": true,
                        "lastChunk": false
                    }
                ]
            }
            """;

        Task task = Utils.OBJECT_MAPPER.readValue(json, Task.class);

        assertEquals(1, task.history().size());
        Message message = task.history().get(0);
        assertEquals(Message.Role.USER, message.role());
        assertEquals("msg-1", message.messageId());
        TextPart part = assertInstanceOf(TextPart.class, message.parts().get(0));
        assertEquals("hello", part.text());

        Artifact artifact = task.artifacts().get(0);
        assertEquals(0, artifact.index());
        assertEquals(Boolean.TRUE, artifact.append());
        assertEquals(Boolean.FALSE, artifact.lastChunk());
        assertEquals(2025, task.status().timestamp().getYear());
    }

    @Test
    void testTaskSerializationOmitsAbsentFields() throws Exception {
        Task task = Task.builder()
                .id("task-1")
                .status(new TaskStatus(TaskState.SUBMITTED))
                .build();

        String json = Utils.toJson(task);

        assertTrue(json.contains("\"state\":\"submitted\""), json);
        assertTrue(json.contains("\"history\":[]"), json);
        assertTrue(!json.contains("contextId"), json);
        assertTrue(!json.contains("metadata"), json);
    }
}
