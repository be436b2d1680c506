package flowescrow.escrow.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    @Test
    void builderDefaults() {
        Task task = Task.builder()
                .id(1)
                .client("alice")
                .totalAmount(1_000)
                .build();

        assertEquals(TaskStatus.FUNDED, task.status());
        assertEquals(0, task.releasedAmount());
        assertEquals(1_000, task.remainingAmount());
        assertFalse(task.isTerminal());
        assertTrue(task.isClient("alice"));
        assertFalse(task.isClient("bob"));
    }

    @Test
    void toBuilderCopiesAllFields() {
        Instant created = Instant.parse("2024-01-01T00:00:00Z");
        Task task = Task.builder()
                .id(7)
                .client("alice")
                .totalAmount(1_000)
                .releasedAmount(400)
                .status(TaskStatus.IN_PROGRESS)
                .createdAt(created)
                .build();

        Task copy = task.toBuilder().build();
        assertEquals(task, copy);
        assertEquals(created, copy.createdAt());

        Task completed = task.toBuilder().status(TaskStatus.COMPLETED).build();
        assertTrue(completed.isTerminal());
        assertEquals(600, completed.remainingAmount());
        assertNotEquals(task, completed);
    }

    @Test
    void rejectsInvalidRecords() {
        assertThrows(IllegalArgumentException.class,
                () -> Task.builder().id(0).client("alice").totalAmount(10).build());
        assertThrows(IllegalArgumentException.class,
                () -> Task.builder().id(1).client("alice").totalAmount(10).releasedAmount(11).build());
        assertThrows(IllegalArgumentException.class,
                () -> Task.builder().id(1).client("alice").totalAmount(10).releasedAmount(-1).build());
        assertThrows(NullPointerException.class,
                () -> Task.builder().id(1).totalAmount(10).build());
    }

    @Test
    void statusPredicates() {
        assertTrue(TaskStatus.FUNDED.isOpen());
        assertTrue(TaskStatus.IN_PROGRESS.isOpen());
        assertFalse(TaskStatus.DISPUTED.isOpen());
        assertFalse(TaskStatus.DISPUTED.isTerminal());
        assertTrue(TaskStatus.RESOLVED.isTerminal());
        assertTrue(TaskStatus.CANCELLED.isTerminal());
        assertTrue(TaskStatus.COMPLETED.isTerminal());
    }
}
