package com.example.guardshift.schedule;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RotationQueueTest {

    @Test
    void newQueue_keepsInputOrder() {
        RotationQueue queue = new RotationQueue(List.of("Alice", "Bob", "Charlie"));

        assertThat(queue.snapshot()).containsExactly("Alice", "Bob", "Charlie");
        assertThat(queue.size()).isEqualTo(3);
    }

    @Test
    void peekFrom_doesNotMutate() {
        RotationQueue queue = new RotationQueue(List.of("Alice", "Bob", "Charlie"));

        assertThat(queue.peekFrom(0)).isEqualTo("Alice");
        assertThat(queue.peekFrom(2)).isEqualTo("Charlie");
        assertThat(queue.peekFrom(1)).isEqualTo("Bob");
        assertThat(queue.snapshot()).containsExactly("Alice", "Bob", "Charlie");
    }

    @Test
    void commit_movesGuardToTailFromAnyPosition() {
        RotationQueue queue = new RotationQueue(List.of("Alice", "Bob", "Charlie", "David"));

        queue.commit("Alice");
        assertThat(queue.snapshot()).containsExactly("Bob", "Charlie", "David", "Alice");

        queue.commit("Charlie");
        assertThat(queue.snapshot()).containsExactly("Bob", "David", "Alice", "Charlie");

        queue.commit("Charlie");
        assertThat(queue.snapshot()).containsExactly("Bob", "David", "Alice", "Charlie");
    }

    @Test
    void commit_neverDropsOrDuplicatesGuards() {
        List<String> roster = List.of("G1", "G2", "G3", "G4", "G5");
        RotationQueue queue = new RotationQueue(roster);

        for (int i = 0; i < 50; i++) {
            queue.commit(queue.peekFrom((i * 3) % queue.size()));
            assertThat(queue.size()).isEqualTo(roster.size());
            assertThat(queue.snapshot()).containsExactlyInAnyOrderElementsOf(roster);
        }
    }

    @Test
    void commit_rejectsGuardOutsideRotation() {
        RotationQueue queue = new RotationQueue(List.of("Alice"));

        assertThatThrownBy(() -> queue.commit("Mallory")).isInstanceOf(IllegalStateException.class);
        assertThat(queue.snapshot()).containsExactly("Alice");
    }

    @Test
    void constructorAndPeek_rejectInvalidInput() {
        assertThatThrownBy(() -> new RotationQueue(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RotationQueue(List.of("A", "A"))).isInstanceOf(IllegalArgumentException.class);

        RotationQueue queue = new RotationQueue(List.of("A", "B"));
        assertThatThrownBy(() -> queue.peekFrom(2)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> queue.peekFrom(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void snapshot_isReadOnly() {
        RotationQueue queue = new RotationQueue(List.of("A", "B"));

        assertThatThrownBy(() -> queue.snapshot().add("C")).isInstanceOf(UnsupportedOperationException.class);
    }
}
