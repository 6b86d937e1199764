package io.github.drompincen.noject.persistence.document;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TaskDocumentTest {

    @Test
    void constructorDerivesKeyFromProjectAndTask() {
        TaskDocument doc = new TaskDocument("p1", 7);

        assertThat(doc.getId()).isEqualTo("p1:7");
        assertThat(doc.getProjectId()).isEqualTo("p1");
        assertThat(doc.getTaskId()).isEqualTo(7);
    }

    @Test
    void sameTaskIdInDifferentProjectsGivesDifferentKeys() {
        assertThat(TaskDocument.key("p1", 1)).isNotEqualTo(TaskDocument.key("p2", 1));
    }

    @Test
    void newTaskDefaultsToEmptyIncompleteTopLevelTail() {
        TaskDocument doc = new TaskDocument("p1", 1);

        assertThat(doc.getValue()).isEmpty();
        assertThat(doc.getLevel()).isZero();
        assertThat(doc.getNext()).isNull();
        assertThat(doc.isCompleted()).isFalse();
        assertThat(doc.getCompletedBy()).isNull();
    }

    @Test
    void taskFieldsPreserved() {
        TaskDocument doc = new TaskDocument("p1", 2);
        Instant now = Instant.now();

        doc.setLevel(1);
        doc.setValue("write tests");
        doc.setNext(3);
        doc.setCompleted(true);
        doc.setCreatedBy("u1");
        doc.setCompletedBy("u2");
        doc.setCreatedAt(now);
        doc.setLastModifiedAt(now.plusSeconds(5));

        assertThat(doc.getLevel()).isEqualTo(1);
        assertThat(doc.getValue()).isEqualTo("write tests");
        assertThat(doc.getNext()).isEqualTo(3);
        assertThat(doc.isCompleted()).isTrue();
        assertThat(doc.getCreatedBy()).isEqualTo("u1");
        assertThat(doc.getCompletedBy()).isEqualTo("u2");
        assertThat(doc.getLastModifiedAt()).isAfter(doc.getCreatedAt());
    }
}
