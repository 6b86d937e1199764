package io.github.drompincen.noject.persistence.document;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProjectDocumentTest {

    @Test
    void newProjectHasEmptyOutlineAndNoVersion() {
        ProjectDocument doc = new ProjectDocument();

        assertThat(doc.getFirstTask()).isNull();
        assertThat(doc.getVersion()).isNull();
    }

    @Test
    void projectFieldsPreserved() {
        ProjectDocument doc = new ProjectDocument();
        Instant now = Instant.now();

        doc.setProjectId("p1");
        doc.setName("Groceries");
        doc.setCreatedBy("u1");
        doc.setColor("#1a2b3c");
        doc.setBackgroundColor("#e5d4c3");
        doc.setFirstTask(4);
        doc.setVersion(2L);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);

        assertThat(doc.getProjectId()).isEqualTo("p1");
        assertThat(doc.getName()).isEqualTo("Groceries");
        assertThat(doc.getCreatedBy()).isEqualTo("u1");
        assertThat(doc.getColor()).isEqualTo("#1a2b3c");
        assertThat(doc.getBackgroundColor()).isEqualTo("#e5d4c3");
        assertThat(doc.getFirstTask()).isEqualTo(4);
        assertThat(doc.getVersion()).isEqualTo(2L);
    }
}
