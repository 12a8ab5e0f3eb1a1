package io.github.drompincen.boardpilot.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentTypeTest {

    @Test
    void initialLanesMatchDocumentKind() {
        assertThat(DocumentType.BLUEPRINT.initialLane()).isZero();
        assertThat(DocumentType.PRD.initialLane()).isEqualTo(1);
        assertThat(DocumentType.MVP.initialLane()).isEqualTo(1);
        assertThat(DocumentType.PLAYBOOK.initialLane()).isZero();
    }

    @Test
    void namesAndFiles() {
        assertThat(DocumentType.PLAYBOOK.displayName()).isEqualTo("Agent Playbook");
        assertThat(DocumentType.PRD.reviewCardTitle()).isEqualTo("Review PRD");
        assertThat(DocumentType.BLUEPRINT.fileName()).isEqualTo("BLUEPRINT.md");
    }

    @Test
    void fromValueIsCaseInsensitiveAndStrict() {
        assertThat(DocumentType.fromValue("MVP")).isEqualTo(DocumentType.MVP);
        assertThatThrownBy(() -> DocumentType.fromValue("roadmap"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
