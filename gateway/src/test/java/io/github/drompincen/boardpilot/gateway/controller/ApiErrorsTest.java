package io.github.drompincen.boardpilot.gateway.controller;

import io.github.drompincen.boardpilot.runtime.NotFoundException;
import io.github.drompincen.boardpilot.runtime.agent.AgentNotAllowedInLaneException;
import io.github.drompincen.boardpilot.runtime.llm.ModelExecutionException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ApiErrorsTest {

    @Test
    void notFoundWinsOverIllegalArgument() {
        assertThat(ApiErrors.statusOf(new NotFoundException("Card", "c-9"))).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(ApiErrors.statusOf(new IllegalArgumentException("bad"))).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void mapsDomainFailures() {
        assertThat(ApiErrors.statusOf(new AgentNotAllowedInLaneException("qa", 0))).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(ApiErrors.statusOf(new ModelExecutionException("down"))).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(ApiErrors.statusOf(new IllegalStateException("twice"))).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ApiErrors.statusOf(new UnsupportedOperationException())).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void bodyCarriesMessageOrExceptionName() {
        ResponseEntity<Map<String, String>> withMessage = ApiErrors.toResponse(new NotFoundException("Card", "c-9"));
        assertThat(withMessage.getBody()).containsEntry("error", "Card not found: c-9");

        ResponseEntity<Map<String, String>> noMessage = ApiErrors.toResponse(new IllegalStateException());
        assertThat(noMessage.getStatusCode().value()).isEqualTo(409);
        assertThat(noMessage.getBody()).containsEntry("error", "IllegalStateException");
    }
}
