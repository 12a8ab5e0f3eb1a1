package io.github.drompincen.boardpilot.gateway.controller;

import io.github.drompincen.boardpilot.runtime.NotFoundException;
import io.github.drompincen.boardpilot.runtime.agent.AgentNotAllowedInLaneException;
import io.github.drompincen.boardpilot.runtime.llm.ModelExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Maps service exceptions to {@code {"error": message}} responses.
 */
final class ApiErrors {

    private static final Logger log = LoggerFactory.getLogger(ApiErrors.class);

    private ApiErrors() {}

    static HttpStatus statusOf(RuntimeException e) {
        if (e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof AgentNotAllowedInLaneException) {
            return HttpStatus.FORBIDDEN;
        }
        if (e instanceof ModelExecutionException) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (e instanceof IllegalStateException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static ResponseEntity<Map<String, String>> toResponse(RuntimeException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", status.value(), e.getMessage(), e);
        } else {
            log.warn("Request rejected with {}: {}", status.value(), e.getMessage());
        }
        return ResponseEntity.status(status).body(Map.of("error", messageOf(e)));
    }

    static ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
