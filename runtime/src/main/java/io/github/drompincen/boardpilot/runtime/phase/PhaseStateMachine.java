package io.github.drompincen.boardpilot.runtime.phase;

import io.github.drompincen.boardpilot.protocol.api.PlanningPhase;
import org.springframework.stereotype.Component;

/**
 * Pure transition function over {@link PlanningPhase}. Advances at most one step per reply
 * and never persists anything; callers act on the returned {@link PhaseTransition}.
 */
@Component
public class PhaseStateMachine {

    private final PhaseSignalDetector signalDetector;

    public PhaseStateMachine(PhaseSignalDetector signalDetector) {
        this.signalDetector = signalDetector;
    }

    public PhaseTransition evaluate(PlanningPhase currentPhase, String cleanedReply) {
        PlanningPhase phase = currentPhase == null ? PlanningPhase.WELCOME : currentPhase;
        boolean complete = signalDetector.detectSignal(cleanedReply, phase);
        PlanningPhase next = complete ? phase.next().orElse(null) : null;
        return new PhaseTransition(phase, complete, next);
    }

    public String guidanceFor(PlanningPhase phase) {
        return PhaseGuidance.guidance(phase == null ? PlanningPhase.WELCOME : phase);
    }
}
