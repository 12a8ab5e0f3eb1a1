package io.github.drompincen.boardpilot.runtime.phase;

import io.github.drompincen.boardpilot.protocol.api.PlanningPhase;

/**
 * Result of inspecting a reply. {@code nextPhase} is null unless {@code phaseComplete}
 * and a following phase exists.
 */
public record PhaseTransition(PlanningPhase currentPhase, boolean phaseComplete, PlanningPhase nextPhase) {

    public boolean advances() {
        return phaseComplete && nextPhase != null;
    }
}
