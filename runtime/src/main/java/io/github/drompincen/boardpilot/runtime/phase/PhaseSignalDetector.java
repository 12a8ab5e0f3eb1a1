package io.github.drompincen.boardpilot.runtime.phase;

import io.github.drompincen.boardpilot.protocol.api.PlanningPhase;

/**
 * Decides whether a model reply signals that the current planning phase is finished.
 */
public interface PhaseSignalDetector {

    boolean detectSignal(String cleanedReply, PlanningPhase currentPhase);
}
