package io.github.drompincen.boardpilot.runtime.phase;

import io.github.drompincen.boardpilot.protocol.api.PlanningPhase;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Substring match of the lower-cased reply against the current phase's triggers and the
 * generic transition phrases. The terminal phase still signals; it just has nowhere to go.
 */
@Component
public class KeywordPhaseSignalDetector implements PhaseSignalDetector {

    @Override
    public boolean detectSignal(String cleanedReply, PlanningPhase currentPhase) {
        if (cleanedReply == null || currentPhase == null || !currentPhase.isSequential()) {
            return false;
        }
        String lower = cleanedReply.toLowerCase(Locale.ROOT).replace('’', '\'');
        if (PhaseGuidance.triggers(currentPhase).stream().anyMatch(lower::contains)) {
            return true;
        }
        return PhaseGuidance.GENERIC_TRIGGERS.stream().anyMatch(lower::contains);
    }
}
