package io.github.drompincen.boardpilot.runtime.phase;

import io.github.drompincen.boardpilot.protocol.api.PlanningPhase;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-phase instructions injected into the copilot prompt, and the phrases that signal
 * the model considers the phase finished.
 */
public final class PhaseGuidance {

    private static final Map<PlanningPhase, String> GUIDANCE = new EnumMap<>(PlanningPhase.class);
    private static final Map<PlanningPhase, List<String>> TRIGGERS = new EnumMap<>(PlanningPhase.class);

    public static final List<String> GENERIC_TRIGGERS = List.of(
            "move to the next phase",
            "move on to",
            "proceed to",
            "let's move to",
            "ready to move",
            "moving forward to",
            "next phase",
            "let's proceed",
            "shall we move",
            "ready to proceed",
            "on to the next");

    static {
        GUIDANCE.put(PlanningPhase.WELCOME, """
                PHASE: Welcome - Understanding the Project Idea

                Accept what the operator tells you and move forward. Do NOT keep asking what problem they are solving.

                In this phase:
                - Listen to the project idea and acknowledge it
                - Summarize what you heard in two or three sentences
                - Then say "Let's move to the Vision phase" """);
        GUIDANCE.put(PlanningPhase.VISION, """
                PHASE: Vision - Clarifying the Value Proposition

                The operator has already explained the idea. Help them state:
                - Who the target audience is
                - The key value proposition
                - What makes it different

                Do not re-ask anything already answered. After one or two exchanges, summarize and say "Let's move to Requirements".""");
        GUIDANCE.put(PlanningPhase.REQUIREMENTS, """
                PHASE: Requirements - Defining Features

                Help the operator list must-have features for launch, nice-to-have features for later,
                and technical constraints. Suggest features from what you already know about the project.
                Do not re-ask answered questions. When done, say "Let's move to Goals".""");
        GUIDANCE.put(PlanningPhase.GOALS, """
                PHASE: Goals - Success Metrics

                Help define what success looks like, the key metrics to track and the timeline.
                Propose reasonable goals for this kind of project instead of asking open questions.
                When done, say "Let's move to Roles".""");
        GUIDANCE.put(PlanningPhase.ROLES, """
                PHASE: Roles - Team & Agents

                Recommend which agents should work on this project (architect, frontend, backend, QA, ...)
                and the development pipeline across the board lanes. Be proactive and do not re-ask
                settled questions. When done, say "Let's move to Architecture".""");
        GUIDANCE.put(PlanningPhase.ARCHITECTURE, """
                PHASE: Architecture - Technical Design

                Recommend a concrete tech stack, frontend structure, backend needs and data storage.
                If the operator mentions WordPress, WooCommerce, themes, plugins or Gutenberg, recommend the
                WordPress agent and create a card for it with agent: wordpress-agent.
                Do not re-ask settled questions. When done, say "Planning is complete! Ready to generate your Blueprint, PRD, and MVP documents.\"""");
        GUIDANCE.put(PlanningPhase.BLUEPRINT_REVIEW, """
                PHASE: Blueprint Review

                The Blueprint, PRD, MVP and Agent Playbook have been generated and are waiting for review.
                Answer questions about them and apply requested changes as card actions. Do not restart planning.
                When the operator is satisfied, say "Planning complete".""");
        GUIDANCE.put(PlanningPhase.PLANNING_COMPLETE, """
                PHASE: Planning Complete

                Planning is finished. Help the operator track the work on the board and create or move cards as needed.""");
        GUIDANCE.put(PlanningPhase.GENERAL, """
                Answer the operator's questions directly. Do not force them into the planning flow unless they ask for it.""");

        TRIGGERS.put(PlanningPhase.WELCOME, List.of(
                "vision phase", "move to vision", "vision stage", "clarify the vision", "let's clarify"));
        TRIGGERS.put(PlanningPhase.VISION, List.of(
                "requirements phase", "move to requirements", "requirements stage", "define requirements",
                "list the requirements"));
        TRIGGERS.put(PlanningPhase.REQUIREMENTS, List.of(
                "goals phase", "move to goals", "goals stage", "define goals", "set goals", "success metrics"));
        TRIGGERS.put(PlanningPhase.GOALS, List.of(
                "roles phase", "move to roles", "roles stage", "identify roles", "team and agents"));
        TRIGGERS.put(PlanningPhase.ROLES, List.of(
                "architecture phase", "move to architecture", "architecture stage", "technical architecture",
                "tech stack"));
        TRIGGERS.put(PlanningPhase.ARCHITECTURE, List.of(
                "planning complete", "planning is complete", "blueprint", "ready to generate", "prd", "complete",
                "finished planning", "create the documents", "creating the documents", "generate the documents",
                "generating documents", "create the necessary documents", "let me create", "let me generate",
                "creating your documents", "generating your documents", "i'll generate", "i will generate",
                "i will create", "begin generating", "start generating", "start creating",
                "proceed with document", "create your blueprint", "finalize the planning", "finalize planning",
                "ready to finalize", "let's finalize"));
        TRIGGERS.put(PlanningPhase.BLUEPRINT_REVIEW, List.of(
                "planning complete", "planning is complete", "documents approved", "all documents approved"));
        TRIGGERS.put(PlanningPhase.PLANNING_COMPLETE, List.of());
        TRIGGERS.put(PlanningPhase.GENERAL, List.of());
    }

    private PhaseGuidance() {}

    public static String guidance(PlanningPhase phase) {
        return GUIDANCE.getOrDefault(phase, GUIDANCE.get(PlanningPhase.GENERAL));
    }

    public static List<String> triggers(PlanningPhase phase) {
        return TRIGGERS.getOrDefault(phase, List.of());
    }
}
