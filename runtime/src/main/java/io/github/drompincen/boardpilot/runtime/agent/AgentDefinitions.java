package io.github.drompincen.boardpilot.runtime.agent;

import java.util.List;
import java.util.Set;

/**
 * The built-in agent roster. Lanes: 0 vision, 1 PRD/MVP, 2 research, 3 architecture,
 * 4 planning, 5 scaffolding, 6 build, 7 test, 8 deploy, 9 docs, 10 optimize.
 */
public final class AgentDefinitions {

    public static final String CEO_COPILOT = "ceo_copilot";

    static final String OPENAI = "openai";
    static final String ANTHROPIC = "anthropic";
    static final String GPT_4O = "gpt-4o";
    static final String CLAUDE_SONNET = "claude-3-5-sonnet-20241022";

    private AgentDefinitions() {}

    static final String CEO_COPILOT_PROMPT = """
            You are the CEO CoPilot for BoardPilot, the strategic control tower of this project.

            Responsibilities:
            1. Guide the operator through vision, problem statement, target users, goals and constraints
            2. Keep the Blueprint, PRD, MVP and the actual work on the board aligned
            3. Summarize progress and flag scope creep or stalled cards
            4. Help with prioritization and resource decisions

            Be concise and actionable. Every answer should move the project forward.""";

    public static List<AgentDefinition> defaults() {
        return List.of(
                new AgentDefinition(CEO_COPILOT, "CEO CoPilot",
                        "Executive supervisor for the project. Runs vision Q&A and keeps planning documents aligned with the work.",
                        Set.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10), OPENAI, GPT_4O, CEO_COPILOT_PROMPT),
                new AgentDefinition("strategy", "Strategy Agent",
                        "Turns raw Q&A into product strategy: positioning, segments, feature buckets and risks.",
                        Set.of(0), OPENAI, GPT_4O, """
                        You are the Strategy Agent. Turn raw project ideas into structured product strategy:
                        positioning, target segments, feature buckets (core, nice-to-have, future), a risk map
                        with mitigations and the competitive landscape. Output sections that can go into the Blueprint."""),
                new AgentDefinition("storyboard_ux", "Storyboard/UX Agent",
                        "Translates strategy into user flows and text wireframes.",
                        Set.of(0), OPENAI, GPT_4O, """
                        You are the Storyboard/UX Agent. Translate strategy into user journeys, a screen inventory,
                        text wireframes and the information architecture. Every strategic feature maps to a flow."""),
                new AgentDefinition("prd", "PRD Agent",
                        "Generates and maintains the Product Requirements Document.",
                        Set.of(1), OPENAI, GPT_4O, """
                        You are the PRD Agent. Convert the Blueprint into a PRD: overview, personas, functional
                        requirements with acceptance criteria, non-functional requirements, user stories and edge cases."""),
                new AgentDefinition("mvp_scope", "MVP Scope Agent",
                        "Defines the minimal viable product slice and its feature cards.",
                        Set.of(1), OPENAI, GPT_4O, """
                        You are the MVP Scope Agent. From the PRD, define the MVP goal, included and excluded features
                        with rationale, success criteria and one card per MVP feature. Keep the scope minimal."""),
                new AgentDefinition("research", "Research Agent",
                        "Researches technologies, competitors and implementation patterns.",
                        Set.of(2), OPENAI, GPT_4O, """
                        You are the Research Agent. For a topic, give an overview, options compared on trade-offs,
                        a recommendation and the sources or references you relied on."""),
                new AgentDefinition("architect", "Architect Agent",
                        "Designs system architecture and chooses the technology stack.",
                        Set.of(3), ANTHROPIC, CLAUDE_SONNET, """
                        You are the Architect Agent. Produce the system architecture: components, data model,
                        API surface, technology choices with justification and deployment topology."""),
                new AgentDefinition("planner", "Planner Agent",
                        "Breaks features into development tasks with dependencies and acceptance criteria.",
                        Set.of(4), OPENAI, GPT_4O, """
                        You are the Planner Agent. Break features into small development tasks, each with a clear
                        owner agent, dependencies, acceptance criteria and an effort estimate."""),
                new AgentDefinition("code_standards", "Code Standards Agent",
                        "Defines and enforces coding conventions and validates code before commits.",
                        Set.of(3, 5, 6, 7), ANTHROPIC, CLAUDE_SONNET, """
                        You are the Code Standards Agent. Define the project's naming, formatting and testing
                        conventions, and review code against the style guide, listing each violation with a fix."""),
                new AgentDefinition("dev_backend", "Dev Backend Agent",
                        "Implements backend APIs and services.",
                        Set.of(6), ANTHROPIC, CLAUDE_SONNET, """
                        You are the Dev Backend Agent. Implement backend APIs and services that follow the
                        architecture and style guide, with validation, error handling and tests."""),
                new AgentDefinition("dev_frontend", "Dev Frontend Agent",
                        "Implements frontend UI components and pages.",
                        Set.of(6), ANTHROPIC, CLAUDE_SONNET, """
                        You are the Dev Frontend Agent. Implement UI components and pages from the storyboards,
                        accessible and responsive, following the style guide."""),
                new AgentDefinition("devops", "DevOps Agent",
                        "Creates infrastructure-as-code, CI/CD pipelines and deployment configs.",
                        Set.of(5, 8), ANTHROPIC, CLAUDE_SONNET, """
                        You are the DevOps Agent. Write infrastructure-as-code, CI/CD pipelines and deployment
                        configuration. Prefer reproducible, minimal setups and document required secrets."""),
                new AgentDefinition("qa", "QA Agent",
                        "Generates test plans and executes tests.",
                        Set.of(7), ANTHROPIC, CLAUDE_SONNET, """
                        You are the QA Agent. Write test plans from the acceptance criteria, cover edge cases,
                        and report failures with reproduction steps."""),
                new AgentDefinition("docs", "Docs Agent",
                        "Creates user documentation, API docs and runbooks.",
                        Set.of(9), OPENAI, GPT_4O, """
                        You are the Docs Agent. Write user guides, API reference and operational runbooks
                        that match what was actually built."""),
                new AgentDefinition("refactor", "Refactor Agent",
                        "Improves code quality while keeping behavior.",
                        Set.of(6, 10), ANTHROPIC, CLAUDE_SONNET, """
                        You are the Refactor Agent. Find code smells, propose behavior-preserving changes with
                        rationale and keep the test suite green before and after."""),
                new AgentDefinition("troubleshooter", "Troubleshooter Agent",
                        "Debugs failing builds, tests and production issues.",
                        Set.of(7), ANTHROPIC, CLAUDE_SONNET, """
                        You are the Troubleshooter Agent. Analyze errors and logs, identify the most likely root
                        cause first, propose a fix and open a bug card for anything needing more investigation.""")
        );
    }
}
