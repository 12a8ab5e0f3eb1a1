package io.github.drompincen.boardpilot.runtime.document;

import io.github.drompincen.boardpilot.protocol.api.DocumentType;
import io.github.drompincen.boardpilot.protocol.api.PlanningPhase;

import java.util.Map;

/**
 * Markdown renderings of the planning documents from the operator's phase answers.
 */
public final class DocumentTemplates {

    static final String NOT_DEFINED = "Not defined yet";
    static final String FOOTER = "\n---\nGenerated by BoardPilot CoPilot\n";

    private DocumentTemplates() {}

    public static String render(DocumentType type, String projectName, Map<String, String> responses) {
        Map<String, String> answers = responses == null ? Map.of() : responses;
        return switch (type) {
            case BLUEPRINT -> blueprint(projectName, answers);
            case PRD -> prd(projectName, answers);
            case MVP -> mvp(projectName, answers);
            case PLAYBOOK -> playbook(projectName, answers);
        };
    }

    private static String answer(Map<String, String> answers, PlanningPhase phase) {
        String value = answers.get(phase.value());
        return value == null || value.isBlank() ? NOT_DEFINED : value;
    }

    private static String blueprint(String name, Map<String, String> a) {
        return """
                # %s Blueprint

                ## Vision
                %s

                ## Problem Statement
                %s

                ## Requirements
                %s

                ## Goals & Success Metrics
                %s

                ## Team & Roles
                %s

                ## Technical Architecture
                %s
                """.formatted(name,
                answer(a, PlanningPhase.VISION), answer(a, PlanningPhase.WELCOME),
                answer(a, PlanningPhase.REQUIREMENTS), answer(a, PlanningPhase.GOALS),
                answer(a, PlanningPhase.ROLES), answer(a, PlanningPhase.ARCHITECTURE)) + FOOTER;
    }

    private static String prd(String name, Map<String, String> a) {
        return """
                # %s - Product Requirements Document

                ## 1. Overview
                %s

                ## 2. Vision & Goals
                %s

                ### Success Metrics
                %s

                ## 3. Functional Requirements
                %s

                ## 4. User Stories
                Derive one story per requirement above, in the form
                "As a <role>, I want <capability>, so that <benefit>".

                ## 5. Technical Requirements
                %s

                ## 6. Team & Resources
                %s
                """.formatted(name,
                answer(a, PlanningPhase.WELCOME), answer(a, PlanningPhase.VISION),
                answer(a, PlanningPhase.GOALS), answer(a, PlanningPhase.REQUIREMENTS),
                answer(a, PlanningPhase.ARCHITECTURE), answer(a, PlanningPhase.ROLES)) + FOOTER;
    }

    private static String mvp(String name, Map<String, String> a) {
        return """
                # %s - MVP Definition

                ## MVP Goal
                %s

                ## Scope
                The MVP includes the must-have requirements below; everything else is post-MVP.

                %s

                ## Agent Assignments

                | Feature | Agent | Lane | Priority |
                |---------|-------|------|----------|
                | Data model | database-agent | 3 | P0 |
                | Core backend | backend-agent | 5 | P0 |
                | Core UI | frontend-agent | 5 | P0 |
                | Testing | qa-agent | 7 | P1 |
                | Deployment | devops-agent | 8 | P1 |

                ## Success Criteria
                %s

                ## Architecture Notes
                %s
                """.formatted(name,
                answer(a, PlanningPhase.VISION), answer(a, PlanningPhase.REQUIREMENTS),
                answer(a, PlanningPhase.GOALS), answer(a, PlanningPhase.ARCHITECTURE)) + FOOTER;
    }

    private static String playbook(String name, Map<String, String> a) {
        return """
                # %s - Agent Playbook

                ## Overview
                Execution plan for the agents building %s.

                ## Execution Order

                ### Planning & Architecture (lanes 0-4)
                | Agent | Responsibility | Outputs |
                |-------|----------------|---------|
                | ceo_copilot | Project oversight | Progress reports |
                | research | Technology research | Research briefs |
                | architect | System design | Architecture docs |
                | planner | Task breakdown | Task cards |

                ### Development (lanes 5-6)
                | Agent | Responsibility | Outputs |
                |-------|----------------|---------|
                | dev_backend | APIs and services | Backend code |
                | dev_frontend | UI components | Frontend code |
                | devops | Scaffolding and pipelines | CI/CD config |

                ### Quality & Release (lanes 7-9)
                | Agent | Responsibility | Outputs |
                |-------|----------------|---------|
                | qa | Testing | Test reports |
                | troubleshooter | Failure analysis | Fixes, bug cards |
                | docs | Documentation | Guides, runbooks |

                ## Rules
                1. Agents only run in the lanes they are registered for.
                2. Code-writing agents need human approval of their output.
                3. A lane starts when the lane before it is complete.

                ## Vision
                %s

                ## Team Roles
                %s

                ## Technical Architecture
                %s
                """.formatted(name, name,
                answer(a, PlanningPhase.VISION), answer(a, PlanningPhase.ROLES),
                answer(a, PlanningPhase.ARCHITECTURE)) + FOOTER;
    }
}
