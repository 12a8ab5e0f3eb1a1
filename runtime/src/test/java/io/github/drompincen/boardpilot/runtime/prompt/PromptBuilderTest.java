package io.github.drompincen.boardpilot.runtime.prompt;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.boardpilot.persistence.document.CardDocument;
import io.github.drompincen.boardpilot.persistence.document.LaneDocument;
import io.github.drompincen.boardpilot.persistence.document.PlanningArtifactDocument;
import io.github.drompincen.boardpilot.persistence.document.ProjectDocument;
import io.github.drompincen.boardpilot.persistence.repository.CardRepository;
import io.github.drompincen.boardpilot.persistence.repository.LaneRepository;
import io.github.drompincen.boardpilot.persistence.repository.PlanningArtifactRepository;
import io.github.drompincen.boardpilot.persistence.repository.ProjectRepository;
import io.github.drompincen.boardpilot.protocol.api.CardPriority;
import io.github.drompincen.boardpilot.protocol.api.CardStatus;
import io.github.drompincen.boardpilot.protocol.api.DocumentType;
import io.github.drompincen.boardpilot.protocol.api.PlanningPhase;
import io.github.drompincen.boardpilot.protocol.api.ProjectStatus;
import io.github.drompincen.boardpilot.protocol.api.TaskComplexity;
import io.github.drompincen.boardpilot.runtime.agent.AgentDefinitions;
import io.github.drompincen.boardpilot.runtime.agent.AgentRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PromptBuilderTest {

    @Mock private StyleGuideService styleGuideService;
    @Mock private AgentContextService agentContextService;
    @Mock private ProjectRepository projectRepository;
    @Mock private PlanningArtifactRepository planningArtifactRepository;
    @Mock private CardRepository cardRepository;
    @Mock private LaneRepository laneRepository;

    private PromptBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new PromptBuilder(new AgentRegistry(AgentDefinitions.defaults()), styleGuideService,
                agentContextService, projectRepository, planningArtifactRepository,
                cardRepository, laneRepository, new ObjectMapper());

        ProjectDocument project = new ProjectDocument();
        project.setProjectId("p-1");
        project.setName("Atlas");
        project.setStatus(ProjectStatus.ACTIVE);
        project.setPhase(PlanningPhase.VISION);
        when(projectRepository.findById("p-1")).thenReturn(Optional.of(project));
        when(planningArtifactRepository.findByProjectId("p-1")).thenReturn(List.of());
        when(styleGuideService.getStyleGuide(anyString())).thenReturn(Optional.empty());
        when(agentContextService.getTokenOptimizedContext(anyString(), anyString(), any())).thenReturn("");
        when(cardRepository.findByParentCardId(anyString())).thenReturn(List.of());
    }

    // ---- system prompt ----

    @Test
    void unknownAgent_isRejected() {
        assertThatThrownBy(() -> builder.buildPrompt(PromptContext.forAgent("p-1", "ghost"), TaskComplexity.MODERATE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void agentContext_isAppendedUnderItsHeader() {
        when(agentContextService.getTokenOptimizedContext("p-1", "architect", PromptMode.FULL))
                .thenReturn("## Agent Plan\n\nStart small.");

        BuiltPrompt prompt = builder.buildPrompt(PromptContext.forAgent("p-1", "architect"), TaskComplexity.COMPLEX);

        assertThat(prompt.systemPrompt()).contains("## Your Current Context").contains("Start small.");
        assertThat(prompt.mode()).isEqualTo(PromptMode.FULL);
    }

    @Test
    void simpleTask_usesSummaryAgentContext() {
        BuiltPrompt prompt = builder.buildPrompt(PromptContext.forAgent("p-1", "architect"), TaskComplexity.SIMPLE);

        assertThat(prompt.mode()).isEqualTo(PromptMode.SUMMARY);
        verify(agentContextService).getTokenOptimizedContext("p-1", "architect", PromptMode.SUMMARY);
    }

    @Test
    void failingStyleGuide_isOmitted() {
        when(styleGuideService.getStyleGuide("p-1")).thenThrow(new IllegalStateException("mongo down"));

        BuiltPrompt prompt = builder.buildPrompt(PromptContext.forAgent("p-1", "architect"), TaskComplexity.MODERATE);

        assertThat(prompt.systemPrompt()).isNotBlank().doesNotContain("## Project Style Guide");
        assertThat(prompt.userContext()).contains("## Project: Atlas");
    }

    // ---- user context ----

    @Test
    void projectSection_listsPhaseAndContextDocuments() {
        PlanningArtifactDocument prd = new PlanningArtifactDocument();
        prd.setType(DocumentType.PRD);
        prd.setVersion(2);
        prd.setContent("# Atlas PRD");
        PlanningArtifactDocument playbook = new PlanningArtifactDocument();
        playbook.setType(DocumentType.PLAYBOOK);
        playbook.setVersion(1);
        playbook.setContent("# Playbook");
        when(planningArtifactRepository.findByProjectId("p-1")).thenReturn(List.of(prd, playbook));

        BuiltPrompt prompt = builder.buildPrompt(PromptContext.forAgent("p-1", "architect"), TaskComplexity.MODERATE);

        assertThat(prompt.userContext())
                .contains("- **Phase**: vision")
                .contains("### PRD (v2)")
                .doesNotContain("# Playbook");
        assertThat(prompt.totalTokenEstimate()).isEqualTo(
                TokenEstimator.estimate(prompt.systemPrompt()) + TokenEstimator.estimate(prompt.userContext()));
    }

    @Test
    void cardSection_includesLaneAndChildren() {
        CardDocument card = new CardDocument();
        card.setCardId("c-1");
        card.setLaneId("lane-3");
        card.setTitle("Build login");
        card.setType("story");
        card.setPriority(CardPriority.HIGH);
        card.setStatus(CardStatus.IN_PROGRESS);
        card.setDescription("OAuth only.");
        LaneDocument lane = new LaneDocument();
        lane.setLaneNumber(3);
        lane.setName("Architecture");
        CardDocument child = new CardDocument();
        child.setTitle("Token refresh");
        child.setType("task");
        child.setStatus(CardStatus.PENDING);
        when(cardRepository.findById("c-1")).thenReturn(Optional.of(card));
        when(laneRepository.findById("lane-3")).thenReturn(Optional.of(lane));
        when(cardRepository.findByParentCardId("c-1")).thenReturn(List.of(child));

        BuiltPrompt prompt = builder.buildPrompt(PromptContext.forCard("p-1", "architect", "c-1"), TaskComplexity.MODERATE);

        assertThat(prompt.userContext())
                .contains("## Current Card")
                .contains("- **Lane**: Architecture (3)")
                .contains("OAuth only.")
                .contains("- [PENDING] task: Token refresh");
    }

    @Test
    void additionalContext_isRenderedAsJson() {
        PromptContext context = new PromptContext("p-1", "architect", null, "Spike", null, Map.of("budget", 10));

        BuiltPrompt prompt = builder.buildPrompt(context, TaskComplexity.MODERATE);

        assertThat(prompt.userContext()).contains("## Current Task").contains("**Spike**")
                .contains("## Additional Context").contains("\"budget\" : 10");
    }
}
