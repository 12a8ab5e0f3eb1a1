package io.github.drompincen.boardpilot.runtime.agent;

import io.github.drompincen.boardpilot.protocol.api.CardPriority;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentRoutingTableTest {

    private final AgentRoutingTable table = AgentRoutingTable.defaults();

    @Test
    void frontendAgent_defaultsToBuildLaneWithHighPriority() {
        AgentRoute route = table.routeFor("frontend-agent");

        assertThat(route.defaultLane()).isEqualTo(5);
        assertThat(route.priority()).isEqualTo(CardPriority.HIGH);
        assertThat(route.lanes()).containsExactly(5, 6);
    }

    @Test
    void unknownAgent_fallsBackToBaselineRoute() {
        assertThat(table.routeFor("nobody")).isEqualTo(table.routeFor(AgentRoutingTable.BASELINE_AGENT));
        assertThat(table.effectiveAgent("nobody")).isEqualTo("ceo-copilot");
        assertThat(table.effectiveAgent(null)).isEqualTo("ceo-copilot");
        assertThat(table.effectiveAgent("qa-agent")).isEqualTo("qa-agent");
    }

    @Test
    void effectiveAgent_followsAliases() {
        assertThat(table.effectiveAgent("the UI agent")).isEqualTo("frontend-agent");
        assertThat(table.effectiveAgent("DB")).isEqualTo("database-agent");
        assertThat(table.effectiveAgent("QA-Agent")).isEqualTo("qa-agent");
    }

    @Test
    void aliases_resolveNaturalLanguageMentions() {
        assertThat(table.resolveAlias("the UI agent")).contains("frontend-agent");
        assertThat(table.resolveAlias("DB")).contains("database-agent");
        assertThat(table.resolveAlias("WooCommerce")).contains("wordpress-agent");
        assertThat(table.resolveAlias("backend-agent")).contains("backend-agent");
        assertThat(table.resolveAlias("chef")).isEmpty();
        assertThat(table.resolveAlias("  ")).isEmpty();
    }

    @Test
    void customTable_canReplaceDefaults() {
        AgentRoutingTable custom = new AgentRoutingTable(
                Map.of("lead", new AgentRoute(List.of(1), 1, CardPriority.LOW)), Map.of("boss", "lead"), "lead");

        assertThat(custom.routeFor("anyone").defaultLane()).isEqualTo(1);
        assertThat(custom.resolveAlias("boss")).contains("lead");
        assertThat(custom.toDtos()).hasSize(1);
    }

    @Test
    void invalidTables_areRejected() {
        assertThatThrownBy(() -> new AgentRoute(List.of(1, 2), 3, CardPriority.LOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AgentRoutingTable(Map.of(), Map.of(), "lead"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AgentRoutingTable(
                Map.of("lead", new AgentRoute(List.of(1), 1, CardPriority.LOW)), Map.of("x", "ghost"), "lead"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
