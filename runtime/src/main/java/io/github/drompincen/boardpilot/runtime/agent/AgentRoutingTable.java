package io.github.drompincen.boardpilot.runtime.agent;

import io.github.drompincen.boardpilot.protocol.api.AgentRouteDto;
import io.github.drompincen.boardpilot.protocol.api.CardPriority;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps card-action agent ids (e.g. {@code frontend-agent}) to their board placement.
 * Aliases only serve {@link #resolveAlias(String)} and never feed permission checks.
 */
public class AgentRoutingTable {

    public static final String BASELINE_AGENT = "ceo-copilot";

    private final Map<String, AgentRoute> routes;
    private final Map<String, String> aliases;
    private final String baselineAgent;

    public AgentRoutingTable(Map<String, AgentRoute> routes, Map<String, String> aliases, String baselineAgent) {
        if (!routes.containsKey(baselineAgent)) {
            throw new IllegalArgumentException("Baseline agent has no route: " + baselineAgent);
        }
        aliases.values().forEach(target -> {
            if (!routes.containsKey(target)) {
                throw new IllegalArgumentException("Alias points at unknown agent: " + target);
            }
        });
        this.routes = Collections.unmodifiableMap(new LinkedHashMap<>(routes));
        this.aliases = Map.copyOf(aliases);
        this.baselineAgent = baselineAgent;
    }

    public static AgentRoutingTable defaults() {
        Map<String, AgentRoute> routes = new LinkedHashMap<>();
        routes.put("ceo-copilot", new AgentRoute(List.of(0, 1), 0, CardPriority.CRITICAL));
        routes.put("frontend-agent", new AgentRoute(List.of(5, 6), 5, CardPriority.HIGH));
        routes.put("backend-agent", new AgentRoute(List.of(5, 6), 5, CardPriority.HIGH));
        routes.put("database-agent", new AgentRoute(List.of(3, 5), 3, CardPriority.HIGH));
        routes.put("qa-agent", new AgentRoute(List.of(7), 7, CardPriority.MEDIUM));
        routes.put("devops-agent", new AgentRoute(List.of(8), 8, CardPriority.MEDIUM));
        routes.put("architect-agent", new AgentRoute(List.of(3, 4), 3, CardPriority.HIGH));
        routes.put("research-agent", new AgentRoute(List.of(2), 2, CardPriority.MEDIUM));
        routes.put("docs-agent", new AgentRoute(List.of(9), 9, CardPriority.LOW));
        routes.put("wordpress-agent", new AgentRoute(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), 5, CardPriority.HIGH));

        Map<String, String> aliases = new LinkedHashMap<>();
        alias(aliases, "frontend-agent", "frontend", "ui", "ui agent", "frontend agent");
        alias(aliases, "backend-agent", "backend", "api", "backend agent");
        alias(aliases, "database-agent", "database", "db", "database agent");
        alias(aliases, "qa-agent", "qa", "test", "testing", "qa agent");
        alias(aliases, "devops-agent", "devops", "deploy", "deployment", "devops agent");
        alias(aliases, "architect-agent", "architect", "architecture", "architect agent");
        alias(aliases, "research-agent", "research", "research agent");
        alias(aliases, "docs-agent", "docs", "documentation", "docs agent");
        alias(aliases, "ceo-copilot", "copilot", "ceo", "ceo copilot");
        alias(aliases, "wordpress-agent", "wordpress", "wp", "cms", "woocommerce", "gutenberg", "theme", "plugin",
                "wordpress agent");
        return new AgentRoutingTable(routes, aliases, BASELINE_AGENT);
    }

    private static void alias(Map<String, String> aliases, String target, String... names) {
        for (String name : names) {
            aliases.put(name, target);
        }
    }

    public String baselineAgent() {
        return baselineAgent;
    }

    public boolean isKnown(String agent) {
        return agent != null && routes.containsKey(agent);
    }

    public Optional<AgentRoute> find(String agent) {
        return agent == null ? Optional.empty() : Optional.ofNullable(routes.get(agent));
    }

    /** Route for the agent, falling back to the baseline agent's route. */
    public AgentRoute routeFor(String agent) {
        return find(agent).orElse(routes.get(baselineAgent));
    }

    /**
     * Agent id the directive should be attributed to: the agent itself or the agent an alias
     * names ("UI", "the DB agent"), else the baseline.
     */
    public String effectiveAgent(String agent) {
        return resolveAlias(agent).orElse(baselineAgent);
    }

    /**
     * Interprets a natural-language mention ("the UI agent", "DB") as a routed agent id.
     */
    public Optional<String> resolveAlias(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String key = text.trim().toLowerCase(Locale.ROOT);
        if (key.startsWith("the ")) {
            key = key.substring(4).trim();
        }
        if (routes.containsKey(key)) {
            return Optional.of(key);
        }
        return Optional.ofNullable(aliases.get(key));
    }

    public List<AgentRouteDto> toDtos() {
        return routes.entrySet().stream()
                .map(e -> e.getValue().toDto(e.getKey()))
                .toList();
    }
}
