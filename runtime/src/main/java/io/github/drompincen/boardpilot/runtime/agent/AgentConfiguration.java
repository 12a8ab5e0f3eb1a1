package io.github.drompincen.boardpilot.runtime.agent;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AgentConfiguration {

    @Bean
    public AgentRegistry agentRegistry() {
        return new AgentRegistry(AgentDefinitions.defaults());
    }

    @Bean
    public AgentRoutingTable agentRoutingTable() {
        return AgentRoutingTable.defaults();
    }
}
