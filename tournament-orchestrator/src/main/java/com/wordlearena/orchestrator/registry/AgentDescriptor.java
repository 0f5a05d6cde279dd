package com.wordlearena.orchestrator.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Everything needed to build a fresh agent inside an isolated episode unit.
 *
 * @param pluginJar absolute path of the jar the class lives in, or null for the application classpath
 */
public record AgentDescriptor(
    @JsonProperty("agentId")   String agentId,
    @JsonProperty("className") String className,
    @JsonProperty("pluginJar") String pluginJar
) {
    public static AgentDescriptor classpath(String agentId, String className) {
        return new AgentDescriptor(agentId, className, null);
    }

    @JsonIgnore
    public boolean isPlugin() {
        return pluginJar != null;
    }
}
