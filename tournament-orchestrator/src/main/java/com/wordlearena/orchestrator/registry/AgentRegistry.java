package com.wordlearena.orchestrator.registry;

import com.wordlearena.common.agent.GuessingAgent;
import com.wordlearena.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The tournament field: every known agent by id.
 *
 * <p>Sources are the {@link GuessingAgent} beans on the application classpath
 * and descriptors discovered in plugin jars. Ids must be unique across both.
 * An include filter, when non-empty, restricts the field to the named ids.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, AgentDescriptor> agents = new TreeMap<>();

    public AgentRegistry(Collection<GuessingAgent> classpathAgents,
                         Collection<AgentDescriptor> pluginAgents,
                         Set<String> include) {
        for (GuessingAgent agent : classpathAgents) {
            Class<?> type = ClassUtils.getUserClass(agent);
            if (!hasPublicNoArgConstructor(type)) {
                log.warn("[Registry] Agent has no public no-arg constructor; its episodes will fault. class={}", type.getName());
            }
            register(AgentDescriptor.classpath(agent.agentId(), type.getName()), include);
        }
        for (AgentDescriptor descriptor : pluginAgents) {
            register(descriptor, include);
        }
        if (include != null && !include.isEmpty()) {
            for (String id : include) {
                if (!agents.containsKey(id)) {
                    log.warn("[Registry] Included agent not found. agent={}", id);
                }
            }
        }
        log.info("[Registry] Field ready. agents={}", agents.keySet());
    }

    private void register(AgentDescriptor descriptor, Set<String> include) {
        if (include != null && !include.isEmpty() && !include.contains(descriptor.agentId())) {
            log.debug("[Registry] Excluded by filter. agent={}", descriptor.agentId());
            return;
        }
        AgentDescriptor previous = agents.putIfAbsent(descriptor.agentId(), descriptor);
        if (previous != null) {
            throw new ConfigurationException("Duplicate agent id '" + descriptor.agentId() + "': "
                + previous.className() + " and " + descriptor.className());
        }
    }

    private static boolean hasPublicNoArgConstructor(Class<?> type) {
        try {
            return Modifier.isPublic(type.getModifiers()) && Modifier.isPublic(type.getConstructor().getModifiers());
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    public List<AgentDescriptor> all() {
        return List.copyOf(agents.values());
    }

    public List<String> agentIds() {
        return List.copyOf(agents.keySet());
    }

    public int size() {
        return agents.size();
    }

    /**
     * @param ids requested agent ids; null or empty selects the whole field
     * @throws ConfigurationException for an unknown id
     */
    public List<AgentDescriptor> select(List<String> ids) {
        if (ids == null || ids.isEmpty()) return all();
        List<AgentDescriptor> selected = new ArrayList<>(ids.size());
        for (String id : ids) {
            AgentDescriptor descriptor = agents.get(id);
            if (descriptor == null) {
                throw new ConfigurationException("Unknown agent '" + id + "'. Registered: " + agents.keySet());
            }
            if (!selected.contains(descriptor)) selected.add(descriptor);
        }
        return selected;
    }

    /** Case-insensitive lookup, as used by single-agent experiments. */
    public AgentDescriptor find(String id) {
        AgentDescriptor exact = agents.get(id);
        if (exact != null) return exact;
        return agents.values().stream()
            .filter(d -> d.agentId().equalsIgnoreCase(id))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException("Unknown agent '" + id + "'. Registered: " + agents.keySet()));
    }
}
