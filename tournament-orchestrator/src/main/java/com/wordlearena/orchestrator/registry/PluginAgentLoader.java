package com.wordlearena.orchestrator.registry;

import com.wordlearena.common.agent.GuessingAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.stream.Stream;

/**
 * Discovers user-supplied agents in {@code *.jar} files of a plugin directory.
 *
 * <p>Each jar registers its implementations under
 * {@code META-INF/services/com.wordlearena.common.agent.GuessingAgent}. A jar or
 * provider that fails to load is logged and skipped; the rest of the field is
 * unaffected.
 */
public class PluginAgentLoader {

    private static final Logger log = LoggerFactory.getLogger(PluginAgentLoader.class);

    private final AgentInstantiator instantiator;

    public PluginAgentLoader(AgentInstantiator instantiator) {
        this.instantiator = instantiator;
    }

    public List<AgentDescriptor> discover(Path pluginDir) {
        List<AgentDescriptor> found = new ArrayList<>();
        if (pluginDir == null || !Files.isDirectory(pluginDir)) {
            log.info("[Plugins] No plugin directory. path={}", pluginDir);
            return found;
        }

        List<Path> jars;
        try (Stream<Path> files = Files.list(pluginDir)) {
            jars = files.filter(p -> p.getFileName().toString().endsWith(".jar")).sorted().toList();
        } catch (IOException e) {
            log.error("[Plugins] Cannot list plugin directory. path={}", pluginDir, e);
            return found;
        }

        for (Path jar : jars) {
            found.addAll(discoverJar(jar));
        }
        log.info("[Plugins] Discovery complete. dir={} jars={} agents={}", pluginDir, jars.size(), found.size());
        return found;
    }

    List<AgentDescriptor> discoverJar(Path jar) {
        List<AgentDescriptor> found = new ArrayList<>();
        ClassLoader loader;
        try {
            loader = instantiator.classLoaderFor(jar);
        } catch (RuntimeException e) {
            log.warn("[Plugins] Skipping jar. jar={} err={}", jar, e.getMessage());
            return found;
        }

        Iterator<GuessingAgent> it = ServiceLoader.load(GuessingAgent.class, loader).iterator();
        while (true) {
            boolean more;
            try {
                more = it.hasNext();
            } catch (ServiceConfigurationError e) {
                log.warn("[Plugins] Unreadable service registration, skipping rest of jar. jar={} err={}",
                    jar, e.getMessage());
                break;
            }
            if (!more) break;

            GuessingAgent agent;
            try {
                agent = it.next();
            } catch (ServiceConfigurationError | LinkageError e) {
                log.warn("[Plugins] Skipping provider. jar={} err={}", jar, e.getMessage());
                continue;
            }
            // the parent loader's own registrations are visible too; keep only this jar's
            if (agent.getClass().getClassLoader() != loader) continue;
            try {
                String agentId = agent.agentId();
                found.add(new AgentDescriptor(agentId, agent.getClass().getName(),
                    jar.toAbsolutePath().normalize().toString()));
                log.info("[Plugins] Registered. agent={} class={} jar={}", agentId, agent.getClass().getName(), jar.getFileName());
            } catch (RuntimeException e) {
                log.warn("[Plugins] agentId() failed, skipping. class={} jar={} err={}",
                    agent.getClass().getName(), jar, e.getMessage());
            }
        }
        return found;
    }
}
