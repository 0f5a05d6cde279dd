package com.wordlearena.orchestrator.registry;

import com.wordlearena.common.agent.GuessingAgent;
import com.wordlearena.common.exception.AgentException;
import com.wordlearena.common.exception.ConfigurationException;

import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates a fresh agent per episode through its public no-arg constructor.
 *
 * <p>Plugin jars get one class loader each, shared by every episode of that
 * jar and parented to the loader that holds the agent contract.
 */
public class AgentInstantiator {

    private final ClassLoader applicationLoader;
    private final Map<String, ClassLoader> pluginLoaders = new ConcurrentHashMap<>();

    public AgentInstantiator() {
        this(AgentInstantiator.class.getClassLoader());
    }

    public AgentInstantiator(ClassLoader applicationLoader) {
        this.applicationLoader = applicationLoader;
    }

    /**
     * @throws AgentException when the class cannot be loaded, is not a {@link GuessingAgent},
     *                        or its constructor fails
     */
    public GuessingAgent instantiate(AgentDescriptor descriptor) {
        try {
            ClassLoader loader = descriptor.isPlugin() ? classLoaderFor(Path.of(descriptor.pluginJar())) : applicationLoader;
            Class<?> type = Class.forName(descriptor.className(), true, loader);
            if (!GuessingAgent.class.isAssignableFrom(type)) {
                throw new AgentException(descriptor.agentId(), AgentException.Phase.LOAD, descriptor.className() + " does not implement GuessingAgent");
            }
            return (GuessingAgent) type.getDeclaredConstructor().newInstance();
        } catch (AgentException e) {
            throw e;
        } catch (ReflectiveOperationException | LinkageError | RuntimeException e) {
            throw new AgentException(descriptor.agentId(), AgentException.Phase.LOAD, "failed to instantiate " + descriptor.className() + ": " + e, e);
        }
    }

    /** One loader per jar, created on first use. */
    public ClassLoader classLoaderFor(Path jar) {
        return pluginLoaders.computeIfAbsent(jar.toAbsolutePath().normalize().toString(), key -> {
            try {
                return new URLClassLoader("agent-plugin:" + Path.of(key).getFileName(),
                    new URL[]{Path.of(key).toUri().toURL()}, applicationLoader);
            } catch (MalformedURLException e) {
                throw new ConfigurationException("Invalid plugin jar path " + key, e);
            }
        });
    }
}
