package com.wordlearena.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wordlearena.common.agent.GuessingAgent;
import com.wordlearena.common.exception.ConfigurationException;
import com.wordlearena.lexicon.CorpusLexiconProvider;
import com.wordlearena.lexicon.LexiconCache;
import com.wordlearena.lexicon.LexiconProvider;
import com.wordlearena.orchestrator.game.GameRunner;
import com.wordlearena.orchestrator.isolation.EpisodeExecutor;
import com.wordlearena.orchestrator.isolation.ProcessEpisodeExecutor;
import com.wordlearena.orchestrator.isolation.ThreadEpisodeExecutor;
import com.wordlearena.orchestrator.registry.AgentInstantiator;
import com.wordlearena.orchestrator.registry.AgentRegistry;
import com.wordlearena.orchestrator.registry.PluginAgentLoader;
import com.wordlearena.orchestrator.service.RoundSpec;
import com.wordlearena.orchestrator.service.TournamentSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Configuration
public class ArenaConfig {

    private static final Logger log = LoggerFactory.getLogger(ArenaConfig.class);

    @Value("${arena.tournament.name:wordle-arena}")
    private String tournamentName;

    @Value("${arena.num-games:0}")
    private int numGames;

    @Value("${arena.repetitions:1}")
    private int repetitions;

    @Value("${arena.shock:0.0}")
    private double shock;

    @Value("${arena.seed:#{null}}")
    private Long seed;

    @Value("${arena.max-guesses:6}")
    private int maxGuesses;

    @Value("${arena.game-timeout:5000ms}")
    private Duration gameTimeout;

    @Value("${arena.allow-non-words:true}")
    private boolean allowNonWords;

    @Value("${arena.lexicon.max-vocabulary-size:0}")
    private int maxVocabularySize;

    @Value("${arena.lexicon.directory:}")
    private String lexiconDirectory;

    /** Comma-separated round ids; blank runs the canonical six. */
    @Value("${arena.rounds:}")
    private String rounds;

    /** Comma-separated agent ids; blank fields every registered agent. */
    @Value("${arena.agents.include:}")
    private String includeAgents;

    @Value("${arena.agents.plugin-dir:}")
    private String pluginDir;

    @Value("${arena.isolation.mode:thread}")
    private String isolationMode;

    @Value("${arena.isolation.java-command:}")
    private String javaCommand;

    @Value("${arena.isolation.classpath:}")
    private String isolationClasspath;

    @Value("${arena.isolation.memory-limit-mb:2048}")
    private int memoryLimitMb;

    @Value("${arena.isolation.startup-grace:3s}")
    private Duration startupGrace;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public LexiconProvider lexiconProvider() {
        CorpusLexiconProvider corpus = lexiconDirectory.isBlank()
            ? new CorpusLexiconProvider()
            : new CorpusLexiconProvider(Paths.get(lexiconDirectory));
        return new LexiconCache(corpus);
    }

    @Bean
    public AgentInstantiator agentInstantiator() {
        return new AgentInstantiator();
    }

    @Bean
    public GameRunner gameRunner(AgentInstantiator instantiator) {
        return new GameRunner(instantiator);
    }

    @Bean
    public PluginAgentLoader pluginAgentLoader(AgentInstantiator instantiator) {
        return new PluginAgentLoader(instantiator);
    }

    @Bean
    public AgentRegistry agentRegistry(List<GuessingAgent> classpathAgents, PluginAgentLoader plugins) {
        Path dir = pluginDir.isBlank() ? null : Paths.get(pluginDir);
        Set<String> include = new LinkedHashSet<>(commaList(includeAgents));
        return new AgentRegistry(classpathAgents, plugins.discover(dir), include);
    }

    @Bean
    public EpisodeExecutor episodeExecutor(GameRunner runner, ObjectMapper mapper) {
        switch (isolationMode.strip().toLowerCase()) {
            case "thread":
                log.info("[Config] Isolation mode=thread");
                return new ThreadEpisodeExecutor(runner);
            case "process":
                String java = javaCommand.isBlank()
                    ? Paths.get(System.getProperty("java.home"), "bin", "java").toString()
                    : javaCommand;
                String cp = isolationClasspath.isBlank() ? System.getProperty("java.class.path") : isolationClasspath;
                log.info("[Config] Isolation mode=process java={} memoryLimitMb={}", java, memoryLimitMb);
                return new ProcessEpisodeExecutor(mapper, java, cp, memoryLimitMb, startupGrace);
            default:
                throw new ConfigurationException("Unknown isolation mode '" + isolationMode + "' (thread|process)");
        }
    }

    @Bean
    public TournamentSettings tournamentDefaults() {
        List<RoundSpec> specs = commaList(rounds).stream().map(RoundSpec::parse).toList();
        TournamentSettings defaults = new TournamentSettings(tournamentName, numGames, repetitions, shock, seed,
            maxGuesses, gameTimeout.toMillis(), allowNonWords, maxVocabularySize, specs, commaList(includeAgents));
        defaults.validate();
        return defaults;
    }

    static List<String> commaList(String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.split(","))
            .map(String::strip)
            .filter(s -> !s.isEmpty())
            .toList();
    }
}
