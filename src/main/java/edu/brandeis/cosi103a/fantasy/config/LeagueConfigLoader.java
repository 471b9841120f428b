package edu.brandeis.cosi103a.fantasy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.fantasy.error.ConfigurationLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;

/**
 * Loads and validates {@link LeagueConfig} files.
 */
public class LeagueConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(LeagueConfigLoader.class);

    private final ObjectMapper mapper;

    public LeagueConfigLoader() {
        this(ObjectMapperFactory.create());
    }

    public LeagueConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws ConfigurationLoadException if the file cannot be read, cannot be parsed, or is invalid
     */
    public LeagueConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            LeagueConfig config = validate(mapper.readValue(in, LeagueConfig.class));
            log.info("Loaded league {} from {}: {} teams, {} rounds",
                config.name(), path, config.teams().size(), config.rounds());
            return config;
        } catch (IOException e) {
            throw new ConfigurationLoadException("Failed to load league configuration from " + path, e);
        }
    }

    /**
     * @throws ConfigurationLoadException if the resource is missing, cannot be parsed, or is invalid
     */
    public LeagueConfig loadResource(String resource) {
        InputStream in = LeagueConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new ConfigurationLoadException("League configuration resource not found: " + resource);
        }
        try (in) {
            LeagueConfig config = validate(mapper.readValue(in, LeagueConfig.class));
            log.info("Loaded league {} from classpath:{}", config.name(), resource);
            return config;
        } catch (IOException e) {
            throw new ConfigurationLoadException("Failed to load league configuration from " + resource, e);
        }
    }

    /**
     * Checks the parts of a configuration the position schema and draft do not check themselves.
     *
     * @return {@code config}
     * @throws ConfigurationLoadException on the first problem found
     */
    static LeagueConfig validate(LeagueConfig config) {
        if (config.name() == null || config.name().isBlank()) {
            throw new ConfigurationLoadException("League name is required");
        }
        if (config.convention() == null) {
            throw new ConfigurationLoadException("League " + config.name() + " has no position convention");
        }
        try {
            config.positionCodes();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationLoadException(e.getMessage(), e);
        }
        if (config.slots() == null) {
            throw new ConfigurationLoadException("League " + config.name() + " has no roster slots");
        }
        if (config.teams() == null || config.teams().isEmpty()) {
            throw new ConfigurationLoadException("League " + config.name() + " needs at least one team");
        }
        if (new HashSet<>(config.teams()).size() != config.teams().size()) {
            throw new ConfigurationLoadException("League " + config.name() + " has duplicate team names");
        }
        if (config.rounds() < 1) {
            throw new ConfigurationLoadException(
                "League " + config.name() + " must draft at least one round, was " + config.rounds());
        }
        return config;
    }
}
