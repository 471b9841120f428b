package edu.brandeis.cosi103a.fantasy.scoring;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.fantasy.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.fantasy.error.ConfigurationLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads {@link ScoringScheme}s from JSON of the form
 * {@code {"OFF": {"Passing Yards": 0.04, ...}, "K": {...}}}.
 */
public final class ScoringSchemeLoader {

    /** Classpath resource holding ESPN's default scoring. */
    public static final String ESPN = "scoring/espn.json";

    /** Classpath resource holding Yahoo!'s default scoring. */
    public static final String YAHOO = "scoring/yahoo.json";

    private static final Logger log = LoggerFactory.getLogger(ScoringSchemeLoader.class);
    private static final TypeReference<Map<String, Map<String, Double>>> SCHEME_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public ScoringSchemeLoader() {
        this(ObjectMapperFactory.create());
    }

    public ScoringSchemeLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws ConfigurationLoadException if the file cannot be read or parsed
     */
    public ScoringScheme load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            ScoringScheme scheme = read(in);
            log.info("Loaded scoring scheme from {} ({} categories)", path, scheme.categories().size());
            return scheme;
        } catch (IOException e) {
            throw new ConfigurationLoadException("Failed to load scoring scheme from " + path, e);
        }
    }

    /**
     * Loads a scheme from the classpath, e.g. {@link #ESPN}.
     *
     * @throws ConfigurationLoadException if the resource is missing or cannot be parsed
     */
    public ScoringScheme loadResource(String resource) {
        InputStream in = ScoringSchemeLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new ConfigurationLoadException("Scoring scheme resource not found: " + resource);
        }
        try (in) {
            ScoringScheme scheme = read(in);
            log.info("Loaded scoring scheme from classpath:{} ({} categories)", resource, scheme.categories().size());
            return scheme;
        } catch (IOException e) {
            throw new ConfigurationLoadException("Failed to load scoring scheme from " + resource, e);
        }
    }

    private ScoringScheme read(InputStream in) throws IOException {
        Map<String, Map<String, Double>> points = mapper.readValue(in, SCHEME_TYPE);
        if (points == null) {
            throw new ConfigurationLoadException("Scoring scheme is empty");
        }
        for (Map.Entry<String, Map<String, Double>> entry : points.entrySet()) {
            if (entry.getValue() == null || entry.getValue().containsValue(null)) {
                throw new ConfigurationLoadException("Scoring category " + entry.getKey() + " has missing values");
            }
        }
        return new ScoringScheme(points);
    }
}
