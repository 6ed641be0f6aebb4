package org.sirena;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.sirena.config.ConfigHelper;
import org.sirena.config.models.ParserConfig;
import org.sirena.diagram.Diagram;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Entry points for callers that do not manage their own {@link DiagramRegistry}.
 */
public class DiagramHelper {

    private static final ObjectMapper mapper = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private static DiagramRegistry defaultRegistry;

    /** Parses with the registry built from the default configuration. */
    public static Diagram parse(String text) {
        return registry().parse(text);
    }

    public static Diagram parse(String text, ParserConfig config) {
        return DiagramRegistry.defaults(config).parse(text);
    }

    /**
     * Reads a diagram document from the classpath and parses it.
     *
     * @throws IllegalArgumentException if the resource does not exist
     */
    public static Diagram loadFromResources(String resourcePath) {
        try (InputStream in = DiagramHelper.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IllegalArgumentException("Resource not found: " + resourcePath);
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + resourcePath, e);
        }
    }

    /** Pretty-printed JSON form of a model. */
    public static String toJson(Diagram diagram) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(diagram);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize " + diagram.diagramType() + " diagram", e);
        }
    }

    private static synchronized DiagramRegistry registry() {
        if (defaultRegistry == null) {
            defaultRegistry = DiagramRegistry.defaults(ConfigHelper.loadDefault());
        }
        return defaultRegistry;
    }
}
