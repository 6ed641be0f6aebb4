package org.sirena.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.sirena.config.models.ParserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;
import java.util.stream.Collectors;

public class ConfigHelper {

    private static final Logger logger = LoggerFactory.getLogger(ConfigHelper.class);

    public static final String DEFAULT_CONFIG_RESOURCE = "sirena.json";
    private static final String SCHEMA_RESOURCE = "schemas/sirena_config_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /**
     * Loads the default configuration resource, falling back to built-in defaults when
     * the classpath has none.
     */
    public static ParserConfig loadDefault() {
        if (ConfigHelper.class.getClassLoader().getResource(DEFAULT_CONFIG_RESOURCE) == null) {
            logger.debug("No {} on the classpath, using built-in parser defaults", DEFAULT_CONFIG_RESOURCE);
            return ParserConfig.defaults();
        }
        return loadFromResources(DEFAULT_CONFIG_RESOURCE);
    }

    /**
     * Loads and schema-validates a configuration resource.
     *
     * @param resourcePath classpath location of the JSON file
     * @return the parsed configuration
     * @throws IllegalArgumentException if the resource is missing or fails validation
     */
    public static ParserConfig loadFromResources(String resourcePath) {
        JsonNode configNode = readResource(resourcePath);
        validate(configNode, resourcePath);
        try {
            return mapper.treeToValue(configNode, ParserConfig.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to map parser configuration " + resourcePath, e);
        }
    }

    /**
     * Validates a configuration tree against the bundled JSON schema.
     *
     * @throws IllegalArgumentException listing every violation
     */
    public static void validate(JsonNode configNode, String source) {
        JsonSchema schema = factory.getSchema(readResource(SCHEMA_RESOURCE));
        Set<ValidationMessage> result = schema.validate(configNode);
        if (!result.isEmpty()) {
            String problems = result.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            logger.warn("Parser configuration {} is invalid: {}", source, problems);
            throw new IllegalArgumentException(
                    String.format("Parser configuration '%s' is invalid: %s", source, problems));
        }
        logger.debug("Parser configuration {} is valid", source);
    }

    private static JsonNode readResource(String resourcePath) {
        try (InputStream in = ConfigHelper.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IllegalArgumentException("Resource not found: " + resourcePath);
            return mapper.readTree(in);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + resourcePath, e);
        }
    }
}
