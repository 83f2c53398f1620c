package com.hiddenmarkov.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hiddenmarkov.model.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads model definitions from JSON.
 */
public class ModelDefinitionLoader {

    private static final Logger logger = LoggerFactory.getLogger(ModelDefinitionLoader.class);

    /** Classpath location of the bundled definitions. */
    public static final String DEFAULT_RESOURCE = "/hmm_models.json";

    private final ObjectMapper mapper = new ObjectMapper();

    public Map<String, ModelDefinition> loadDefaults() {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    public Map<String, ModelDefinition> loadFromClasspath(String resource) {
        try (InputStream is = ModelDefinitionLoader.class.getResourceAsStream(resource)) {
            if (is == null) {
                logger.error("Model definition resource not found: {}", resource);
                throw new ConfigurationException("Model definition resource not found: " + resource);
            }
            return load(is, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read model definitions from " + resource, e);
        }
    }

    /**
     * Parses a catalog document. Definitions are validated by {@link ModelDefinition#toModel()}
     * before being returned, keyed by name in document order.
     */
    public Map<String, ModelDefinition> load(InputStream jsonStream, String source) {
        ModelCatalog catalog;
        try {
            catalog = mapper.readValue(jsonStream, ModelCatalog.class);
        } catch (IOException e) {
            logger.error("Malformed model definitions in {}", source, e);
            throw new ConfigurationException("Malformed model definitions in " + source, e);
        }

        Map<String, ModelDefinition> definitions = new LinkedHashMap<>();
        if (catalog.models == null) {
            logger.warn("No models defined in {}", source);
            return Collections.emptyMap();
        }
        for (ModelDefinition definition : catalog.models) {
            if (definition.name == null || definition.name.trim().isEmpty()) {
                throw new ConfigurationException("Model definition without a name in " + source);
            }
            if (definitions.containsKey(definition.name)) {
                throw new ConfigurationException("Duplicate model name '" + definition.name + "' in " + source);
            }
            definition.toModel();
            definitions.put(definition.name, definition);
        }
        logger.info("Loaded {} model definitions from {}: {}", definitions.size(), source, definitions.keySet());
        return Collections.unmodifiableMap(definitions);
    }
}
