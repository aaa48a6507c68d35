package com.nilsson.imagetagger.data;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.Map;

/**
 Read-only access to application settings.
 * <p>Settings live in a JSON document. The bundled {@code /defaults.json} supplies every key;
 an optional user file ({@code tagger.json} in the working directory, or the path named by the
 {@code tagger.config} system property) is deep-merged on top of it, so a user file only needs
 the keys it changes.</p>
 * <p>Keys are addressed with dotted paths such as {@code processing.addWatermark}.</p>
 */
public class SettingsRepository {

    private static final Logger logger = LoggerFactory.getLogger(SettingsRepository.class);

    public static final String CONFIG_PROPERTY = "tagger.config";
    public static final String DEFAULT_CONFIG_FILE = "tagger.json";
    static final String DEFAULTS_RESOURCE = "/defaults.json";

    // --- Setting Keys ---
    public static final String ADD_WATERMARK = "processing.addWatermark";
    public static final String TARGET_SUBFOLDER = "runtime.targetSubfolder";
    public static final String TEMP_DIRECTORY = "temp.directory";
    public static final String KEYWORDS_FILE = "keywords.file";
    public static final String EXIFTOOL_PATH = "exiftool.path";
    public static final String WORKER_THREADS = "workers.threads";

    private static final ObjectMapper mapper = new ObjectMapper()
            .configure(JsonParser.Feature.ALLOW_COMMENTS, true);

    private final ObjectNode settings;

    public SettingsRepository() throws IOException {
        this(Paths.get(System.getProperty(CONFIG_PROPERTY, DEFAULT_CONFIG_FILE)));
    }

    public SettingsRepository(Path userFile) throws IOException {
        ObjectNode merged = loadDefaults();
        if (userFile != null && Files.isRegularFile(userFile)) {
            try (InputStream in = Files.newInputStream(userFile)) {
                JsonNode user = mapper.readTree(in);
                if (user == null || !user.isObject()) {
                    throw new IOException("Settings file " + userFile + " must contain a JSON object");
                }
                mergeInto(merged, (ObjectNode) user);
            }
            logger.info("Loaded settings from {}", userFile.toAbsolutePath());
        } else {
            logger.info("No settings file at {}, using defaults", userFile);
        }
        this.settings = merged;
    }

    private static ObjectNode loadDefaults() throws IOException {
        try (InputStream in = SettingsRepository.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IOException("Bundled settings " + DEFAULTS_RESOURCE + " are missing");
            }
            JsonNode defaults = mapper.readTree(in);
            if (defaults == null || !defaults.isObject()) {
                throw new IOException("Bundled settings " + DEFAULTS_RESOURCE + " must contain a JSON object");
            }
            return (ObjectNode) defaults;
        }
    }

    /**
     Nested objects merge key by key; anything else in {@code overrides} replaces the default.
     */
    static void mergeInto(ObjectNode target, ObjectNode overrides) {
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                mergeInto((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }

    // --- Data Access Operations ---

    public String get(String key, String defaultValue) {
        JsonNode node = lookup(key);
        if (node == null || node.isNull() || node.isContainerNode()) return defaultValue;
        return node.asText();
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        JsonNode node = lookup(key);
        if (node == null || node.isNull()) return defaultValue;
        if (node.isBoolean()) return node.booleanValue();
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.equalsIgnoreCase("true")) return true;
            if (text.equalsIgnoreCase("false")) return false;
        }
        logger.warn("Setting {} is not a boolean: {}", key, node);
        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        JsonNode node = lookup(key);
        if (node == null || node.isNull()) return defaultValue;
        if (node.canConvertToInt()) return node.intValue();
        try {
            return Integer.parseInt(node.asText().trim());
        } catch (NumberFormatException e) {
            logger.warn("Setting {} is not an integer: {}", key, node);
            return defaultValue;
        }
    }

    private JsonNode lookup(String key) {
        JsonNode current = settings;
        for (String part : key.split("\\.")) {
            if (current == null || !current.isObject()) return null;
            current = current.get(part);
        }
        return current;
    }
}
