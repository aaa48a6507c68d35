package com.nilsson.imagetagger.data;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 Loads the keyword dictionary from its JSON configuration file.
 * <p>The file is a single JSON object whose values are either a label string or an array of
 label strings:</p>
 <pre>
 {
   "sunset": "TimeOfDay: Sunset",
   "pine tree": ["Tree: Pine", "Landscape: Forest"]
 }
 </pre>
 * <p>When the configured file does not exist the bundled example dictionary is used instead.</p>
 */
public class KeywordDictionaryLoader {

    private static final Logger logger = LoggerFactory.getLogger(KeywordDictionaryLoader.class);
    static final String BUNDLED_EXAMPLE = "/keywords.example.json";

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(JsonParser.Feature.ALLOW_COMMENTS, true)
            .configure(JsonParser.Feature.ALLOW_TRAILING_COMMA, true);

    /**
     Reads the dictionary at {@code file}, falling back to the bundled example when it is missing.

     @throws IOException if the file exists but cannot be read or is not a JSON object
     */
    public KeywordDictionary load(Path file) throws IOException {
        if (file != null && Files.isRegularFile(file)) {
            logger.info("Loading keyword dictionary from {}", file.toAbsolutePath());
            try (InputStream in = Files.newInputStream(file)) {
                return parse(in, file.toString());
            }
        }

        logger.warn("Keyword dictionary {} not found, using bundled example dictionary", file);
        try (InputStream in = KeywordDictionaryLoader.class.getResourceAsStream(BUNDLED_EXAMPLE)) {
            if (in == null) {
                throw new IOException("Bundled keyword dictionary " + BUNDLED_EXAMPLE + " is missing");
            }
            return parse(in, BUNDLED_EXAMPLE);
        }
    }

    KeywordDictionary parse(InputStream in, String source) throws IOException {
        JsonNode root = mapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new IOException("Keyword dictionary " + source + " must be a JSON object");
        }

        Map<String, List<String>> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<String> labels = readLabels(field.getKey(), field.getValue());
            if (!labels.isEmpty()) {
                entries.put(field.getKey(), labels);
            }
        }

        KeywordDictionary dictionary = KeywordDictionary.of(entries);
        logger.info("Loaded {} keyword terms from {}", entries.size(), source);
        return dictionary;
    }

    private List<String> readLabels(String term, JsonNode value) {
        List<String> labels = new ArrayList<>();
        if (value.isTextual()) {
            labels.add(value.asText());
        } else if (value.isArray()) {
            for (JsonNode item : value) {
                if (item.isTextual()) {
                    labels.add(item.asText());
                } else {
                    logger.warn("Skipping non-text label {} for term '{}'", item, term);
                }
            }
        } else {
            logger.warn("Skipping term '{}': expected a label or a list of labels, got {}", term, value.getNodeType());
        }
        return labels;
    }
}
