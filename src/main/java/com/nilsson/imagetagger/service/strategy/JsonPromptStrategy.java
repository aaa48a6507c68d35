package com.nilsson.imagetagger.service.strategy;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nilsson.imagetagger.service.model.ImageMetadata;
import com.nilsson.imagetagger.service.model.MetadataComment;
import com.nilsson.imagetagger.service.model.PromptEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 <h2>JsonPromptStrategy</h2>
 <p>
 Reads prompts from the ComfyUI API graph stored in the {@code prompt} text chunk. The graph is a
 JSON object keyed by node id; nodes produced by wildcard/dynamic-prompt processors carry the
 resolved prompt in {@code inputs.populated_text}.
 </p>
 <pre>
 {"12": {"class_type": "ImpactWildcardProcessor", "inputs": {"populated_text": "a mountain, cloudy sky"}}}
 </pre>
 <p>
 Each such node yields one {@link PromptEntry} keyed by its node id. Numeric node ids come first in
 ascending numeric order, any other keys follow in document order; the first entry becomes the
 image description. Text that is not a JSON object is treated as "not this encoding" so the next
 strategy can run.
 </p>
 */
public class JsonPromptStrategy implements PromptExtractionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(JsonPromptStrategy.class);

    public static final String IDENTIFIER = "jsonPrompt";
    public static final String COMMENT_KEYWORD = "prompt";

    private static final Pattern INDEX_KEY = Pattern.compile("0|[1-9]\\d{0,9}");
    private static final long MAX_INDEX = 4_294_967_294L;

    private static final ObjectMapper mapper = new ObjectMapper()
            .configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);

    @Override
    public String getIdentifier() {
        return IDENTIFIER;
    }

    @Override
    public List<PromptEntry> extract(ImageMetadata metadata) {
        Optional<MetadataComment> comment = metadata.findComment(COMMENT_KEYWORD);
        if (comment.isEmpty()) {
            logger.debug("No prompt comment found");
            return null;
        }

        JsonNode root;
        try {
            root = mapper.readTree(comment.get().getText());
        } catch (JsonProcessingException e) {
            logger.warn("Prompt comment is not valid JSON: {}", e.getOriginalMessage());
            return null;
        }

        if (root == null || !root.isObject()) {
            logger.debug("Prompt comment is not a JSON object");
            return null;
        }

        List<PromptEntry> prompts = new ArrayList<>();
        for (Map.Entry<String, JsonNode> node : nodesInKeyOrder(root)) {
            JsonNode populated = node.getValue().path("inputs").path("populated_text");
            if (populated.isTextual() && !populated.asText().isEmpty()) {
                prompts.add(new PromptEntry(node.getKey(), populated.asText()));
            }
        }

        if (prompts.isEmpty()) {
            logger.debug("No populated_text inputs found in prompt graph");
            return null;
        }
        return prompts;
    }

    /**
     Object members with array-index keys ({@code "0"}, {@code "12"}, up to 2^32 - 2) sorted
     numerically, followed by the remaining members in document order.
     */
    static List<Map.Entry<String, JsonNode>> nodesInKeyOrder(JsonNode root) {
        List<Map.Entry<String, JsonNode>> indexed = new ArrayList<>();
        List<Map.Entry<String, JsonNode>> named = new ArrayList<>();

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (isIndexKey(field.getKey())) {
                indexed.add(field);
            } else {
                named.add(field);
            }
        }

        indexed.sort(Comparator.comparingLong(field -> Long.parseLong(field.getKey())));
        indexed.addAll(named);
        return indexed;
    }

    static boolean isIndexKey(String key) {
        if (!INDEX_KEY.matcher(key).matches()) return false;
        return Long.parseLong(key) <= MAX_INDEX;
    }
}
