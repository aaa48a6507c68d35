package com.nilsson.imagetagger.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 Immutable term-to-label lookup used by the keyword matcher.
 * <p>Every configured term is indexed twice: once normalized (lowercase, trimmed, single spaces)
 and once with all whitespace removed, so that {@code "sun set"} and {@code "sunset"} resolve to
 the same labels. A term configured explicitly always keeps its own labels; a space-free alias that
 collides with it is dropped. The term list is sorted longest-first once, at construction, together
 with the space-free form of each term.</p>
 * <p>Instances are read-only after construction and may be shared between worker threads.</p>
 */
public final class KeywordDictionary {

    private static final Logger logger = LoggerFactory.getLogger(KeywordDictionary.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Map<String, List<String>> labelsByTerm;
    private final List<String> termsLongestFirst;
    private final List<String> compactTermsLongestFirst;

    private KeywordDictionary(Map<String, List<String>> labelsByTerm) {
        this.labelsByTerm = Collections.unmodifiableMap(labelsByTerm);

        List<String> terms = new ArrayList<>(labelsByTerm.keySet());
        terms.sort(Comparator.comparingInt(String::length).reversed()
                .thenComparing(Comparator.naturalOrder()));
        this.termsLongestFirst = Collections.unmodifiableList(terms);

        List<String> compact = new ArrayList<>(terms.size());
        for (String term : terms) {
            compact.add(stripWhitespace(term));
        }
        this.compactTermsLongestFirst = Collections.unmodifiableList(compact);
    }

    /**
     Builds a dictionary from raw configuration entries.

     @param entries term to label(s); keys are normalized, blank terms and blank labels are dropped
     @return the normalized dictionary
     */
    public static KeywordDictionary of(Map<String, List<String>> entries) {
        Map<String, List<String>> explicit = new LinkedHashMap<>();

        for (Map.Entry<String, List<String>> entry : entries.entrySet()) {
            String term = normalizeTerm(entry.getKey());
            if (term.isEmpty()) {
                logger.warn("Ignoring blank keyword term mapped to {}", entry.getValue());
                continue;
            }

            List<String> labels = new ArrayList<>();
            if (entry.getValue() != null) {
                for (String label : entry.getValue()) {
                    if (label != null && !label.isBlank()) labels.add(label);
                }
            }
            if (labels.isEmpty()) {
                logger.warn("Ignoring keyword term '{}' without labels", term);
                continue;
            }

            register(explicit, term, List.copyOf(labels));
        }

        Map<String, List<String>> index = new LinkedHashMap<>(explicit);
        for (Map.Entry<String, List<String>> entry : explicit.entrySet()) {
            String alias = stripWhitespace(entry.getKey());
            if (alias.equals(entry.getKey())) continue;

            List<String> configured = explicit.get(alias);
            if (configured != null) {
                if (!configured.equals(entry.getValue())) {
                    logger.warn("Keyword term '{}' is configured explicitly; ignoring it as an alias of '{}'",
                            alias, entry.getKey());
                }
                continue;
            }
            register(index, alias, entry.getValue());
        }

        logger.debug("Keyword dictionary built with {} indexed terms", index.size());
        return new KeywordDictionary(index);
    }

    /**
     Convenience factory for single-label entries.
     */
    public static KeywordDictionary ofSingleLabels(Map<String, String> entries) {
        Map<String, List<String>> expanded = new LinkedHashMap<>();
        entries.forEach((term, label) -> expanded.put(term, label == null ? List.of() : List.of(label)));
        return of(expanded);
    }

    private static void register(Map<String, List<String>> index, String term, List<String> labels) {
        List<String> previous = index.put(term, labels);
        if (previous != null && !previous.equals(labels)) {
            logger.debug("Keyword term '{}' redefined: {} -> {}", term, previous, labels);
        }
    }

    // --- Normalization ---

    static String normalizeTerm(String raw) {
        if (raw == null) return "";
        return WHITESPACE.matcher(raw.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    static String stripWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll("");
    }

    // --- Lookup ---

    /**
     Terms (both the spaced and the space-free forms) ordered by descending length.
     */
    public List<String> getTermsLongestFirst() {
        return termsLongestFirst;
    }

    /**
     Space-free form of each entry of {@link #getTermsLongestFirst()}, at the same index.
     */
    public List<String> getCompactTermsLongestFirst() {
        return compactTermsLongestFirst;
    }

    /**
     @return the labels for a normalized term, or an empty list when the term is unknown
     */
    public List<String> labelsFor(String term) {
        return labelsByTerm.getOrDefault(term, List.of());
    }

    public boolean containsTerm(String term) {
        return labelsByTerm.containsKey(term);
    }

    public int size() {
        return labelsByTerm.size();
    }

    public boolean isEmpty() {
        return labelsByTerm.isEmpty();
    }
}
