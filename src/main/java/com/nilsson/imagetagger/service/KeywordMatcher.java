package com.nilsson.imagetagger.service;

import com.nilsson.imagetagger.data.KeywordDictionary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 <h2>KeywordMatcher</h2>
 <p>
 Turns free-form prompt text into a set of dictionary labels.
 </p>
 <h3>Matching rules:</h3>
 <ul>
 <li>The text is split on commas and every phrase is matched on its own.</li>
 <li>A phrase loses any {@code :weight} qualifier and its parentheses, then is lowercased and
 whitespace-collapsed, so {@code (Pine Tree:1.2)} becomes {@code pine tree}.</li>
 <li>The longest dictionary term that is a prefix of the remaining phrase wins and is consumed.
 When no term matches literally, the comparison is retried with all whitespace removed, which
 lets {@code sun set} hit {@code sunset}.</li>
 <li>When nothing matches, the leading word is dropped and matching resumes on the rest.</li>
 </ul>
 <p>
 The matcher holds no mutable state and can be shared across worker threads.
 </p>
 */
public class KeywordMatcher {

    private static final Logger logger = LoggerFactory.getLogger(KeywordMatcher.class);

    private static final Pattern QUALIFIER = Pattern.compile(":.*", Pattern.DOTALL);
    private static final Pattern PARENTHESES = Pattern.compile("[()]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final KeywordDictionary dictionary;

    @Inject
    public KeywordMatcher(KeywordDictionary dictionary) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
    }

    // ------------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------------

    /**
     Finds every label whose term occurs in {@code text}.

     @param text prompt text, may be {@code null}
     @return the distinct labels matched, in first-seen order
     */
    public Set<String> findKeywords(String text) {
        Set<String> matched = new LinkedHashSet<>();
        if (text == null || text.isBlank() || dictionary.isEmpty()) {
            return matched;
        }

        for (String phrase : text.split(",")) {
            matched.addAll(findKeywordsInPhrase(phrase));
        }
        return matched;
    }

    // ------------------------------------------------------------------------
    // Phrase Matching
    // ------------------------------------------------------------------------

    Set<String> findKeywordsInPhrase(String phrase) {
        Set<String> matches = new LinkedHashSet<>();
        String remaining = cleanPhrase(phrase);

        logger.trace("Processing phrase: {}", remaining);

        while (!remaining.isEmpty()) {
            Match match = findMatchAtStart(remaining);
            if (match == null) {
                remaining = dropLeadingWord(remaining);
                continue;
            }

            matches.addAll(dictionary.labelsFor(match.term));
            remaining = remaining.substring(match.consumed).trim();
        }

        return matches;
    }

    static String cleanPhrase(String phrase) {
        String cleaned = QUALIFIER.matcher(phrase).replaceFirst("");
        cleaned = PARENTHESES.matcher(cleaned).replaceAll("");
        cleaned = cleaned.toLowerCase(Locale.ROOT).trim();
        return WHITESPACE.matcher(cleaned).replaceAll(" ");
    }

    private Match findMatchAtStart(String text) {
        // Pass 1: literal prefix, spaces preserved
        for (String term : dictionary.getTermsLongestFirst()) {
            if (text.startsWith(term)) {
                return new Match(term, term.length());
            }
        }

        // Pass 2: prefix with all whitespace removed on both sides
        String compactText = WHITESPACE.matcher(text).replaceAll("");
        List<String> terms = dictionary.getTermsLongestFirst();
        List<String> compactTerms = dictionary.getCompactTermsLongestFirst();
        for (int i = 0; i < terms.size(); i++) {
            String compactTerm = compactTerms.get(i);
            if (!compactTerm.isEmpty() && compactText.startsWith(compactTerm)) {
                return new Match(terms.get(i), spanOfNonWhitespace(text, compactTerm.length()));
            }
        }

        return null;
    }

    /**
     Number of characters of {@code text} needed to cover {@code count} non-whitespace characters.
     */
    static int spanOfNonWhitespace(String text, int count) {
        int seen = 0;
        int index = 0;
        while (index < text.length() && seen < count) {
            if (!Character.isWhitespace(text.charAt(index))) {
                seen++;
            }
            index++;
        }
        return index;
    }

    private static String dropLeadingWord(String text) {
        int space = text.indexOf(' ');
        return space < 0 ? "" : text.substring(space + 1).trim();
    }

    private static final class Match {
        final String term;
        final int consumed;

        Match(String term, int consumed) {
            this.term = term;
            this.consumed = consumed;
        }
    }
}
