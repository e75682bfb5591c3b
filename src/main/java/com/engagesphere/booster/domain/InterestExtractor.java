package com.engagesphere.booster.domain;

import com.engagesphere.booster.domain.model.Event;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Derives interest keywords from an event's name and description.
 */
@Component
public class InterestExtractor {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^a-z0-9]+");
    private static final int MIN_KEYWORD_LENGTH = 3;

    static final Set<String> STOP_WORDS = Set.of(
            "a", "about", "above", "after", "again", "against", "all", "also", "am", "an", "and", "any",
            "are", "as", "at", "be", "because", "been", "before", "being", "below", "between", "both",
            "but", "by", "can", "could", "did", "do", "does", "doing", "down", "during", "each", "event",
            "few", "for", "from", "further", "had", "has", "have", "having", "he", "her", "here", "hers",
            "him", "his", "how", "into", "is", "it", "its", "join", "just", "more", "most", "not", "now",
            "off", "once", "only", "other", "our", "ours", "out", "over", "own", "same", "she", "should",
            "some", "such", "than", "that", "the", "their", "theirs", "them", "then", "there", "these",
            "they", "this", "those", "through", "too", "under", "until", "very", "was", "we", "were",
            "what", "when", "where", "which", "while", "who", "whom", "why", "will", "with", "would",
            "you", "your", "yours"
    );

    public SortedSet<String> extract(Event event) {
        String text = (nullToEmpty(event.name()) + " " + nullToEmpty(event.description()))
                .toLowerCase(Locale.ROOT);

        SortedSet<String> keywords = new TreeSet<>();
        Arrays.stream(TOKEN_SEPARATOR.split(text))
                .filter(token -> token.length() >= MIN_KEYWORD_LENGTH)
                .filter(token -> !STOP_WORDS.contains(token))
                .forEach(keywords::add);
        return keywords;
    }

    /**
     * Union of the existing interests and the event's keywords, lowercased and sorted
     */
    public SortedSet<String> merge(Set<String> existing, Event event) {
        SortedSet<String> merged = new TreeSet<>();
        existing.stream()
                .map(interest -> interest.trim().toLowerCase(Locale.ROOT))
                .filter(interest -> !interest.isEmpty())
                .forEach(merged::add);
        merged.addAll(extract(event));
        return merged;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
