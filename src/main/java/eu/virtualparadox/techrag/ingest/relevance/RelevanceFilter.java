package eu.virtualparadox.techrag.ingest.relevance;

import eu.virtualparadox.techrag.application.config.DomainVocabularyProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical domain-relevance heuristic.
 * <p>
 * A text is relevant when at least {@code minMatches} distinct vocabulary entries (topics
 * and keywords combined) occur in it as whole words or phrases, compared case-insensitively.
 * The result is a tag only; callers never drop content because of it.
 * </p>
 * <p>Stateless after construction and therefore thread-safe.</p>
 */
@Component
public class RelevanceFilter {

    private final List<Pattern> vocabulary;
    private final int minMatches;

    @Autowired
    public RelevanceFilter(final DomainVocabularyProperties properties) {
        this(properties.getTopics(), properties.getKeywords(), properties.getMinMatches());
    }

    public RelevanceFilter(final Collection<String> topics,
                           final Collection<String> keywords,
                           final int minMatches) {
        if (minMatches <= 0) {
            throw new IllegalArgumentException("minMatches must be positive");
        }
        // topics and keywords may overlap; a term is counted once
        final Set<String> terms = new LinkedHashSet<>();
        addTerms(terms, topics);
        addTerms(terms, keywords);

        this.vocabulary = terms.stream()
                .map(RelevanceFilter::wholeTermPattern)
                .toList();
        this.minMatches = minMatches;
    }

    /**
     * @param text chunk or document text, may be null
     * @return {@code true} iff the combined vocabulary match count reaches the threshold
     */
    public boolean isDomainRelevant(final String text) {
        return countMatches(text) >= minMatches;
    }

    /**
     * Number of distinct vocabulary entries present in {@code text}.
     */
    public int countMatches(final String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        final String lower = text.toLowerCase(Locale.ROOT);
        int matches = 0;
        for (final Pattern term : vocabulary) {
            if (term.matcher(lower).find()) {
                matches++;
            }
        }
        return matches;
    }

    private static void addTerms(final Set<String> target, final Collection<String> source) {
        if (source == null) {
            return;
        }
        for (final String term : source) {
            if (term != null && !term.isBlank()) {
                target.add(term.trim().toLowerCase(Locale.ROOT));
            }
        }
    }

    private static Pattern wholeTermPattern(final String term) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(term) + "(?![\\p{L}\\p{N}])");
    }
}
