package com.jreinhal.hragent.citation;

import com.jreinhal.hragent.constant.StopWords;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the part of a passage that explains why it matched the question.
 *
 * <p>Each sentence is scored by the summed length of the question keywords it contains (longer
 * words are more specific). The best sentence is returned with one sentence of context on each
 * side, cut to the maximum length at a sentence end when that keeps most of the text.</p>
 */
public final class ExcerptExtractor {

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
    private static final double MIN_KEPT_FRACTION = 0.7;
    private static final String ELLIPSIS = "...";

    private ExcerptExtractor() {
    }

    public static String extract(String content, String query, int maxLength) {
        if (content == null || content.isEmpty() || query == null || query.isEmpty()) {
            return prefix(content == null ? "" : content, maxLength);
        }
        Set<String> keywords = keywords(query);
        if (keywords.isEmpty()) {
            return prefix(content, maxLength);
        }

        String[] sentences = SENTENCE_BREAK.split(content, -1);
        int bestIndex = -1;
        int bestScore = 0;
        for (int i = 0; i < sentences.length; i++) {
            String lower = sentences[i].toLowerCase(Locale.ROOT);
            int score = 0;
            for (String keyword : keywords) {
                if (lower.contains(keyword)) {
                    score += keyword.length();
                }
            }
            if (score > bestScore) {
                bestScore = score;
                bestIndex = i;
            }
        }
        if (bestIndex < 0) {
            return prefix(content, maxLength);
        }

        int start = Math.max(0, bestIndex - 1);
        int end = Math.min(sentences.length, bestIndex + 2);
        String excerpt = String.join(" ", Arrays.copyOfRange(sentences, start, end));
        if (excerpt.length() <= maxLength) {
            return excerpt;
        }
        String truncated = excerpt.substring(0, maxLength);
        int lastSentenceEnd = Math.max(truncated.lastIndexOf('.'),
                Math.max(truncated.lastIndexOf('!'), truncated.lastIndexOf('?')));
        if (lastSentenceEnd > maxLength * MIN_KEPT_FRACTION) {
            return truncated.substring(0, lastSentenceEnd + 1) + ELLIPSIS;
        }
        return truncated + ELLIPSIS;
    }

    static Set<String> keywords(String query) {
        Set<String> words = new LinkedHashSet<>();
        Matcher matcher = WORD.matcher(query.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (!StopWords.EXCERPT_KEYWORDS.contains(word)) {
                words.add(word);
            }
        }
        return words;
    }

    private static String prefix(String content, int maxLength) {
        if (content.length() <= maxLength) {
            return content;
        }
        return content.substring(0, maxLength) + ELLIPSIS;
    }
}
