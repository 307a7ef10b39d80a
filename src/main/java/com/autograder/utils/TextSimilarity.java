package com.autograder.utils;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lexical comparisons between a student answer and the reference material of a question
 */
public final class TextSimilarity {

    private static final Set<String> STOPWORDS = new HashSet<>(Arrays.asList(
        "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is", "it", "its",
        "of", "on", "that", "the", "to", "was", "will", "with", "this", "but", "they", "have", "had",
        "what", "which", "she", "do", "how", "their", "if", "so", "some", "her", "would", "into", "him",
        "than", "been", "who", "were", "there", "them", "these", "those", "or", "not", "can", "also", "such"
    ));

    private TextSimilarity() {}

    /**
     * Lower-cases, collapses whitespace and drops punctuation
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}\\s]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    /**
     * Fraction of keywords found in the answer. Multi-word keywords must appear as a phrase.
     */
    public static double keywordCoverage(String answer, Collection<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return 0.0;
        }
        String haystack = " " + normalize(answer) + " ";
        int total = 0;
        int found = 0;
        for (String keyword : keywords) {
            String needle = normalize(keyword);
            if (needle.isEmpty()) {
                continue;
            }
            total++;
            if (haystack.contains(" " + needle + " ")) {
                found++;
            }
        }
        return total == 0 ? 0.0 : (double) found / total;
    }

    /**
     * Cosine similarity of the content-word frequency vectors of both texts
     */
    public static double wordOverlap(String text1, String text2) {
        Map<String, Integer> vector1 = createWordVector(normalize(text1));
        Map<String, Integer> vector2 = createWordVector(normalize(text2));
        return cosineSimilarity(vector1, vector2);
    }

    private static Map<String, Integer> createWordVector(String text) {
        Map<String, Integer> vector = new HashMap<>();
        if (text.isEmpty()) {
            return vector;
        }
        for (String word : text.split(" ")) {
            if (word.length() > 1 && !STOPWORDS.contains(word)) {
                vector.merge(word, 1, Integer::sum);
            }
        }
        return vector;
    }

    private static double cosineSimilarity(Map<String, Integer> vector1, Map<String, Integer> vector2) {
        Set<String> allWords = new HashSet<>(vector1.keySet());
        allWords.addAll(vector2.keySet());

        double dotProduct = 0.0;
        double norm1 = 0.0;
        double norm2 = 0.0;

        for (String word : allWords) {
            int freq1 = vector1.getOrDefault(word, 0);
            int freq2 = vector2.getOrDefault(word, 0);

            dotProduct += freq1 * freq2;
            norm1 += freq1 * freq1;
            norm2 += freq2 * freq2;
        }

        if (norm1 == 0 || norm2 == 0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(norm1) * Math.sqrt(norm2));
    }
}
