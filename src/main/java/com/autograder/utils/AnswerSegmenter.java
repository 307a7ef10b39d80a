package com.autograder.utils;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits extracted answer-sheet text into per-question answers.
 *
 * <p>A question marker sits at the start of a line and reads {@code Q<N>}, {@code Q.<N>},
 * {@code Ques <N>}, {@code Question <N>}, {@code Ans <N>} or {@code Answer <N>} (any case),
 * followed by one of {@code : . ) -} or by the end of the line. Everything after a marker up to the
 * next marker (or the end of the text) is that question's answer, line breaks included.
 *
 * <p>Text before the first marker is ignored. Blank answers are left out of the result. When a
 * question number appears more than once, the last non-blank answer replaces earlier ones.
 */
public final class AnswerSegmenter {

    static final Pattern QUESTION_MARKER = Pattern.compile(
            "^[ \\t]*(?:q(?:ues(?:tion)?)?|ans(?:wer)?)[ \\t]*\\.?[ \\t]*(\\d{1,4})[ \\t]*(?:[.:)\\-]|$)",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private AnswerSegmenter() {}

    /**
     * @return question number to answer text, in ascending question order; never null
     */
    public static SortedMap<Integer, String> segment(String text) {
        SortedMap<Integer, String> answers = new TreeMap<>();
        if (text == null || text.isBlank()) {
            return Collections.unmodifiableSortedMap(answers);
        }

        Matcher matcher = QUESTION_MARKER.matcher(text);
        Integer currentQuestion = null;
        int answerStart = 0;

        while (matcher.find()) {
            if (currentQuestion != null) {
                putAnswer(answers, currentQuestion, text.substring(answerStart, matcher.start()));
            }
            currentQuestion = Integer.parseInt(matcher.group(1));
            answerStart = matcher.end();
        }
        if (currentQuestion != null) {
            putAnswer(answers, currentQuestion, text.substring(answerStart));
        }

        return Collections.unmodifiableSortedMap(answers);
    }

    private static void putAnswer(SortedMap<Integer, String> answers, int questionNumber, String raw) {
        String answer = raw.strip();
        if (!answer.isEmpty()) {
            answers.put(questionNumber, answer);
        }
    }
}
