package com.example.CourseRag.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class SentenceSplitter {

    private SentenceSplitter() {
    }

    /**
     * Sentence boundary: terminal punctuation (optionally followed by a closing quote or bracket)
     * and whitespace, unless the punctuation belongs to a short abbreviation such as "e.g." or "Dr.".
     */
    private static final Pattern BOUNDARY = Pattern.compile(
            "(?<!\\b\\p{Alpha}\\.\\p{Alpha}\\.)(?<!\\b(?:Mr|Mrs|Ms|Dr|Prof|vs|etc)\\.)(?<=[.!?][\"')\\]]?)\\s+"
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static List<String> split(String text) {
        if (text == null) {
            return List.of();
        }
        String normalized = WHITESPACE.matcher(text).replaceAll(" ").trim();
        if (normalized.isEmpty()) {
            return List.of();
        }

        List<String> sentences = new ArrayList<>();
        for (String part : BOUNDARY.split(normalized)) {
            String sentence = part.trim();
            if (!sentence.isEmpty()) {
                sentences.add(sentence);
            }
        }
        return sentences;
    }
}
