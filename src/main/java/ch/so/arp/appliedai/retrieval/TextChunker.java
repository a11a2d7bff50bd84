package ch.so.arp.appliedai.retrieval;

import java.util.ArrayList;
import java.util.List;

import ch.so.arp.appliedai.error.AssistantException;

/**
 * Splits ingested text into contiguous fragments of bounded length. Fragments
 * never overlap and concatenating them in order yields the trimmed input.
 */
public final class TextChunker {

    public static final int DEFAULT_MAX_LENGTH = 800;

    private TextChunker() {
    }

    public static List<String> split(String text) {
        return split(text, DEFAULT_MAX_LENGTH);
    }

    /**
     * Partition the trimmed text into fragments of at most {@code maxLength}
     * characters. A fragment boundary is moved back by one character when it
     * would separate a surrogate pair.
     *
     * @param text      the raw text, {@code null} is treated as empty
     * @param maxLength the maximum fragment length, must be positive
     * @return the fragments in document order, empty for blank text
     */
    public static List<String> split(String text, int maxLength) {
        if (maxLength <= 0) {
            throw AssistantException.invalidInput("maxLength must be positive but was " + maxLength);
        }
        String trimmed = text == null ? "" : text.trim();
        List<String> fragments = new ArrayList<>();
        int start = 0;
        while (start < trimmed.length()) {
            int end = Math.min(trimmed.length(), start + maxLength);
            if (end < trimmed.length() && end - start > 1 && Character.isHighSurrogate(trimmed.charAt(end - 1))
                    && Character.isLowSurrogate(trimmed.charAt(end))) {
                end--;
            }
            fragments.add(trimmed.substring(start, end));
            start = end;
        }
        return fragments;
    }
}
