package com.rcassist.infrastructure.ai.parsing;

import java.util.Optional;

/**
 * Finds the first top-level {@code { ... }} span in free text. Braces inside JSON string
 * literals, including escaped quotes, do not count.
 */
public final class JsonBlockLocator {

    private enum State { STRUCTURE, STRING, ESCAPE }

    /**
     * @param start      index of the opening brace
     * @param end        index one past the closing brace, or text length when unterminated
     * @param terminated false when the text ended before the braces balanced
     */
    public record JsonBlock(int start, int end, boolean terminated) {

        public String slice(String text) {
            return text.substring(start, end);
        }
    }

    private JsonBlockLocator() {
    }

    public static Optional<JsonBlock> locate(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int start = text.indexOf('{');
        if (start < 0) {
            return Optional.empty();
        }

        State state = State.STRUCTURE;
        int depth = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (state) {
                case STRING -> {
                    if (c == '\\') {
                        state = State.ESCAPE;
                    } else if (c == '"') {
                        state = State.STRUCTURE;
                    }
                }
                case ESCAPE -> state = State.STRING;
                case STRUCTURE -> {
                    if (c == '"') {
                        state = State.STRING;
                    } else if (c == '{') {
                        depth++;
                    } else if (c == '}') {
                        depth--;
                        if (depth == 0) {
                            return Optional.of(new JsonBlock(start, i + 1, true));
                        }
                    }
                }
            }
        }
        return Optional.of(new JsonBlock(start, text.length(), false));
    }
}
