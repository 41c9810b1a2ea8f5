package com.rcassist.infrastructure.ai.parsing;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits markdown into heading-delimited blocks. Recognizes ATX headings ({@code #} to
 * {@code ######}) and short bold lines used as pseudo-headings ({@code **Root Cause:**}).
 * Lines inside fenced code blocks are never headings.
 */
public final class MarkdownSectionSplitter {

    static final String PREAMBLE_KEY = "preamble";

    private static final Pattern ATX_HEADING = Pattern.compile("^ {0,3}#{1,6}\\s+(.+?)(?:\\s+#+)?\\s*$");
    private static final Pattern BOLD_HEADING = Pattern.compile("^\\s*(?:\\*\\*|__)((?:(?!\\*\\*|__).){1,80}?)(?:\\*\\*|__)\\s*:?\\s*$");
    private static final Pattern FENCE = Pattern.compile("^\\s*(```|~~~)");
    private static final Pattern HORIZONTAL_RULE = Pattern.compile("^\\s*([-*_])(\\s*\\1){2,}\\s*$");
    private static final Pattern EMPHASIS_EDGES = Pattern.compile("^[*_\\s]+|[*_\\s:]+$");

    /**
     * A heading and the lines under it, up to the next heading.
     *
     * @param heading heading text without markers, null for text before the first heading
     * @param body    body with leading and trailing blank or rule lines removed
     */
    public record Block(String heading, String body) {

        public boolean isPreamble() {
            return heading == null;
        }
    }

    private MarkdownSectionSplitter() {
    }

    public static List<Block> split(String text) {
        List<Block> blocks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return blocks;
        }

        String currentHeading = null;
        List<String> currentLines = new ArrayList<>();
        boolean inFence = false;

        for (String line : text.split("\n", -1)) {
            if (FENCE.matcher(line).find()) {
                inFence = !inFence;
                currentLines.add(line);
                continue;
            }
            String heading = inFence ? null : headingOf(line);
            if (heading == null) {
                currentLines.add(line);
                continue;
            }
            addBlock(blocks, currentHeading, currentLines);
            currentHeading = heading;
            currentLines = new ArrayList<>();
        }
        addBlock(blocks, currentHeading, currentLines);
        return blocks;
    }

    static String headingOf(String line) {
        Matcher atx = ATX_HEADING.matcher(line);
        if (atx.matches()) {
            String heading = EMPHASIS_EDGES.matcher(atx.group(1)).replaceAll("");
            return heading.isEmpty() ? atx.group(1).strip() : heading;
        }
        Matcher bold = BOLD_HEADING.matcher(line);
        if (bold.matches()) {
            String heading = EMPHASIS_EDGES.matcher(bold.group(1)).replaceAll("");
            return heading.isEmpty() ? null : heading;
        }
        return null;
    }

    private static void addBlock(List<Block> blocks, String heading, List<String> lines) {
        String body = trimBody(lines);
        if (heading == null && body.isEmpty()) {
            return;
        }
        blocks.add(new Block(heading, body));
    }

    private static String trimBody(List<String> lines) {
        int from = 0;
        int to = lines.size();
        while (from < to && isFiller(lines.get(from))) {
            from++;
        }
        while (to > from && isFiller(lines.get(to - 1))) {
            to--;
        }
        return String.join("\n", lines.subList(from, to));
    }

    private static boolean isFiller(String line) {
        return line.isBlank() || HORIZONTAL_RULE.matcher(line).matches();
    }
}
