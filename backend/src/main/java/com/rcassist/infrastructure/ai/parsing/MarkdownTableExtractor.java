package com.rcassist.infrastructure.ai.parsing;

import com.rcassist.domain.analysis.model.TableContent;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds the first pipe table in a block of markdown. Rows whose cell count differs from the
 * header are reported, never padded or truncated.
 */
public final class MarkdownTableExtractor {

    private static final Pattern SEPARATOR_LINE = Pattern.compile("^[\\s|:\\-]+$");
    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*(?:[-*+]|\\d+[.)])\\s+(.+)$");

    /**
     * @param rowNumber 1-based position among the data rows
     * @param cells     cell count of the rejected row
     */
    public record DroppedRow(int rowNumber, int cells) {
    }

    public record Extraction(TableContent table, List<DroppedRow> droppedRows) {
    }

    private MarkdownTableExtractor() {
    }

    public static Optional<Extraction> extract(String body) {
        if (body == null || body.indexOf('|') < 0) {
            return Optional.empty();
        }
        String[] lines = body.split("\n", -1);
        for (int i = 0; i + 1 < lines.length; i++) {
            if (countUnescapedPipes(lines[i]) >= 2 && isSeparator(lines[i + 1])) {
                return Optional.of(readTable(lines, i));
            }
        }
        return Optional.empty();
    }

    /**
     * List entries when every non-blank line of the block is a bullet or numbered item.
     */
    public static Optional<List<String>> listItems(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        List<String> items = new ArrayList<>();
        for (String line : body.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            var matcher = LIST_ITEM.matcher(line);
            if (!matcher.matches()) {
                return Optional.empty();
            }
            items.add(matcher.group(1).strip());
        }
        return items.isEmpty() ? Optional.empty() : Optional.of(items);
    }

    private static Extraction readTable(String[] lines, int headerIndex) {
        List<String> headers = splitCells(lines[headerIndex]);
        List<List<String>> rows = new ArrayList<>();
        List<DroppedRow> dropped = new ArrayList<>();

        int rowNumber = 0;
        for (int i = headerIndex + 2; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank() || countUnescapedPipes(line) == 0) {
                break;
            }
            rowNumber++;
            List<String> cells = splitCells(line);
            if (cells.size() == headers.size()) {
                rows.add(cells);
            } else {
                dropped.add(new DroppedRow(rowNumber, cells.size()));
            }
        }
        return new Extraction(new TableContent(headers, rows), dropped);
    }

    static boolean isSeparator(String line) {
        return SEPARATOR_LINE.matcher(line).matches() && line.indexOf('-') >= 0 && line.indexOf('|') >= 0;
    }

    static List<String> splitCells(String line) {
        String trimmed = line.strip();
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c == '\\' && i + 1 < trimmed.length() && trimmed.charAt(i + 1) == '|') {
                cell.append('|');
                i++;
            } else if (c == '|') {
                cells.add(cell.toString().strip());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString().strip());

        // outer pipes produce empty edge cells
        if (trimmed.startsWith("|")) {
            cells.remove(0);
        }
        if (!cells.isEmpty() && trimmed.endsWith("|") && !trimmed.endsWith("\\|")) {
            cells.remove(cells.size() - 1);
        }
        return cells;
    }

    static int countUnescapedPipes(String line) {
        int count = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '|') {
                count++;
            }
        }
        return count;
    }
}
