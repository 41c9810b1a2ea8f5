package com.rcassist.infrastructure.ai.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rcassist.domain.analysis.model.ParsedReply;
import com.rcassist.domain.analysis.model.StructuredSection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Two-track parse of a model reply: the first JSON object becomes the structured fields, and
 * the whole text is independently scanned for headings, tables and lists so narrative written
 * outside the JSON is kept. Never throws for malformed replies; problems become warnings.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResponseParser {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS_TYPE = new TypeReference<>() {
    };

    // ```json fence left empty once the JSON span is cut out
    private static final Pattern OPEN_FENCE_BEFORE = Pattern.compile("```[A-Za-z]*[ \\t]*\\n?\\s*$");
    private static final Pattern CLOSE_FENCE_AFTER = Pattern.compile("^\\s*```[ \\t]*(?:\\n|$)");

    private final ObjectMapper objectMapper;

    public ParsedReply parse(String rawText) {
        List<String> warnings = new ArrayList<>();
        if (rawText == null || rawText.isBlank()) {
            warnings.add("model reply is empty");
            return new ParsedReply(Map.of(), List.of(), warnings);
        }

        String text = rawText.replace("\r\n", "\n").replace('\r', '\n');
        Map<String, Object> fields = Map.of();
        String scanText = text;

        Optional<JsonBlockLocator.JsonBlock> block = JsonBlockLocator.locate(text);
        if (block.isPresent()) {
            JsonBlockLocator.JsonBlock json = block.get();
            if (!json.terminated()) {
                warnings.add("structured JSON block is unterminated");
            } else {
                try {
                    fields = objectMapper.readValue(json.slice(text), FIELDS_TYPE);
                    scanText = removeSpan(text, json);
                } catch (JsonProcessingException e) {
                    warnings.add("structured JSON block could not be parsed: " + e.getOriginalMessage());
                }
            }
        }

        List<StructuredSection> sections = toSections(MarkdownSectionSplitter.split(scanText), warnings);

        log.info("[Parser] Parsed reply - fields: {}, sections: {}, warnings: {}",
                fields.size(), sections.size(), warnings.size());
        return new ParsedReply(fields, sections, warnings);
    }

    private List<StructuredSection> toSections(List<MarkdownSectionSplitter.Block> blocks, List<String> warnings) {
        List<StructuredSection> sections = new ArrayList<>();
        Set<String> usedKeys = new HashSet<>();

        for (MarkdownSectionSplitter.Block block : blocks) {
            String baseKey = block.isPreamble()
                    ? MarkdownSectionSplitter.PREAMBLE_KEY
                    : SectionKeyNormalizer.normalize(block.heading());
            String key = SectionKeyNormalizer.unique(baseKey, usedKeys);
            String heading = block.isPreamble() ? "" : block.heading();

            Optional<MarkdownTableExtractor.Extraction> table = MarkdownTableExtractor.extract(block.body());
            if (table.isPresent()) {
                for (MarkdownTableExtractor.DroppedRow row : table.get().droppedRows()) {
                    String warning = String.format("table '%s' row %d dropped: expected %d columns, got %d",
                            key, row.rowNumber(), table.get().table().columnCount(), row.cells());
                    log.warn("[Parser] {}", warning);
                    warnings.add(warning);
                }
                sections.add(StructuredSection.table(key, heading, block.body(), table.get().table()));
                continue;
            }

            Optional<List<String>> items = MarkdownTableExtractor.listItems(block.body());
            if (items.isPresent()) {
                sections.add(StructuredSection.list(key, heading, block.body(), items.get()));
            } else {
                sections.add(StructuredSection.narrative(key, heading, block.body()));
            }
        }
        return sections;
    }

    /**
     * Cuts the parsed JSON span out of the text, together with a code fence that would be left
     * empty around it.
     */
    static String removeSpan(String text, JsonBlockLocator.JsonBlock json) {
        String before = text.substring(0, json.start());
        String after = text.substring(json.end());

        Matcher open = OPEN_FENCE_BEFORE.matcher(before);
        Matcher close = CLOSE_FENCE_AFTER.matcher(after);
        if (open.find() && close.find()) {
            before = before.substring(0, open.start());
            after = after.substring(close.end());
        }
        return before + "\n" + after;
    }
}
