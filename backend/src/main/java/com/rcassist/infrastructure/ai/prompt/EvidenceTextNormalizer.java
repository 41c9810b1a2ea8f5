package com.rcassist.infrastructure.ai.prompt;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Cleans extracted evidence text before it goes into a prompt:
 * - Unicode NFC normalization
 * - Invisible/control character removal
 * - Whitespace normalization (collapse runs, trim)
 */
@Component
public class EvidenceTextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except \n and \t; form feeds from PDF page breaks included
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    private static final Pattern TRAILING_SPACES = Pattern.compile("[ \\t]+\\n");

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t]{2,}");

    // 3+ consecutive newlines → 2 newlines
    private static final Pattern EXCESSIVE_NEWLINES = Pattern.compile("\\n{3,}");

    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        result = result.replace("\r\n", "\n").replace('\r', '\n');
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = TRAILING_SPACES.matcher(result).replaceAll("\n");
        result = MULTIPLE_SPACES.matcher(result).replaceAll(" ");
        result = EXCESSIVE_NEWLINES.matcher(result).replaceAll("\n\n");
        return result.strip();
    }
}
