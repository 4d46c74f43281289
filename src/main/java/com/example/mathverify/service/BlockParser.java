package com.example.mathverify.service;

import com.example.mathverify.model.Heading;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a solution blob into its EXERCICE / SOLUTION / FINAL_ANSWER / CHECK blocks.
 * <p>
 * A heading is a line holding only {@code HEADING:} (blanks around the colon are tolerated).
 * Content runs until the next heading or end of text and is trimmed. Text with fewer
 * than two headings is considered unstructured and yields an empty mapping.
 */
@Service
public class BlockParser {

    private static final Pattern HEADING_LINE = Pattern.compile(
            "(?m)^[ \\t]*(EXERCICE|SOLUTION|FINAL_ANSWER|CHECK)[ \\t]*:[ \\t]*$");

    /** Minimum number of heading lines for the text to count as structured. */
    private static final int MIN_HEADINGS = 2;

    /**
     * @param text raw solution text, may be null
     * @return blocks by heading in heading order; empty when unstructured
     */
    public Map<Heading, String> extractBlocks(String text) {
        Map<Heading, String> blocks = new EnumMap<>(Heading.class);
        if (text == null || text.isBlank()) {
            return blocks;
        }

        String t = text.replace("\r\n", "\n");
        Matcher m = HEADING_LINE.matcher(t);

        int headings = 0;
        Heading current = null;
        int contentStart = -1;
        while (m.find()) {
            if (current != null) {
                blocks.put(current, t.substring(contentStart, m.start()).strip());
            }
            current = Heading.valueOf(m.group(1));
            contentStart = m.end();
            headings++;
        }
        if (current != null) {
            blocks.put(current, t.substring(contentStart).strip());
        }

        if (headings < MIN_HEADINGS) {
            blocks.clear();
        }
        return blocks;
    }

    /** Trimmed FINAL_ANSWER content, empty when absent or blank. */
    public Optional<String> getFinalAnswer(String text) {
        return block(text, Heading.FINAL_ANSWER);
    }

    /** Trimmed CHECK content, empty when absent or blank. */
    public Optional<String> getCheck(String text) {
        return block(text, Heading.CHECK);
    }

    /**
     * Renders blocks back into heading text, in heading order, skipping empty blocks.
     * Re-extracting the result yields the same trimmed content per heading.
     */
    public String rebuild(Map<Heading, String> blocks) {
        StringBuilder sb = new StringBuilder();
        for (Heading heading : Heading.values()) {
            String content = blocks.get(heading);
            if (content == null || content.isBlank()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(heading.name()).append(":\n").append(content.strip());
        }
        return sb.toString();
    }

    private Optional<String> block(String text, Heading heading) {
        String content = extractBlocks(text).get(heading);
        return content == null || content.isBlank() ? Optional.empty() : Optional.of(content);
    }
}
