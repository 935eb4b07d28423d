package com.coursepath.prereq.parser;

import com.coursepath.prereq.config.PrereqProperties;
import com.coursepath.prereq.domain.CourseCodes;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw catalog prerequisite text: strips markup, catalog metadata
 * and the "Prereq:" prefix, cuts co/antirequisite clauses, re-spaces course
 * codes and collapses whitespace.
 */
@Component
public class PrerequisiteNormalizer {
    private static final Set<String> EMPTY_LITERALS = Set.of("", "none", "n/a", "null");

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final List<Pattern> CATALOG_NOISE = List.of(
            Pattern.compile("Course ID:\\s*\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\[Offered:.*?]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\(Credit course for designated students only\\)", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern PREFIX = Pattern.compile("^prereq(?:uisites?)?\\s*:?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern SIDE_REQUISITE = Pattern.compile("\\b(?:anti|co)req(?:uisites?)?\\s*:?.*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s.;,]+$");

    private final PrereqProperties properties;

    public PrerequisiteNormalizer(PrereqProperties properties) {
        this.properties = properties;
    }

    public NormalizedText normalize(String raw) {
        List<String> warnings = new ArrayList<>();
        if (isEmptyLiteral(raw)) {
            return new NormalizedText("", warnings);
        }

        String text = HTML_TAG.matcher(raw).replaceAll(" ");
        for (Pattern noise : CATALOG_NOISE) {
            text = noise.matcher(text).replaceAll(" ");
        }
        text = collapse(text);
        text = PREFIX.matcher(text).replaceFirst("");

        Matcher side = SIDE_REQUISITE.matcher(text);
        if (side.find()) {
            warnings.add("Ignored co/antirequisite clause: '" + side.group().trim() + "'");
            text = text.substring(0, side.start());
        }

        text = collapse(CourseCodes.respace(text));
        text = TRAILING_PUNCTUATION.matcher(text).replaceAll("");
        if (isEmptyLiteral(text)) {
            return new NormalizedText("", warnings);
        }

        if (text.length() > properties.getNormalizer().getMaxLength()) {
            warnings.add("Prerequisite text is very long (" + text.length() + " characters)");
        }
        return new NormalizedText(text, warnings);
    }

    /** True for null, blank, "none", "n/a" and "null" in any case, with or without a final period. */
    public static boolean isEmptyLiteral(String text) {
        if (text == null) return true;
        String value = text.trim().toLowerCase(Locale.ROOT);
        if (value.endsWith(".")) {
            value = value.substring(0, value.length() - 1).trim();
        }
        return EMPTY_LITERALS.contains(value);
    }

    private String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public record NormalizedText(String text, List<String> warnings) {
        public NormalizedText {
            warnings = List.copyOf(warnings);
        }

        public boolean isEmpty() {
            return text.isEmpty();
        }
    }
}
