package com.coursepath.prereq.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Course code helpers shared by parsing, evaluation and scoring.
 */
public final class CourseCodes {
    /** Department of 2-5 capitals, optional space, three digits, optional suffix letter. */
    public static final Pattern COURSE_CODE = Pattern.compile("([A-Z]{2,5})\\s?(\\d{3}[A-Z]?)");

    private static final Pattern LOOSE_COURSE_CODE = Pattern.compile("([A-Z]{2,5})\\s*(\\d{3}[A-Z]?)");
    private static final Pattern NON_ALNUM = Pattern.compile("[^A-Z0-9]+");
    private static final Pattern LETTER_DIGIT = Pattern.compile("([A-Z])(\\d)");
    private static final Pattern FIRST_DIGIT = Pattern.compile("\\d");

    private CourseCodes() {}

    /**
     * Canonical "DEPT NUM" form used for set membership: upper-cased, separators
     * replaced by spaces, department split from number, first two tokens kept.
     * Applying it twice gives the same result as applying it once.
     */
    public static String normalize(String code) {
        if (code == null) return "";
        String upper = NON_ALNUM.matcher(code.toUpperCase(Locale.ROOT)).replaceAll(" ");
        String[] parts = LETTER_DIGIT.matcher(upper).replaceFirst("$1 $2").trim().split("\\s+");
        if (parts.length >= 2) {
            return parts[0] + " " + parts[1];
        }
        return parts[0];
    }

    /** Re-spaces every embedded code so that "ECE240" reads "ECE 240". */
    public static String respace(String text) {
        return LOOSE_COURSE_CODE.matcher(text).replaceAll("$1 $2");
    }

    public static List<String> extract(String text) {
        List<String> codes = new ArrayList<>();
        Matcher matcher = COURSE_CODE.matcher(text);
        while (matcher.find()) {
            codes.add(matcher.group(1) + " " + matcher.group(2));
        }
        return codes;
    }

    /**
     * First digit of the numeric part, so "CS 444" is level 4. Codes without a
     * number are treated as first-level courses.
     */
    public static int level(String code) {
        String normalized = normalize(code);
        int space = normalized.indexOf(' ');
        String numeric = space < 0 ? normalized : normalized.substring(space + 1);
        Matcher matcher = FIRST_DIGIT.matcher(numeric);
        return matcher.find() ? Character.digit(numeric.charAt(matcher.start()), 10) : 1;
    }
}
