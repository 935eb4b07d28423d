package com.coursepath.prereq.parser;

import com.coursepath.prereq.domain.PrereqModels.LevelRequirement;
import com.coursepath.prereq.domain.PrereqModels.ProgramRequirement;
import com.coursepath.prereq.domain.PrereqModels.Requirement;
import com.coursepath.prereq.domain.PrereqModels.RequirementShape;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Routes normalized prerequisite text to one of three shapes. Standing wins
 * over program enrollment, which wins over a general course expression.
 */
@Component
public class PrerequisiteClassifier {
    private static final List<Pattern> LEVEL_PATTERNS = List.of(
            Pattern.compile("\\d+[A-Z]*\\s+standing", Pattern.CASE_INSENSITIVE),
            Pattern.compile("year\\s+\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\d+[A-Z]*\\s+year", Pattern.CASE_INSENSITIVE),
            Pattern.compile("level\\s+\\d+[A-Z]*", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern PROGRAM_PATTERN = Pattern.compile(
            "(?:enroll?(?:ed)?\\s+in|admission\\s+to|faculty\\s+of|students?\\s+in)(?:\\s+(.+))?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DIGITS = Pattern.compile("\\d{1,6}");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s.;,:]+$");

    public Classification classify(String text) {
        if (hasLevelClause(text)) {
            // first digit run anywhere in the text, not only inside the standing clause
            Matcher digits = DIGITS.matcher(text);
            int year = digits.find() ? Integer.parseInt(digits.group()) : 1;
            return new Classification(RequirementShape.LEVEL, new LevelRequirement(year));
        }

        Matcher program = PROGRAM_PATTERN.matcher(text);
        if (program.find()) {
            String name = program.group(1) == null ? "" : TRAILING_PUNCTUATION.matcher(program.group(1).trim()).replaceAll("");
            name = name.isEmpty() ? "UNKNOWN" : name.toUpperCase(Locale.ROOT);
            return new Classification(RequirementShape.PROGRAM, new ProgramRequirement(name));
        }

        return new Classification(RequirementShape.EXPRESSION, null);
    }

    private boolean hasLevelClause(String text) {
        return LEVEL_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }

    /** Requirement is null for {@link RequirementShape#EXPRESSION}; the parser builds that tree. */
    public record Classification(RequirementShape shape, Requirement requirement) {}
}
