package com.coursepath.prereq.parser;

import com.coursepath.prereq.domain.CourseCodes;
import com.coursepath.prereq.domain.PrereqModels.ParsedPrerequisites;
import com.coursepath.prereq.domain.PrereqModels.PrerequisiteNode;
import com.coursepath.prereq.domain.PrereqModels.RequirementShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a prerequisite tree from catalog text.
 *
 * <p>General expressions produce one flat node: every course code found becomes
 * a direct child of a single AND or OR root. Parenthesized groups are not
 * distinguished, so "A and (B or C)" and "A and B or C" parse the same way;
 * any OR keyword in the full text, grade clauses included, makes the whole root OR.
 */
@Component
public class PrerequisiteParser {
    private static final Logger log = LoggerFactory.getLogger(PrerequisiteParser.class);

    private static final Pattern OR_KEYWORD = Pattern.compile("\\bor\\b|/|\\beither\\b", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> GRADE_CLAUSES = List.of(
            Pattern.compile("minimum\\s+(?:grade\\s+)?(?:of\\s+)?\\d+\\s*%(?:\\s+or\\s+higher)?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\d+\\s*%\\s+or\\s+higher", Pattern.CASE_INSENSITIVE),
            Pattern.compile("grade\\s+of\\s+[A-F][+-]?(?![A-Za-z])", Pattern.CASE_INSENSITIVE)
    );

    private final PrerequisiteNormalizer normalizer;
    private final PrerequisiteClassifier classifier;

    public PrerequisiteParser(PrerequisiteNormalizer normalizer, PrerequisiteClassifier classifier) {
        this.normalizer = normalizer;
        this.classifier = classifier;
    }

    public ParsedPrerequisites parse(String raw) {
        PrerequisiteNormalizer.NormalizedText normalized = normalizer.normalize(raw);
        List<String> warnings = new ArrayList<>(normalized.warnings());
        String text = normalized.text();
        if (normalized.isEmpty()) {
            return new ParsedPrerequisites(text, RequirementShape.NONE, null, warnings);
        }

        PrerequisiteClassifier.Classification classification = classifier.classify(text);
        ParsedPrerequisites parsed = switch (classification.shape()) {
            case LEVEL, PROGRAM -> {
                List<String> ignored = CourseCodes.extract(text);
                if (!ignored.isEmpty()) {
                    warnings.add("Course requirements not evaluated alongside "
                            + classification.shape().name().toLowerCase(Locale.ROOT) + " requirement: " + String.join(", ", ignored));
                }
                yield new ParsedPrerequisites(text, classification.shape(), PrerequisiteNode.leaf(classification.requirement()), warnings);
            }
            default -> parseExpression(text, warnings);
        };
        log.debug("Parsed prerequisites '{}' as {} ({} warnings)", text, parsed.shape(), parsed.warnings().size());
        return parsed;
    }

    private ParsedPrerequisites parseExpression(String text, List<String> warnings) {
        String expression = stripGradeClauses(text, warnings);
        List<String> codes = CourseCodes.extract(expression);

        if (codes.isEmpty()) {
            warnings.add("No course codes recognized in '" + text + "'; treated as no prerequisites");
            return new ParsedPrerequisites(text, RequirementShape.NONE, null, warnings);
        }
        if (codes.size() == 1) {
            return new ParsedPrerequisites(text, RequirementShape.EXPRESSION, PrerequisiteNode.course(codes.get(0)), warnings);
        }

        List<PrerequisiteNode> leaves = codes.stream().map(PrerequisiteNode::course).toList();
        PrerequisiteNode root = OR_KEYWORD.matcher(text).find()
                ? PrerequisiteNode.or(leaves)
                : PrerequisiteNode.and(leaves);
        return new ParsedPrerequisites(text, RequirementShape.EXPRESSION, root, warnings);
    }

    private String stripGradeClauses(String text, List<String> warnings) {
        String result = text;
        for (Pattern pattern : GRADE_CLAUSES) {
            Matcher matcher = pattern.matcher(result);
            StringBuilder sb = new StringBuilder();
            while (matcher.find()) {
                warnings.add("Minimum grade requirement not evaluated: '" + matcher.group() + "'");
                matcher.appendReplacement(sb, " ");
            }
            matcher.appendTail(sb);
            result = sb.toString();
        }
        return result;
    }
}
