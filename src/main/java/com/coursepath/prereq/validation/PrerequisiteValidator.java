package com.coursepath.prereq.validation;

import com.coursepath.prereq.domain.PrereqModels.*;
import com.coursepath.prereq.parser.PrerequisiteParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Entry point for checking a student against a course's prerequisite text.
 * Holds no per-call state; safe to share between threads.
 */
@Service
public class PrerequisiteValidator {
    private static final Logger log = LoggerFactory.getLogger(PrerequisiteValidator.class);

    private final PrerequisiteParser parser;
    private final PrerequisiteEvaluator evaluator;

    public PrerequisiteValidator(PrerequisiteParser parser, PrerequisiteEvaluator evaluator) {
        this.parser = parser;
        this.evaluator = evaluator;
    }

    public ValidationResult validatePrerequisites(String coursePrereqs,
                                                  Collection<String> completedCourses,
                                                  int studentYear,
                                                  String studentProgram) {
        return validate(coursePrereqs, StudentContext.of(completedCourses, studentYear, studentProgram));
    }

    public ValidationResult validate(String coursePrereqs, StudentContext student) {
        return validate(parser.parse(coursePrereqs), student);
    }

    public ValidationResult validate(ParsedPrerequisites parsed, StudentContext student) {
        if (!parsed.hasTree()) {
            return ValidationResult.noPrerequisites(parsed.warnings());
        }

        Evaluation evaluation = evaluator.evaluate(parsed.tree(), student);
        List<String> warnings = new ArrayList<>(parsed.warnings());
        warnings.addAll(evaluation.warnings());

        log.debug("Validated '{}' for year {} / '{}': satisfied={}, missing={}",
                parsed.normalizedText(), student.year(), student.program(), evaluation.satisfied(), evaluation.missing());
        // grade clauses are detected but never turned into requirements
        return ValidationResult.of(evaluation, warnings);
    }
}
