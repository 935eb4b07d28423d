package com.coursepath.prereq.validation;

import com.coursepath.prereq.domain.CourseCodes;
import com.coursepath.prereq.domain.PrereqModels.*;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Evaluates a prerequisite tree against a student.
 *
 * <p>An unsatisfied AND reports the concatenation, in child order, of each
 * unsatisfied child's missing list. An unsatisfied OR reports every child's
 * missing list, since no branch succeeded. Duplicates are kept in both cases.
 * Warnings from all children are concatenated whatever the outcome.
 */
@Component
public class PrerequisiteEvaluator {

    public Evaluation evaluate(PrerequisiteNode node, StudentContext student) {
        if (node.isLeaf()) {
            boolean satisfied = isMet(node.requirement(), student);
            return new Evaluation(satisfied, satisfied ? List.of() : List.of(node.requirement()), List.of());
        }

        List<Evaluation> results = node.children().stream().map(child -> evaluate(child, student)).toList();
        List<Requirement> unmet = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        results.forEach(r -> warnings.addAll(r.warnings()));

        boolean satisfied = node.operator() == Operator.OR
                ? results.stream().anyMatch(Evaluation::satisfied)
                : results.stream().allMatch(Evaluation::satisfied);
        if (!satisfied) {
            results.stream().filter(r -> !r.satisfied()).forEach(r -> unmet.addAll(r.unmet()));
        }
        return new Evaluation(satisfied, unmet, warnings);
    }

    private boolean isMet(Requirement requirement, StudentContext student) {
        if (requirement instanceof CourseRequirement course) {
            return student.completedCourses().contains(CourseCodes.normalize(course.code()));
        }
        if (requirement instanceof LevelRequirement level) {
            return student.year() >= level.year();
        }
        if (requirement instanceof ProgramRequirement program) {
            String required = program.name().toLowerCase(Locale.ROOT);
            String enrolled = student.program().toLowerCase(Locale.ROOT);
            return enrolled.contains(required) || (!enrolled.isEmpty() && required.contains(enrolled));
        }
        throw new IllegalArgumentException("Unsupported requirement: " + requirement);
    }
}
