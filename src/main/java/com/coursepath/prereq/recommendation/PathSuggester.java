package com.coursepath.prereq.recommendation;

import com.coursepath.prereq.config.PrereqProperties;
import com.coursepath.prereq.domain.PrereqModels.*;
import com.coursepath.prereq.validation.PrerequisiteValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Lists the courses a student still needs for a target course.
 *
 * <p>This is a flat re-export of the validator's unmet course requirements in
 * evaluator order, with standing and enrollment entries removed. It does not
 * search prerequisite chains; {@code availableCourses} is reserved for that and
 * currently unused.
 */
@Service
public class PathSuggester {
    private static final Logger log = LoggerFactory.getLogger(PathSuggester.class);

    private final PrerequisiteValidator validator;
    private final PrereqProperties properties;

    public PathSuggester(PrerequisiteValidator validator, PrereqProperties properties) {
        this.validator = validator;
        this.properties = properties;
    }

    public List<String> suggestPath(String targetCourse,
                                    String targetPrereqs,
                                    Collection<String> completedCourses,
                                    List<CourseSummary> availableCourses) {
        PrereqProperties.Defaults defaults = properties.getDefaults();
        return suggestPath(targetCourse, targetPrereqs,
                StudentContext.of(completedCourses, defaults.getStudentYear(), defaults.getStudentProgram()),
                availableCourses);
    }

    public List<String> suggestPath(String targetCourse,
                                    String targetPrereqs,
                                    StudentContext student,
                                    List<CourseSummary> availableCourses) {
        List<String> path = suggestPath(validator.validate(targetPrereqs, student));
        log.debug("Suggested path for {}: {}", targetCourse, path);
        return path;
    }

    /** Path from an already computed validation, for callers that have parsed the text themselves. */
    public List<String> suggestPath(ValidationResult validation) {
        if (validation.satisfied()) {
            return List.of();
        }
        return validation.unmetRequirements().stream()
                .filter(CourseRequirement.class::isInstance)
                .map(Requirement::missingLabel)
                .toList();
    }
}
