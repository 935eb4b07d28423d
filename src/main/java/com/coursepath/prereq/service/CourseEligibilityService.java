package com.coursepath.prereq.service;

import com.coursepath.prereq.domain.CourseCodes;
import com.coursepath.prereq.domain.PrereqModels.*;
import com.coursepath.prereq.parser.PrerequisiteParser;
import com.coursepath.prereq.recommendation.DifficultyScorer;
import com.coursepath.prereq.recommendation.PathSuggester;
import com.coursepath.prereq.repository.CourseCatalogJdbcRepository;
import com.coursepath.prereq.validation.PrerequisiteValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Answers prerequisite questions about courses stored in the catalog.
 */
@Service
public class CourseEligibilityService {
    private static final Logger log = LoggerFactory.getLogger(CourseEligibilityService.class);

    private final CourseCatalogJdbcRepository repository;
    private final PrerequisiteParser parser;
    private final PrerequisiteValidator validator;
    private final DifficultyScorer difficultyScorer;
    private final PathSuggester pathSuggester;

    public CourseEligibilityService(CourseCatalogJdbcRepository repository,
                                    PrerequisiteParser parser,
                                    PrerequisiteValidator validator,
                                    DifficultyScorer difficultyScorer,
                                    PathSuggester pathSuggester) {
        this.repository = repository;
        this.parser = parser;
        this.validator = validator;
        this.difficultyScorer = difficultyScorer;
        this.pathSuggester = pathSuggester;
    }

    public RegistrationResult registerCourses(List<CourseSummary> courses) {
        if (courses == null) return new RegistrationResult(0, 0, List.of());

        List<RegisteredCourse> registered = new ArrayList<>();
        int rejected = 0;
        for (CourseSummary course : courses) {
            if (course == null || course.code() == null || course.code().isBlank()) {
                rejected++;
                continue;
            }
            String code = CourseCodes.normalize(course.code());
            ParsedPrerequisites parsed = parser.parse(course.prerequisites());
            repository.upsert(new CourseSummary(code, course.title(), course.prerequisites()));
            registered.add(new RegisteredCourse(code, parsed.shape(), parsed.warnings()));
        }
        log.info("Registered {} catalog courses ({} rejected)", registered.size(), rejected);
        return new RegistrationResult(registered.size(), rejected, registered);
    }

    public Optional<CourseSummary> findCourse(String code) {
        return repository.findByCode(CourseCodes.normalize(code));
    }

    public Optional<CourseCheck> checkCourse(String code, StudentContext student) {
        return findCourse(code).map(course -> {
            ParsedPrerequisites parsed = parser.parse(course.prerequisites());
            ValidationResult validation = validator.validate(parsed, student);
            double difficulty = difficultyScorer.score(course.code(), parsed);
            List<String> path = pathSuggester.suggestPath(validation);
            return new CourseCheck(course.code(), course.title(), validation, difficulty, path);
        });
    }

    /** Catalog courses the student has not completed and may take now, by code. */
    public List<String> eligibleCourses(StudentContext student) {
        return repository.findAll().stream()
                .filter(course -> !student.completedCourses().contains(course.code()))
                .filter(course -> validator.validate(course.prerequisites(), student).satisfied())
                .map(CourseSummary::code)
                .sorted()
                .toList();
    }

    public record RegisteredCourse(String code, RequirementShape shape, List<String> warnings) {}

    public record RegistrationResult(int accepted, int rejected, List<RegisteredCourse> courses) {}

    public record CourseCheck(String code,
                              String title,
                              ValidationResult validation,
                              double difficulty,
                              List<String> suggestedPath) {}
}
