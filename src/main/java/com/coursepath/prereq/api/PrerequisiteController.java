package com.coursepath.prereq.api;

import com.coursepath.prereq.config.PrereqProperties;
import com.coursepath.prereq.domain.PrereqModels;
import com.coursepath.prereq.parser.PrerequisiteParser;
import com.coursepath.prereq.recommendation.DifficultyScorer;
import com.coursepath.prereq.recommendation.PathSuggester;
import com.coursepath.prereq.repository.CourseCatalogJdbcRepository;
import com.coursepath.prereq.validation.PrerequisiteValidator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/prerequisites")
public class PrerequisiteController {
    private final PrerequisiteParser parser;
    private final PrerequisiteValidator validator;
    private final DifficultyScorer difficultyScorer;
    private final PathSuggester pathSuggester;
    private final CourseCatalogJdbcRepository catalog;
    private final PrereqProperties properties;

    public PrerequisiteController(PrerequisiteParser parser,
                                  PrerequisiteValidator validator,
                                  DifficultyScorer difficultyScorer,
                                  PathSuggester pathSuggester,
                                  CourseCatalogJdbcRepository catalog,
                                  PrereqProperties properties) {
        this.parser = parser;
        this.validator = validator;
        this.difficultyScorer = difficultyScorer;
        this.pathSuggester = pathSuggester;
        this.catalog = catalog;
        this.properties = properties;
    }

    @PostMapping("/parse")
    public ResponseEntity<PrereqModels.ParsedPrerequisites> parse(@RequestBody ParseRequest request) {
        return ResponseEntity.ok(parser.parse(request.prerequisites()));
    }

    @PostMapping("/validate")
    public ResponseEntity<PrereqModels.ValidationResult> validate(@RequestBody ValidateRequest request) {
        if (request.prerequisites() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "prerequisites is required");
        }
        return ResponseEntity.ok(validator.validate(request.prerequisites(),
                student(request.completedCourses(), request.studentYear(), request.studentProgram())));
    }

    @PostMapping("/difficulty")
    public ResponseEntity<DifficultyResponse> difficulty(@RequestBody DifficultyRequest request) {
        if (request.courseCode() == null || request.courseCode().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "courseCode is required");
        }
        return ResponseEntity.ok(new DifficultyResponse(request.courseCode(),
                difficultyScorer.score(request.courseCode(), request.prerequisites())));
    }

    @PostMapping("/path")
    public ResponseEntity<PathResponse> path(@RequestBody PathRequest request) {
        if (request.targetCourse() == null || request.targetCourse().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "targetCourse is required");
        }
        List<String> path = pathSuggester.suggestPath(request.targetCourse(), request.targetPrereqs(),
                student(request.completedCourses(), request.studentYear(), request.studentProgram()),
                catalog.findAll());
        return ResponseEntity.ok(new PathResponse(request.targetCourse(), path));
    }

    private PrereqModels.StudentContext student(List<String> completed, Integer year, String program) {
        if (year != null && year < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "studentYear must be at least 1");
        }
        PrereqProperties.Defaults defaults = properties.getDefaults();
        return PrereqModels.StudentContext.of(completed,
                year == null ? defaults.getStudentYear() : year,
                program == null ? defaults.getStudentProgram() : program);
    }

    public record ParseRequest(String prerequisites) {}

    public record ValidateRequest(String prerequisites, List<String> completedCourses, Integer studentYear, String studentProgram) {}

    public record DifficultyRequest(String courseCode, String prerequisites) {}

    public record DifficultyResponse(String courseCode, double score) {}

    public record PathRequest(String targetCourse, String targetPrereqs, List<String> completedCourses,
                              Integer studentYear, String studentProgram) {}

    public record PathResponse(String targetCourse, List<String> path) {}
}
