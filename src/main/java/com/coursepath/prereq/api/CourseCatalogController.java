package com.coursepath.prereq.api;

import com.coursepath.prereq.config.PrereqProperties;
import com.coursepath.prereq.domain.PrereqModels;
import com.coursepath.prereq.service.CourseEligibilityService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/courses")
public class CourseCatalogController {
    private final CourseEligibilityService eligibilityService;
    private final PrereqProperties properties;

    public CourseCatalogController(CourseEligibilityService eligibilityService, PrereqProperties properties) {
        this.eligibilityService = eligibilityService;
        this.properties = properties;
    }

    @PostMapping
    public ResponseEntity<CourseEligibilityService.RegistrationResult> register(@RequestBody List<PrereqModels.CourseSummary> courses) {
        return ResponseEntity.ok(eligibilityService.registerCourses(courses));
    }

    @GetMapping("/{code}")
    public ResponseEntity<PrereqModels.CourseSummary> course(@PathVariable String code) {
        return eligibilityService.findCourse(code)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> notFound(code));
    }

    @PostMapping("/{code}/check")
    public ResponseEntity<CourseEligibilityService.CourseCheck> check(@PathVariable String code, @RequestBody StudentRequest request) {
        return eligibilityService.checkCourse(code, toStudent(request))
                .map(ResponseEntity::ok)
                .orElseThrow(() -> notFound(code));
    }

    @PostMapping("/eligible")
    public ResponseEntity<List<String>> eligible(@RequestBody StudentRequest request) {
        return ResponseEntity.ok(eligibilityService.eligibleCourses(toStudent(request)));
    }

    private PrereqModels.StudentContext toStudent(StudentRequest request) {
        if (request.studentYear() != null && request.studentYear() < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "studentYear must be at least 1");
        }
        PrereqProperties.Defaults defaults = properties.getDefaults();
        return PrereqModels.StudentContext.of(request.completedCourses(),
                request.studentYear() == null ? defaults.getStudentYear() : request.studentYear(),
                request.studentProgram() == null ? defaults.getStudentProgram() : request.studentProgram());
    }

    private ResponseStatusException notFound(String code) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "course not found: " + code);
    }

    public record StudentRequest(List<String> completedCourses, Integer studentYear, String studentProgram) {}
}
