package com.coursepath.prereq.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.*;

public class PrereqModels {
    public enum Operator { AND, OR, NONE }

    public enum RequirementShape { NONE, LEVEL, PROGRAM, EXPRESSION }

    /**
     * One atomic requirement held by a leaf node. Each variant knows how it is
     * reported when unmet.
     */
    public interface Requirement {
        String missingLabel();
    }

    public record CourseRequirement(String code) implements Requirement {
        public CourseRequirement {
            Objects.requireNonNull(code, "code");
        }

        @Override
        public String missingLabel() {
            return CourseCodes.normalize(code);
        }
    }

    public record LevelRequirement(int year) implements Requirement {
        @Override
        public String missingLabel() {
            return "Year " + year + " standing";
        }
    }

    public record ProgramRequirement(String name) implements Requirement {
        public ProgramRequirement {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String missingLabel() {
            return "Enrollment in " + name;
        }
    }

    /**
     * Node of a prerequisite expression tree. Leaves carry a requirement and no
     * children; AND/OR nodes carry at least one child and no requirement.
     */
    public record PrerequisiteNode(Operator operator, Requirement requirement, List<PrerequisiteNode> children) {
        public PrerequisiteNode {
            Objects.requireNonNull(operator, "operator");
            children = children == null ? List.of() : List.copyOf(children);
            if (operator == Operator.NONE) {
                if (requirement == null || !children.isEmpty()) {
                    throw new IllegalArgumentException("Leaf node needs a requirement and no children");
                }
            } else if (requirement != null || children.isEmpty()) {
                throw new IllegalArgumentException(operator + " node needs children and no requirement");
            }
        }

        public static PrerequisiteNode leaf(Requirement requirement) {
            return new PrerequisiteNode(Operator.NONE, requirement, List.of());
        }

        public static PrerequisiteNode course(String code) {
            return leaf(new CourseRequirement(code));
        }

        public static PrerequisiteNode and(List<PrerequisiteNode> children) {
            return new PrerequisiteNode(Operator.AND, null, children);
        }

        public static PrerequisiteNode or(List<PrerequisiteNode> children) {
            return new PrerequisiteNode(Operator.OR, null, children);
        }

        public boolean isLeaf() {
            return operator == Operator.NONE;
        }
    }

    public record ParsedPrerequisites(String normalizedText,
                                      RequirementShape shape,
                                      PrerequisiteNode tree,
                                      List<String> warnings) {
        public ParsedPrerequisites {
            warnings = List.copyOf(warnings);
        }

        public boolean hasTree() {
            return tree != null;
        }
    }

    /** Outcome of evaluating one subtree; unmet requirements are kept in evaluation order. */
    public record Evaluation(boolean satisfied, List<Requirement> unmet, List<String> warnings) {
        public Evaluation {
            unmet = List.copyOf(unmet);
            warnings = List.copyOf(warnings);
        }

        public List<String> missing() {
            return unmet.stream().map(Requirement::missingLabel).toList();
        }
    }

    public record ValidationResult(boolean satisfied,
                                   List<String> missingPrereqs,
                                   List<String> warnings,
                                   Map<String, String> gradeRequirements,
                                   @JsonIgnore List<Requirement> unmetRequirements) {
        public ValidationResult {
            missingPrereqs = List.copyOf(missingPrereqs);
            warnings = List.copyOf(warnings);
            gradeRequirements = Map.copyOf(gradeRequirements);
            unmetRequirements = List.copyOf(unmetRequirements);
        }

        public static ValidationResult noPrerequisites(List<String> warnings) {
            return new ValidationResult(true, List.of(), warnings, Map.of(), List.of());
        }

        public static ValidationResult of(Evaluation evaluation, List<String> warnings) {
            return new ValidationResult(evaluation.satisfied(), evaluation.missing(), warnings, Map.of(), evaluation.unmet());
        }
    }

    public record StudentContext(Set<String> completedCourses, int year, String program) {
        public StudentContext {
            Set<String> normalized = new LinkedHashSet<>();
            if (completedCourses != null) {
                completedCourses.stream().filter(Objects::nonNull).map(CourseCodes::normalize).forEach(normalized::add);
            }
            completedCourses = Collections.unmodifiableSet(normalized);
            program = program == null ? "" : program;
        }

        public static StudentContext of(Collection<String> completedCourses, int year, String program) {
            return new StudentContext(completedCourses == null ? Set.of() : new LinkedHashSet<>(completedCourses), year, program);
        }
    }

    public record CourseSummary(String code, String title, String prerequisites) {}
}
