package com.coursepath.prereq;

import com.coursepath.prereq.domain.PrereqModels.*;
import com.coursepath.prereq.validation.PrerequisiteEvaluator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.coursepath.prereq.domain.PrereqModels.PrerequisiteNode.*;
import static org.junit.jupiter.api.Assertions.*;

class PrerequisiteEvaluatorTest {
    private final PrerequisiteEvaluator evaluator = new PrerequisiteEvaluator();

    @Test
    void courseLeafMatchesNormalizedCompletedCodes() {
        assertTrue(evaluator.evaluate(course("CS 135"), student(List.of("cs-135"))).satisfied());
        assertTrue(evaluator.evaluate(course("CS135"), student(List.of("CS 135"))).satisfied());

        Evaluation missing = evaluator.evaluate(course("cs135"), student(List.of("CS 136")));
        assertFalse(missing.satisfied());
        assertEquals(List.of("CS 135"), missing.missing());
    }

    @Test
    void andReportsUnsatisfiedChildrenInOrderWithDuplicates() {
        PrerequisiteNode tree = and(List.of(course("CS 135"), course("MATH 135"), course("CS 136"), course("MATH 135")));
        Evaluation result = evaluator.evaluate(tree, student(List.of("CS 135")));

        assertFalse(result.satisfied());
        assertEquals(List.of("MATH 135", "CS 136", "MATH 135"), result.missing());
    }

    @Test
    void satisfiedAndReportsNothing() {
        Evaluation result = evaluator.evaluate(and(List.of(course("CS 135"), course("MATH 135"))),
                student(List.of("CS 135", "MATH 135")));
        assertTrue(result.satisfied());
        assertTrue(result.missing().isEmpty());
    }

    @Test
    void failedOrReportsEveryBranch() {
        Evaluation result = evaluator.evaluate(or(List.of(course("STAT 230"), course("STAT 240"))), student(List.of()));
        assertFalse(result.satisfied());
        assertEquals(List.of("STAT 230", "STAT 240"), result.missing());
    }

    @Test
    void orNeedsOneBranch() {
        Evaluation result = evaluator.evaluate(or(List.of(course("CS 135"), course("CS 145"))), student(List.of("CS 145")));
        assertTrue(result.satisfied());
        assertTrue(result.missing().isEmpty());
    }

    @Test
    void nestedTreesCombineRecursively() {
        PrerequisiteNode tree = and(List.of(
                course("CS 240"),
                or(List.of(course("STAT 230"), course("STAT 240")))));

        assertTrue(evaluator.evaluate(tree, student(List.of("CS 240", "STAT 240"))).satisfied());

        Evaluation result = evaluator.evaluate(tree, student(List.of("CS 240")));
        assertFalse(result.satisfied());
        assertEquals(List.of("STAT 230", "STAT 240"), result.missing());
    }

    @Test
    void levelLeafComparesYear() {
        PrerequisiteNode third = leaf(new LevelRequirement(3));
        assertTrue(evaluator.evaluate(third, new StudentContext(null, 3, "")).satisfied());

        Evaluation result = evaluator.evaluate(third, new StudentContext(null, 2, ""));
        assertFalse(result.satisfied());
        assertEquals(List.of("Year 3 standing"), result.missing());
    }

    @Test
    void programLeafMatchesSubstringEitherWay() {
        PrerequisiteNode engineering = leaf(new ProgramRequirement("COMPUTER ENGINEERING"));
        assertTrue(evaluator.evaluate(engineering, new StudentContext(null, 1, "Honours Computer Engineering")).satisfied());

        PrerequisiteNode honours = leaf(new ProgramRequirement("HONOURS COMPUTER SCIENCE"));
        assertTrue(evaluator.evaluate(honours, new StudentContext(null, 1, "computer science")).satisfied());

        Evaluation none = evaluator.evaluate(engineering, new StudentContext(null, 1, ""));
        assertFalse(none.satisfied());
        assertEquals(List.of("Enrollment in COMPUTER ENGINEERING"), none.missing());
    }

    @Test
    void unmetRequirementsKeepTheirKind() {
        PrerequisiteNode tree = and(List.of(leaf(new LevelRequirement(2)), course("CS 135")));
        Evaluation result = evaluator.evaluate(tree, new StudentContext(null, 1, ""));

        assertEquals(List.of(new LevelRequirement(2), new CourseRequirement("CS 135")), result.unmet());
        assertEquals(List.of("Year 2 standing", "CS 135"), result.missing());
    }

    private StudentContext student(List<String> completed) {
        return StudentContext.of(completed, 2, "X");
    }
}
