package com.coursepath.prereq;

import com.coursepath.prereq.domain.PrereqModels.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PrerequisiteNodeTest {

    @Test
    void leafCarriesRequirementAndNoChildren() {
        PrerequisiteNode leaf = PrerequisiteNode.course("CS 135");
        assertTrue(leaf.isLeaf());
        assertEquals(Operator.NONE, leaf.operator());
        assertEquals(new CourseRequirement("CS 135"), leaf.requirement());
        assertTrue(leaf.children().isEmpty());
    }

    @Test
    void rejectsMalformedNodes() {
        assertThrows(IllegalArgumentException.class, () -> new PrerequisiteNode(Operator.NONE, null, List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new PrerequisiteNode(Operator.NONE, new LevelRequirement(2), List.of(PrerequisiteNode.course("CS 135"))));
        assertThrows(IllegalArgumentException.class, () -> PrerequisiteNode.and(List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new PrerequisiteNode(Operator.OR, new LevelRequirement(2), List.of(PrerequisiteNode.course("CS 135"))));
    }

    @Test
    void childrenAreCopiedOnConstruction() {
        List<PrerequisiteNode> children = new ArrayList<>(List.of(PrerequisiteNode.course("CS 135")));
        PrerequisiteNode root = PrerequisiteNode.or(children);
        children.add(PrerequisiteNode.course("CS 145"));

        assertEquals(1, root.children().size());
        assertThrows(UnsupportedOperationException.class, () -> root.children().add(PrerequisiteNode.course("CS 146")));
    }

    @Test
    void requirementsRenderMissingLabels() {
        assertEquals("CS 135", new CourseRequirement("cs135").missingLabel());
        assertEquals("Year 3 standing", new LevelRequirement(3).missingLabel());
        assertEquals("Enrollment in COMPUTER ENGINEERING", new ProgramRequirement("COMPUTER ENGINEERING").missingLabel());
    }

    @Test
    void studentContextNormalizesCompletedCourses() {
        StudentContext student = StudentContext.of(java.util.Arrays.asList("cs135", null, "MATH-135"), 2, null);
        assertEquals(java.util.Set.of("CS 135", "MATH 135"), student.completedCourses());
        assertEquals("", student.program());
    }

    @Test
    void resultsDoNotShareCollections() {
        ValidationResult first = ValidationResult.noPrerequisites(List.of());
        ValidationResult second = ValidationResult.noPrerequisites(List.of());
        assertTrue(first.missingPrereqs().isEmpty());
        assertTrue(first.gradeRequirements().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> first.missingPrereqs().add("CS 135"));
        assertTrue(second.missingPrereqs().isEmpty());
    }
}
