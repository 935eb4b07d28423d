package com.coursepath.prereq.recommendation;

import com.coursepath.prereq.domain.CourseCodes;
import com.coursepath.prereq.domain.PrereqModels.CourseRequirement;
import com.coursepath.prereq.domain.PrereqModels.ParsedPrerequisites;
import com.coursepath.prereq.domain.PrereqModels.PrerequisiteNode;
import com.coursepath.prereq.parser.PrerequisiteParser;
import org.springframework.stereotype.Service;

/**
 * Heuristic difficulty in [0, 1] from course level and prerequisite count.
 * Monotone in both inputs; not a calibrated probability.
 */
@Service
public class DifficultyScorer {
    static final double NO_PREREQUISITES_SCORE = 0.1;
    private static final double MAX_LEVEL_COMPONENT = 0.75;
    private static final double MAX_PREREQ_COMPONENT = 0.3;

    private final PrerequisiteParser parser;

    public DifficultyScorer(PrerequisiteParser parser) {
        this.parser = parser;
    }

    public double score(String courseCode, String prerequisites) {
        return score(courseCode, parser.parse(prerequisites));
    }

    public double score(String courseCode, ParsedPrerequisites parsed) {
        if (!parsed.hasTree()) {
            return NO_PREREQUISITES_SCORE;
        }

        int courseCount = countCourses(parsed.tree());
        int level = CourseCodes.level(courseCode);

        double base = Math.max(0.0, Math.min((level - 1) / 4.0, MAX_LEVEL_COMPONENT));
        double prereq = Math.min(courseCount / 10.0, MAX_PREREQ_COMPONENT);
        return Math.min(base + prereq, 1.0);
    }

    static int countCourses(PrerequisiteNode node) {
        if (node.isLeaf()) {
            return node.requirement() instanceof CourseRequirement ? 1 : 0;
        }
        return node.children().stream().mapToInt(DifficultyScorer::countCourses).sum();
    }
}
