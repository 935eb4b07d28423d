package com.coursepath.prereq;

import com.coursepath.prereq.config.PrereqProperties;
import com.coursepath.prereq.parser.PrerequisiteNormalizer;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PrerequisiteNormalizerTest {
    private final PrerequisiteNormalizer normalizer = new PrerequisiteNormalizer(new PrereqProperties());

    @Test
    void treatsNoneLiteralsAsEmpty() {
        for (String literal : Arrays.asList(null, "", "   ", "none", "None", "N/A", "n/a", "NULL", "None.")) {
            assertTrue(PrerequisiteNormalizer.isEmptyLiteral(literal), String.valueOf(literal));
            assertTrue(normalizer.normalize(literal).isEmpty(), String.valueOf(literal));
        }
        assertFalse(PrerequisiteNormalizer.isEmptyLiteral("CS 135"));
    }

    @Test
    void stripsPrefixAndRespacesCodes() {
        assertEquals("ECE 240 and MATH 119", normalizer.normalize("Prereq: ECE240 and   MATH119").text());
        assertEquals("CS 135", normalizer.normalize("Prerequisite: CS 135").text());
        assertEquals("CS 135 or CS 145", normalizer.normalize("prerequisites:CS135 or CS145").text());
    }

    @Test
    void prefixedNoneIsEmpty() {
        assertTrue(normalizer.normalize("Prerequisites: None.").isEmpty());
        assertTrue(normalizer.normalize("Prereq: N/A").isEmpty());
    }

    @Test
    void removesCatalogNoiseSilently() {
        var result = normalizer.normalize("Course ID: 12345 Prereq: CS 135 [Offered: F,W] <br/>");
        assertEquals("CS 135", result.text());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void cutsSideRequisiteClausesWithWarning() {
        var result = normalizer.normalize("Prereq: CS 136. Antireq: CS 145");
        assertEquals("CS 136", result.text());
        assertEquals(List.of("Ignored co/antirequisite clause: 'Antireq: CS 145'"), result.warnings());

        var coreq = normalizer.normalize("MATH 135; Coreq: MATH 136");
        assertEquals("MATH 135", coreq.text());
        assertEquals(1, coreq.warnings().size());
    }

    @Test
    void normalizingTwiceChangesNothing() {
        for (String raw : List.of("Prereq: ECE240, MATH119", "CS 135 and (STAT 230 or STAT 240)", "2A standing")) {
            String once = normalizer.normalize(raw).text();
            assertEquals(once, normalizer.normalize(once).text(), raw);
        }
    }

    @Test
    void warnsOnVeryLongText() {
        PrereqProperties properties = new PrereqProperties();
        properties.getNormalizer().setMaxLength(20);
        var result = new PrerequisiteNormalizer(properties).normalize("CS 135 and MATH 135 and STAT 230");

        assertEquals("CS 135 and MATH 135 and STAT 230", result.text());
        assertTrue(result.warnings().stream().anyMatch(w -> w.startsWith("Prerequisite text is very long")));
    }
}
