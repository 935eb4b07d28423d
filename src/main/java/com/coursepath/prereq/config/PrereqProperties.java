package com.coursepath.prereq.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "prereq")
public class PrereqProperties {

    private Defaults defaults = new Defaults();
    private Normalizer normalizer = new Normalizer();

    public Defaults getDefaults() { return defaults; }
    public void setDefaults(Defaults defaults) { this.defaults = defaults; }

    public Normalizer getNormalizer() { return normalizer; }
    public void setNormalizer(Normalizer normalizer) { this.normalizer = normalizer; }

    public static class Defaults {
        private int studentYear = 1;
        private String studentProgram = "";

        public int getStudentYear() { return studentYear; }
        public void setStudentYear(int studentYear) { this.studentYear = studentYear; }

        public String getStudentProgram() { return studentProgram; }
        public void setStudentProgram(String studentProgram) { this.studentProgram = studentProgram; }
    }

    public static class Normalizer {
        // longer prerequisite text is almost always scraped page noise
        private int maxLength = 1000;

        public int getMaxLength() { return maxLength; }
        public void setMaxLength(int maxLength) { this.maxLength = maxLength; }
    }
}
