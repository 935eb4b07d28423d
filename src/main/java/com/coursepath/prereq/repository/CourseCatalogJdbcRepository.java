package com.coursepath.prereq.repository;

import com.coursepath.prereq.domain.PrereqModels.CourseSummary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class CourseCatalogJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public CourseCatalogJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void upsert(CourseSummary course) {
        int updated = jdbcTemplate.update(
                "UPDATE courses SET title=?, prerequisites=? WHERE code=?",
                course.title(), course.prerequisites(), course.code());
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO courses(code, title, prerequisites) VALUES (?,?,?)",
                    course.code(), course.title(), course.prerequisites());
        }
    }

    public Optional<CourseSummary> findByCode(String code) {
        List<CourseSummary> rows = jdbcTemplate.query(
                "SELECT code, title, prerequisites FROM courses WHERE code=?",
                (rs, n) -> new CourseSummary(rs.getString(1), rs.getString(2), rs.getString(3)),
                code);
        return rows.stream().findFirst();
    }

    public List<CourseSummary> findAll() {
        return jdbcTemplate.query(
                "SELECT code, title, prerequisites FROM courses ORDER BY code",
                (rs, n) -> new CourseSummary(rs.getString(1), rs.getString(2), rs.getString(3)));
    }
}
