package com.williamcallahan.trivia_image_curator.util;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Optional;

/**
 * Shared JDBC helper methods so repositories don't repeat empty-result
 * and row-count boilerplate.
 */
public final class JdbcUtils {

    private JdbcUtils() {
    }

    /**
     * Query for a single object with a RowMapper, returning Optional.
     */
    public static <T> Optional<T> queryForOptionalObject(JdbcTemplate jdbc, String sql, RowMapper<T> rowMapper, Object... params) {
        List<T> results = jdbc.query(sql, rowMapper, params);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Execute an update and return whether any rows were affected.
     */
    public static boolean executeUpdate(JdbcTemplate jdbc, String sql, Object... params) {
        return jdbc.update(sql, params) > 0;
    }
}
