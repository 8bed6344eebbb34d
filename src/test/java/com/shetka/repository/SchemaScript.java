package com.shetka.repository;

import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Runs the same schema.sql the application executes at startup.
 */
final class SchemaScript {

    private SchemaScript() {}

    static void apply(JdbcTemplate jdbcTemplate) {
        String sql;
        try (InputStream in = SchemaScript.class.getResourceAsStream("/schema.sql")) {
            if (in == null) {
                throw new IllegalStateException("schema.sql not on the test classpath");
            }
            sql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        for (String stmt : sql.split(";")) {
            String t = stmt.trim();
            if (!t.isEmpty()) {
                jdbcTemplate.execute(t);
            }
        }
    }
}
