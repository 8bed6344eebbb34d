package com.shetka.repository;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Scanner;

/**
 * Named SQL loaded from classpath:sql/queries.sql.
 *
 * Each query starts with a {@code -- name: <query>} line. A block named
 * {@code <query>.<dialect>} replaces {@code <query>} when the loader runs with that dialect,
 * which is how statements without a portable form (the upsert) get an H2 variant.
 */
@Component
public class SqlTemplateLoader {

    static final String QUERIES_LOCATION = "classpath:sql/queries.sql";
    private static final String NAME_MARKER = "-- name:";

    private final ResourceLoader resourceLoader;
    private final String dialect;
    private final Map<String, String> queriesCache = new HashMap<>();

    public SqlTemplateLoader(ResourceLoader resourceLoader,
                             @Value("${app.db.dialect:postgresql}") String dialect) {
        this.resourceLoader = resourceLoader;
        this.dialect = dialect;
    }

    public synchronized String load(String name) {
        if (queriesCache.isEmpty()) {
            parse();
        }

        String query = queriesCache.get(name + "." + dialect);
        if (query == null) {
            query = queriesCache.get(name);
        }
        if (query == null) {
            throw new IllegalArgumentException("SQL query not found in queries.sql: " + name);
        }
        return query;
    }

    private void parse() {
        Resource combined = resourceLoader.getResource(QUERIES_LOCATION);
        try (InputStream in = combined.getInputStream(); Scanner s = new Scanner(in, StandardCharsets.UTF_8)) {
            String currentName = null;
            StringBuilder sb = new StringBuilder();
            while (s.hasNextLine()) {
                String line = s.nextLine();
                if (line.trim().startsWith(NAME_MARKER)) {
                    if (currentName != null) {
                        queriesCache.put(currentName, sb.toString().trim());
                    }
                    currentName = line.trim().substring(NAME_MARKER.length()).trim();
                    sb = new StringBuilder();
                } else if (currentName != null) {
                    sb.append(line).append('\n');
                }
            }
            if (currentName != null) {
                queriesCache.put(currentName, sb.toString().trim());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load SQL queries file: " + QUERIES_LOCATION, e);
        }
    }
}
