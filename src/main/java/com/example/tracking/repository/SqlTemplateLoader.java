package com.example.tracking.repository;

import org.springframework.beans.factory.annotation.Autowired;
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
 * Loads named SQL statements from a single queries file.
 * A statement starts at a "-- name: xyz" line and runs until the next marker.
 */
@Component
public class SqlTemplateLoader {

    static final String DEFAULT_LOCATION = "classpath:sql/queries.sql";
    private static final String NAME_MARKER = "-- name:";

    private final ResourceLoader resourceLoader;
    private final String location;
    private volatile Map<String, String> queries;

    @Autowired
    public SqlTemplateLoader(ResourceLoader resourceLoader,
                             @Value("${app.sql.location:" + DEFAULT_LOCATION + "}") String location) {
        this.resourceLoader = resourceLoader;
        this.location = location;
    }

    public SqlTemplateLoader(ResourceLoader resourceLoader) {
        this(resourceLoader, DEFAULT_LOCATION);
    }

    public String load(String name) {
        String query = queries().get(name);
        if (query == null) {
            throw new IllegalArgumentException("SQL query not found in " + location + ": " + name);
        }
        return query;
    }

    private Map<String, String> queries() {
        Map<String, String> loaded = queries;
        if (loaded == null) {
            synchronized (this) {
                loaded = queries;
                if (loaded == null) {
                    loaded = parse(resourceLoader.getResource(location));
                    queries = loaded;
                }
            }
        }
        return loaded;
    }

    private Map<String, String> parse(Resource resource) {
        Map<String, String> parsed = new HashMap<>();
        try (InputStream in = resource.getInputStream();
             Scanner s = new Scanner(in, StandardCharsets.UTF_8.name())) {
            String currentName = null;
            StringBuilder sb = new StringBuilder();
            while (s.hasNextLine()) {
                String line = s.nextLine();
                String trimmed = line.trim();
                if (trimmed.startsWith(NAME_MARKER)) {
                    if (currentName != null) {
                        parsed.put(currentName, sb.toString().trim());
                    }
                    currentName = trimmed.substring(NAME_MARKER.length()).trim();
                    sb = new StringBuilder();
                } else if (currentName != null) {
                    sb.append(line).append('\n');
                }
            }
            if (currentName != null) {
                parsed.put(currentName, sb.toString().trim());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load SQL queries file: " + location, e);
        }
        return Map.copyOf(parsed);
    }
}
