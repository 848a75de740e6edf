package com.userservice.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a {@code .env} file of {@code KEY=value} lines.
 * Blank lines and lines starting with {@code #} are skipped.
 */
public final class DotEnv {

    private DotEnv() {}

    public static Map<String, String> loadIfExists(Path envFile) throws IOException {
        Map<String, String> values = new LinkedHashMap<>();
        if (envFile == null || !Files.isRegularFile(envFile)) {
            return values;
        }

        for (String line : Files.readAllLines(envFile)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            if (trimmed.startsWith("export ")) {
                trimmed = trimmed.substring("export ".length()).trim();
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0) {
                continue;
            }

            String key = trimmed.substring(0, eq).trim();
            values.put(key, unquote(trimmed.substring(eq + 1).trim()));
        }
        return values;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
