package io.taskloom.config;

import java.util.List;

/**
 * Fatal startup problem, such as overlapping ownership rules or a snapshot written by a newer
 * schema. Never retried; the process refuses to accept work.
 */
public final class ConfigurationException extends RuntimeException {
    private final List<String> problems;

    public ConfigurationException(String message) {
        this(message, List.of(), null);
    }

    public ConfigurationException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    public ConfigurationException(String message, List<String> problems) {
        this(message, problems, null);
    }

    private ConfigurationException(String message, List<String> problems, Throwable cause) {
        super(problems == null || problems.isEmpty() ? message : message + ": " + String.join("; ", problems), cause);
        this.problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
