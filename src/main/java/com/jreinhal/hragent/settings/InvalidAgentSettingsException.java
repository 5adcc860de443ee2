package com.jreinhal.hragent.settings;

import java.util.List;

/**
 * Raised when a configuration snapshot violates one of the load-time rules.
 */
public class InvalidAgentSettingsException extends RuntimeException {

    private final List<String> violations;

    public InvalidAgentSettingsException(List<String> violations) {
        super("Invalid agent settings: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
