package in.spreadarb.config;

import java.util.List;

/**
 * Thrown at startup when the configuration cannot be run. Fatal: the process refuses to start.
 */
public class ConfigInvalidException extends IllegalStateException {

    private final List<String> violations;

    public ConfigInvalidException(List<String> violations) {
        super("❌ INVALID CONFIG:\n  - " + String.join("\n  - ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
