package sh.harold.warden.api.moderation;

import java.util.List;

/**
 * Raised when input (configuration values, durations, command arguments) is rejected.
 * The message is safe to show to the requester.
 */
public class ValidationException extends ModerationException {
    private final List<String> errors;

    public ValidationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ValidationException(String message, List<String> errors) {
        super(message + ": " + errors);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
