package space.ketterling.climate.query;

import java.util.List;

/**
 * Thrown when a date bound does not start with a {@code yyyy-mm-dd} prefix.
 * The message is user-facing and names the rejected input.
 */
public class ValidationException extends RuntimeException {
    private final List<String> invalidFields;

    public ValidationException(String message, List<String> invalidFields) {
        super(message);
        this.invalidFields = List.copyOf(invalidFields);
    }

    /**
     * Which bounds failed: "start", "end", or both.
     */
    public List<String> invalidFields() {
        return invalidFields;
    }
}
