package com.example.chat.shared.exception;

import java.util.List;

/**
 * The frame was well formed but its typed payload broke a field constraint.
 */
public class PayloadValidationException extends ProtocolException {

    private final List<String> violations;

    public PayloadValidationException(String messageType, List<String> violations) {
        super("Invalid " + messageType + " data: " + String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
