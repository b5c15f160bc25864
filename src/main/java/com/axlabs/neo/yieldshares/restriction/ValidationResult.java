package com.axlabs.neo.yieldshares.restriction;

/**
 * Outcome of a validation, i.e., of checking a transfer against its restrictions or a proposal against its bounds.
 * Carries the reason if rejected.
 */
public class ValidationResult {

    private static final ValidationResult ALLOWED = new ValidationResult(true, "");

    private final boolean allowed;
    private final String reason;

    private ValidationResult(boolean allowed, String reason) {
        this.allowed = allowed;
        this.reason = reason;
    }

    public static ValidationResult allowed() {
        return ALLOWED;
    }

    public static ValidationResult rejected(String reason) {
        return new ValidationResult(false, reason);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return allowed ? "allowed" : "rejected: " + reason;
    }
}
