package com.axlabs.neo.yieldshares;

/**
 * Aborts a contract invocation. All storage changes and notifications of the aborted invocation are rolled back
 * by the {@link com.axlabs.neo.yieldshares.runtime.Runtime}.
 * <p>
 * The message has the form {@code [Contract.method] reason}, so callers can match on the reason with
 * {@code endsWith}.
 */
public class ContractException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;
    private final String reason;

    public ContractException(ErrorCode code, String location, String reason) {
        super("[" + location + "] " + reason);
        this.code = code;
        this.reason = reason;
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * @return the human-readable cause without the location prefix.
     */
    public String getReason() {
        return reason;
    }
}
