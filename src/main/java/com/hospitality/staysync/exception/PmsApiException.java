package com.hospitality.staysync.exception;

/**
 * Thrown when a PMS vendor API cannot be reached or refuses to answer.
 * Rate limiting and momentary unavailability are expected and retried.
 */
public class PmsApiException extends StaySyncException {

    private final String pmsName;
    private final String reference;
    private final boolean isRetryable;

    public PmsApiException(String message, String pmsName) {
        super(message);
        this.pmsName = pmsName;
        this.reference = null;
        this.isRetryable = true;
    }

    public PmsApiException(String message, String pmsName, String reference) {
        super(message);
        this.pmsName = pmsName;
        this.reference = reference;
        this.isRetryable = true;
    }

    public PmsApiException(String message, String pmsName, String reference, boolean isRetryable) {
        super(message);
        this.pmsName = pmsName;
        this.reference = reference;
        this.isRetryable = isRetryable;
    }

    public PmsApiException(String message, String pmsName, String reference, boolean isRetryable,
                           Throwable cause) {
        super(message, cause);
        this.pmsName = pmsName;
        this.reference = reference;
        this.isRetryable = isRetryable;
    }

    public String getPmsName() {
        return pmsName;
    }

    public String getReference() {
        return reference;
    }

    /**
     * Indicates if the vendor may answer on a later attempt.
     * False once the retry budget for the call has been spent.
     */
    public boolean isRetryable() {
        return isRetryable;
    }
}
