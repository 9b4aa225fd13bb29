package com.github.tarcv.binexp;

/**
 * Failure reported by pattern compilation or by a match operation.
 * Absence of a match is never reported through this exception.
 */
public class UErrorException extends RuntimeException {
    private final UErrorCode status;

    public UErrorException(UErrorCode status) {
        this.status = status;
    }

    public UErrorException(UErrorCode status, String message) {
        super(message);
        this.status = status;
    }

    public UErrorException(UErrorCode status, Throwable cause) {
        super(cause);
        this.status = status;
    }

    public UErrorCode getErrorCode() {
        return status;
    }

    @Override
    public String toString() {
        String message = getMessage();
        return "UErrorException{" +
                "status=" + status +
                (message != null ? ", message='" + message + '\'' : "") +
                '}';
    }
}
