package com.stablecore.error;

import lombok.Getter;

/** Base unchecked exception for every rejected core operation. */
@Getter
public class CoreException extends RuntimeException {

    private final ErrorCode code;

    public CoreException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public CoreException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static CoreException of(ErrorCode code, String fmt, Object... args) {
        return new CoreException(code, String.format(fmt, args));
    }

    /** Throws {@code INVALID_REQUEST} when the condition does not hold. */
    public static void require(boolean condition, String message) {
        if (!condition) throw new CoreException(ErrorCode.INVALID_REQUEST, message);
    }

    /** Unwraps completion/execution wrappers down to the first CoreException, or wraps the cause. */
    public static CoreException unwrap(Throwable t) {
        Throwable cur = t;
        while (cur != null) {
            if (cur instanceof CoreException ce) return ce;
            cur = cur.getCause();
        }
        return new CoreException(ErrorCode.EXTERNAL_CALL_FAILED,
                t == null ? "unknown failure" : String.valueOf(t.getMessage()), t);
    }
}
