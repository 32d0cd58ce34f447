/**
 *
 */
package flint.roaring;

import java.io.IOException;

/**
 * Codec exception with error code classification.
 * Lets callers tell a malformed input apart from a destination buffer that is too small.
 */
public class RoaringException extends IOException {

    private final ErrorCode errorCode;

    public RoaringException(ErrorCode errorCode, String additionalMessage) {
        super(errorCode.getMessage() + " - " + additionalMessage);
        this.errorCode = errorCode;
    }

    /**
     * Get the error code for this exception
     * @return the error code
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Check if this exception has a specific error code
     * @param code the error code to check
     * @return true if the error code matches
     */
    public boolean isErrorCode(ErrorCode code) {
        return this.errorCode == code;
    }

    /**
     * True for every decoding failure (malformed, unknown cookie, truncated)
     */
    public boolean isMalformedInput() {
        int code = errorCode.getCode();
        return code <= -1000 && code > -2000;
    }
}
