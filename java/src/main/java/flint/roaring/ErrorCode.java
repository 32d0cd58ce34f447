/**
 *
 */
package flint.roaring;

/**
 * Error codes for bitmap operations
 */
public enum ErrorCode {
    NOT_FOUND(-1, "Value not found"),

    // Decoding errors (-1000 to -1999)
    MALFORMED_INPUT(-1000, "Malformed input"),
    UNKNOWN_COOKIE(-1001, "Unknown format cookie"),
    TRUNCATED_INPUT(-1002, "Input truncated"),

    // Encoding errors (-2000 to -2999)
    INSUFFICIENT_BUFFER(-2000, "Insufficient buffer"),

    // Precondition errors (-3000 to -3999)
    EMPTY_SET(-3000, "Set is empty"),
    INVALID_RANGE(-3001, "Invalid range"),
    IMMUTABLE_VIEW(-3002, "Frozen view is immutable"),

    // General errors (-9000 to -9999)
    INTERNAL_ERROR(-9002, "Internal error");

    private final int code;
    private final String message;

    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
