package dev.dettmer.vnitype.core;

/**
 * Errors reported while delivering edits to the host.
 *
 * <p>Delivered to the adapter via {@link VniTypeAdapter#onError(VniTypeError)}.
 * After any of these the engine clears its composition, since the buffer no
 * longer matches the field.</p>
 */
public enum VniTypeError {

    /** The host refused to delete characters before the cursor. */
    DELETE_REJECTED(1, "Text field rejected a delete"),

    /** The host refused to insert a character. */
    INSERT_REJECTED(2, "Text field rejected an insert"),

    /** Unknown error. */
    UNKNOWN(999, "Unknown error");

    /** Numeric error code. */
    public final int code;

    /** Human-readable error description. */
    public final String message;

    VniTypeError(int code, String message) {
        this.code = code;
        this.message = message;
    }

    /**
     * Look up a VniTypeError by its numeric code.
     *
     * @param code Error code
     * @return Matching VniTypeError, or UNKNOWN if code not recognized
     */
    public static VniTypeError fromCode(int code) {
        for (VniTypeError e : values()) {
            if (e.code == code) return e;
        }
        return UNKNOWN;
    }
}
