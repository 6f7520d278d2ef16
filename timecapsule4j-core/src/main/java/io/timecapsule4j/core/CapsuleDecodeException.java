package io.timecapsule4j.core;

/**
 * A stored member is not a well-formed capsule.
 *
 * <p>When raised from a dig, the offending entry has already been popped and is not put back.
 */
public class CapsuleDecodeException extends TimeCapsuleException {

    public CapsuleDecodeException(String message) {
        super(message);
    }

    public CapsuleDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
