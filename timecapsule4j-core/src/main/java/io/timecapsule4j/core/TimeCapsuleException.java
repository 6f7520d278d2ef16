package io.timecapsule4j.core;

/**
 * Base type for failures raised by capsule stores and codecs.
 */
public class TimeCapsuleException extends RuntimeException {

    public TimeCapsuleException(String message) {
        super(message);
    }

    public TimeCapsuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
