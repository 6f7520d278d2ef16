package io.timecapsule4j.core;

/**
 * The backing store could not be reached or rejected a command.
 */
public class CapsuleStoreException extends TimeCapsuleException {

    public CapsuleStoreException(String message) {
        super(message);
    }

    public CapsuleStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
