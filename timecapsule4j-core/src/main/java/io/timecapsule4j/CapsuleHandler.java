package io.timecapsule4j;

/**
 * A {@link DigHandler} that also declares its payload type, so a container can build the matching
 * store and digger for it.
 */
public interface CapsuleHandler<P> extends DigHandler<P> {

    Class<P> payloadType();
}
