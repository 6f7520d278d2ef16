package io.timecapsule4j.core;

/**
 * One sorted-set entry: due-time score (epoch millis) and encoded capsule.
 */
public record ScoredMember(long score, String member) {
}
