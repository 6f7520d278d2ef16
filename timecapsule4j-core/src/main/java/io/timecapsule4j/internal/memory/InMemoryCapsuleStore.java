package io.timecapsule4j.internal.memory;

import io.timecapsule4j.core.CapsuleCodec;
import io.timecapsule4j.core.RetrySettings;
import io.timecapsule4j.core.ScoredMember;
import io.timecapsule4j.internal.AbstractCapsuleStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Process-local sorted set with Redis ZSET semantics: members are unique, re-adding a member moves
 * it to the new score, ordering is by score then member.
 *
 * <p>Shared between diggers of the same JVM only; nothing survives a restart.
 */
public class InMemoryCapsuleStore<P> extends AbstractCapsuleStore<P> {

    private static final Comparator<ScoredMember> ORDER =
            Comparator.comparingLong(ScoredMember::score).thenComparing(ScoredMember::member);

    private final TreeSet<ScoredMember> entries = new TreeSet<>(ORDER);
    private final Map<String, Long> scores = new HashMap<>();

    public InMemoryCapsuleStore(String key, CapsuleCodec<P> codec) {
        this(key, codec, RetrySettings.defaults());
    }

    public InMemoryCapsuleStore(String key, CapsuleCodec<P> codec, RetrySettings retrySettings) {
        super(key, codec, retrySettings);
    }

    @Override
    public String type() {
        return "InMemory";
    }

    @Override
    protected synchronized void insert(long score, String member) {
        Long previous = scores.put(member, score);
        if (previous != null) {
            entries.remove(new ScoredMember(previous, member));
        }
        entries.add(new ScoredMember(score, member));
    }

    @Override
    protected synchronized boolean hasMemberWithin(long minScore, long maxScore) {
        ScoredMember first = entries.ceiling(new ScoredMember(minScore, ""));
        return first != null && first.score() <= maxScore;
    }

    @Override
    protected synchronized Optional<ScoredMember> popMin() {
        ScoredMember head = entries.pollFirst();
        if (head == null) {
            return Optional.empty();
        }
        scores.remove(head.member());
        return Optional.of(head);
    }

    @Override
    protected synchronized void remove(String member) {
        Long score = scores.remove(member);
        if (score != null) {
            entries.remove(new ScoredMember(score, member));
        }
    }

    @Override
    protected synchronized void removeAll() {
        entries.clear();
        scores.clear();
    }

    /**
     * Snapshot of the current entries in pop order.
     */
    public synchronized List<ScoredMember> entries() {
        return new ArrayList<>(entries);
    }

    public synchronized int size() {
        return entries.size();
    }
}
