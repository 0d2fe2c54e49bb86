package biz.kryukov.dev.svcwatch.store;

import biz.kryukov.dev.svcwatch.LivenessStatus;
import biz.kryukov.dev.svcwatch.Target;
import biz.kryukov.dev.svcwatch.TargetNotFoundException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory target store keyed by name.
 *
 * <p>Each slot holds the current {@link Target} snapshot and its bounded check history.
 * Every mutation is a single {@link ConcurrentHashMap#compute} on the slot, so concurrent
 * updates to one target are serialized and never lost.</p>
 */
public final class TargetStore {

    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();
    private final int historySize;

    public TargetStore(int historySize) {
        if (historySize < 1) {
            throw new IllegalArgumentException("historySize must be >= 1, got " + historySize);
        }
        this.historySize = historySize;
    }

    /**
     * Inserts a target, or merges declared settings into an existing one.
     *
     * <p>An existing target keeps its observed state (status, detection bookkeeping, a
     * rewritten URL). Non-empty declared settings replace the stored ones.</p>
     *
     * @return the stored snapshot
     */
    public Target upsert(Target declared) {
        Slot slot = slots.compute(declared.name(), (name, existing) -> {
            if (existing == null) {
                return new Slot(declared, List.of());
            }
            Target merged = mergeSettings(existing.target, declared);
            return new Slot(merged, existing.history);
        });
        return slot.target;
    }

    /** Inserts a target only when the name is free. */
    public boolean putIfAbsent(Target target) {
        return slots.putIfAbsent(target.name(), new Slot(target, List.of())) == null;
    }

    /**
     * Applies an update to the current snapshot.
     *
     * @throws TargetNotFoundException if the target does not exist
     */
    public Target update(String name, UnaryOperator<Target> change) {
        Slot slot = slots.computeIfPresent(name,
                (n, existing) -> new Slot(change.apply(existing.target), existing.history));
        if (slot == null) {
            throw new TargetNotFoundException(name);
        }
        return slot.target;
    }

    /**
     * Applies an update and appends a check record in the same step.
     *
     * @throws TargetNotFoundException if the target does not exist
     */
    public Target update(String name, UnaryOperator<Target> change, CheckRecord record) {
        Slot slot = slots.computeIfPresent(name,
                (n, existing) -> new Slot(change.apply(existing.target),
                        append(existing.history, record)));
        if (slot == null) {
            throw new TargetNotFoundException(name);
        }
        return slot.target;
    }

    /** Removes a target and its history. Returns the removed snapshot, if any. */
    public Optional<Target> remove(String name) {
        Slot removed = slots.remove(name);
        return removed == null ? Optional.empty() : Optional.of(removed.target);
    }

    public Optional<Target> get(String name) {
        Slot slot = slots.get(name);
        return slot == null ? Optional.empty() : Optional.of(slot.target);
    }

    public boolean contains(String name) {
        return slots.containsKey(name);
    }

    /** Snapshot of all targets, sorted by name. */
    public List<Target> all() {
        List<Target> result = new ArrayList<>(slots.size());
        for (Slot slot : slots.values()) {
            result.add(slot.target);
        }
        result.sort(Comparator.comparing(Target::name));
        return result;
    }

    public Collection<String> names() {
        return List.copyOf(slots.keySet());
    }

    /** Check history of a target, oldest first; empty for unknown targets. */
    public List<CheckRecord> history(String name) {
        Slot slot = slots.get(name);
        return slot == null ? List.of() : slot.history;
    }

    /**
     * Percentage of up records in the retained history.
     *
     * @return 0..100, or null when there is no history
     */
    public Double uptime(String name) {
        List<CheckRecord> records = history(name);
        if (records.isEmpty()) {
            return null;
        }
        long up = records.stream().filter(r -> r.status() == LivenessStatus.UP).count();
        return up * 100.0 / records.size();
    }

    private List<CheckRecord> append(List<CheckRecord> history, CheckRecord record) {
        ArrayDeque<CheckRecord> deque = new ArrayDeque<>(history);
        deque.addLast(record);
        while (deque.size() > historySize) {
            deque.removeFirst();
        }
        return List.copyOf(deque);
    }

    private static Target mergeSettings(Target existing, Target declared) {
        Target.Builder b = existing.toBuilder()
                .manual(existing.manual() || declared.manual());
        if (!declared.apiUrl().isEmpty()) {
            b.apiUrl(declared.apiUrl());
        }
        if (!declared.authEndpoint().isEmpty()) {
            b.authEndpoint(declared.authEndpoint());
        }
        if (!declared.apiType().isEmpty()) {
            b.apiType(declared.apiType());
        }
        if (!sameHost(existing.url(), declared.url())) {
            b.url(declared.url());
        }
        return b.build();
    }

    // A plaintext rewrite only changes the scheme; keep it unless the declared address moved.
    private static boolean sameHost(String current, String declared) {
        return stripScheme(current).equals(stripScheme(declared));
    }

    private static String stripScheme(String url) {
        int idx = url.indexOf("://");
        return idx < 0 ? url : url.substring(idx + 3);
    }

    private record Slot(Target target, List<CheckRecord> history) {}
}
