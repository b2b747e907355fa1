package work.lcod.context.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Append-only output of a builder: ordered fragments plus a deduplicated metadata set
 * (required assets and the like). Frozen once the owning builder completes.
 */
public final class OutputAccumulator<F> {
    private final List<F> fragments = new ArrayList<>();
    private final Set<Object> metadata = new LinkedHashSet<>();
    private boolean finalized = false;

    OutputAccumulator() {}

    public static <F> OutputAccumulator<F> empty() {
        var accumulator = new OutputAccumulator<F>();
        accumulator.finish();
        return accumulator;
    }

    synchronized void append(F fragment) {
        ensureOpen();
        fragments.add(Objects.requireNonNull(fragment, "fragment"));
    }

    synchronized void mergeMetadata(Object entry) {
        ensureOpen();
        metadata.add(Objects.requireNonNull(entry, "entry"));
    }

    synchronized void merge(OutputAccumulator<? extends F> other) {
        ensureOpen();
        fragments.addAll(other.fragments());
        metadata.addAll(other.metadata());
    }

    synchronized OutputAccumulator<F> finish() {
        finalized = true;
        return this;
    }

    public synchronized boolean isFinalized() {
        return finalized;
    }

    public synchronized List<F> fragments() {
        return Collections.unmodifiableList(new ArrayList<>(fragments));
    }

    public synchronized Set<Object> metadata() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(metadata));
    }

    public <M> List<M> metadata(Class<M> type) {
        List<M> matching = new ArrayList<>();
        for (Object entry : metadata()) {
            if (type.isInstance(entry)) {
                matching.add(type.cast(entry));
            }
        }
        return matching;
    }

    /**
     * Concatenates fragments using their string form; convenient for text output.
     */
    public String join() {
        var sb = new StringBuilder();
        for (F fragment : fragments()) {
            sb.append(fragment);
        }
        return sb.toString();
    }

    private void ensureOpen() {
        if (finalized) {
            throw new IllegalStateException("Output is finalized");
        }
    }

    @Override
    public String toString() {
        return "OutputAccumulator[fragments=" + fragments() + ", metadata=" + metadata() + "]";
    }
}
