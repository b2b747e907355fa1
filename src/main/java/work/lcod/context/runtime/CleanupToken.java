package work.lcod.context.runtime;

/**
 * Handle returned by {@link CleanupRegistry#register}; lets the owner cancel a pending action.
 */
public final class CleanupToken {
    private final CleanupRegistry owner;
    private final long sequence;
    private final String name;

    CleanupToken(CleanupRegistry owner, long sequence, String name) {
        this.owner = owner;
        this.sequence = sequence;
        this.name = name;
    }

    CleanupRegistry owner() {
        return owner;
    }

    public long sequence() {
        return sequence;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "CleanupToken[" + name + "#" + sequence + "]";
    }
}
