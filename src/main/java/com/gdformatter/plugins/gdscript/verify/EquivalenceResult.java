package com.gdformatter.plugins.gdscript.verify;

/**
 * Outcome of comparing two syntax trees.
 */
public final class EquivalenceResult {
    private static final EquivalenceResult EQUIVALENT = new EquivalenceResult(true, "", null);

    private final boolean equivalent;
    private final String path;
    private final String reason;

    private EquivalenceResult(boolean equivalent, String path, String reason) {
        this.equivalent = equivalent;
        this.path = path;
        this.reason = reason;
    }

    public static EquivalenceResult equivalent() {
        return EQUIVALENT;
    }

    /**
     * @param path   dot separated {@code kind[index]} segments leading to the first difference
     * @param reason what differs at that node
     */
    public static EquivalenceResult different(String path, String reason) {
        return new EquivalenceResult(false, path, reason);
    }

    public boolean isEquivalent() {
        return equivalent;
    }

    public String getPath() {
        return path;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return equivalent ? "Equivalent" : "Different{path=" + path + ", reason=" + reason + "}";
    }
}
