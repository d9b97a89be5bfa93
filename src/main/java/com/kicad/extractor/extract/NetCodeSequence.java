package com.kicad.extractor.extract;

/**
 * Monotonic net code counter for one extraction run. Codes start at 1.
 *
 * Not thread-safe; one instance belongs to one run.
 */
public class NetCodeSequence {

    private int next;

    public NetCodeSequence() {
        this(1);
    }

    public NetCodeSequence(int first) {
        if (first < 1) {
            throw new IllegalArgumentException("Net codes start at 1, got " + first);
        }
        this.next = first;
    }

    public int next() {
        return next++;
    }

    /**
     * The code the next call to {@link #next()} will return.
     */
    public int peek() {
        return next;
    }

    public int issued() {
        return next - 1;
    }
}
