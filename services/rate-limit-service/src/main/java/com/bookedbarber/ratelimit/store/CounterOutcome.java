package com.bookedbarber.ratelimit.store;

import java.util.List;

/**
 * Result of {@link CounterStore#incrementAllIfBelow(List)}.
 *
 * @param deniedIndex index of the first counter at or over its limit, or -1 when every counter was incremented
 * @param counts      per-counter values: post-increment when allowed, untouched current values when denied
 */
public record CounterOutcome(int deniedIndex, List<Long> counts) {

    public CounterOutcome {
        counts = List.copyOf(counts);
    }

    public boolean allowed() {
        return deniedIndex < 0;
    }

    public long count(int index) {
        return counts.get(index);
    }
}
