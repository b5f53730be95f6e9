package com.ordoAetheris.pipeline.check;

import com.ordoAetheris.pipeline.compute.ComputeFunction;
import com.ordoAetheris.pipeline.work.ResultStore;

/**
 * Domain consistency check over a complete result store, where slot i holds f(rangeStart + i).
 */
@FunctionalInterface
public interface ResultCheck {

    /** @throws ValidationException on the first inconsistent slot */
    void verify(ResultStore results, int rangeStart);

    /** No domain check; completeness is still verified by {@link ResultValidator}. */
    static ResultCheck none() {
        return (results, rangeStart) -> { };
    }

    /** Recomputes every slot with {@code function}. Only sensible for cheap functions. */
    static ResultCheck matching(ComputeFunction function) {
        return (results, rangeStart) -> {
            for (int i = 0; i < results.size(); i++) {
                long expected = function.apply(rangeStart + i);
                if (results.get(i) != expected) {
                    throw new ValidationException(String.format(
                            "results[%d] = %d, expected f(%d) = %d", i, results.get(i), rangeStart + i, expected));
                }
            }
        };
    }
}
