package com.ordoAetheris.pipeline.check;

import com.ordoAetheris.pipeline.work.ResultStore;

import java.util.List;

/**
 * Post-run validation. Single-threaded; call it only after every producer and
 * consumer thread has been joined.
 */
public final class ResultValidator {

    private final ResultCheck check;

    public ResultValidator(ResultCheck check) {
        this.check = check;
    }

    public void validate(ResultStore results, int rangeStart) {
        requireComplete(results);
        check.verify(results, rangeStart);
    }

    public static void requireComplete(ResultStore results) {
        List<Integer> missing = results.missingPositions();
        if (!missing.isEmpty()) {
            throw new ValidationException(missing.size() + " of " + results.size()
                    + " result slots were never written: " + missing);
        }
    }
}
