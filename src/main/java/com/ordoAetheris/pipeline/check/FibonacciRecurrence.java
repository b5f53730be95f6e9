package com.ordoAetheris.pipeline.check;

import com.ordoAetheris.pipeline.compute.ComputeFunction;
import com.ordoAetheris.pipeline.compute.Fibonacci;
import com.ordoAetheris.pipeline.work.ResultStore;

/**
 * results[0] == fib(start), results[1] == fib(start + 1), then
 * results[i] == results[i - 1] + results[i - 2]. Only the two seeds are recomputed.
 */
public final class FibonacciRecurrence implements ResultCheck {

    private final ComputeFunction fibonacci;

    public FibonacciRecurrence() {
        this(new Fibonacci());
    }

    public FibonacciRecurrence(ComputeFunction fibonacci) {
        this.fibonacci = fibonacci;
    }

    @Override
    public void verify(ResultStore results, int rangeStart) {
        int n = results.size();
        if (n > 0) expectSeed(results, 0, rangeStart);
        if (n > 1) expectSeed(results, 1, rangeStart);
        for (int i = 2; i < n; i++) {
            long sum = results.get(i - 2) + results.get(i - 1);
            if (results.get(i) != sum) {
                throw new ValidationException(String.format(
                        "results[%d] = %d, expected results[%d] + results[%d] = %d",
                        i, results.get(i), i - 2, i - 1, sum));
            }
        }
    }

    private void expectSeed(ResultStore results, int position, int rangeStart) {
        long expected = fibonacci.apply(rangeStart + position);
        if (results.get(position) != expected) {
            throw new ValidationException(String.format(
                    "results[%d] = %d, expected fib(%d) = %d",
                    position, results.get(position), rangeStart + position, expected));
        }
    }
}
