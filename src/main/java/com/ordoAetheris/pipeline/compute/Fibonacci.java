package com.ordoAetheris.pipeline.compute;

/**
 * Naive recursive Fibonacci, fib(1) = fib(2) = 1.
 * Exponential on purpose: it is the CPU load the consumers chew on.
 */
public final class Fibonacci implements ComputeFunction {

    @Override
    public long apply(int n) {
        if (n < 1) throw new IllegalArgumentException("fibonacci is defined for n >= 1, got " + n);
        return fib(n);
    }

    private static long fib(int n) {
        return n <= 2 ? 1 : fib(n - 1) + fib(n - 2);
    }

    @Override
    public String toString() {
        return "fibonacci";
    }
}
