package com.ordoAetheris.pipeline.compute;

/**
 * Work done by a consumer for one item: a pure, deterministic function of the item key.
 * Implementations may be slow; they must not touch shared state.
 */
@FunctionalInterface
public interface ComputeFunction {

    long apply(int key);
}
