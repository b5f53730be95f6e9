package com.ordoAetheris.pipeline.check;

/**
 * The results of a finished run break an invariant: an empty slot or a wrong value.
 * Always a bug, never a condition to recover from.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
