package com.ordoAetheris.pipeline.work;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public final class Permutations {

    private Permutations() {
    }

    /** Each number of [0, length) exactly once, in an order fixed by {@code random}. */
    public static int[] shuffled(int length, Random random) {
        if (length < 0) throw new IllegalArgumentException("length must be >= 0, got " + length);
        List<Integer> numbers = new ArrayList<>(length);
        for (int i = 0; i < length; i++) numbers.add(i);
        Collections.shuffle(numbers, random);

        int[] result = new int[length];
        for (int i = 0; i < length; i++) result[i] = numbers.get(i);
        return result;
    }
}
