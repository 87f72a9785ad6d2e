package org.learningjava.scalarstore.domain.model;

import java.util.List;

/**
 * Points of one scalar: {@code x} holds steps, {@code y} the values, index-aligned.
 */
public record ScalarSeries(List<Long> x, List<Double> y) {

    public ScalarSeries {
        x = List.copyOf(x);
        y = List.copyOf(y);
        if (x.size() != y.size()) {
            throw new IllegalArgumentException("x and y must have the same size");
        }
    }

    public int size() {
        return x.size();
    }
}
