/* (C)2026 */
package com.ammann.analytics.model;

import com.ammann.analytics.exception.InvalidInputException;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, validated sequence of scalar measurements.
 *
 * <p>A sample holds at least {@value #MIN_SIZE} finite values in their original order.
 * Accessors return defensive copies, so a sample can be shared between threads and
 * analysed concurrently without synchronization.
 */
public final class Sample
{
    /** Smallest sample size the engine analyses. */
    public static final int MIN_SIZE = 5;

    public static final String DEFAULT_LABEL = "sample";

    private final String label;
    private final double[] values;
    private final double[] sorted;

    private Sample(String label, double[] values)
    {
        this.label = normalizeLabel(label);
        this.values = values;
        this.sorted = values.clone();
        Arrays.sort(this.sorted);
    }

    /**
     * Creates an unlabelled sample.
     *
     * @param values measurements in observation order
     * @return validated sample
     * @throws InvalidInputException if fewer than five values are given or any value is NaN or infinite
     */
    public static Sample of(double... values)
    {
        return of(DEFAULT_LABEL, values);
    }

    /**
     * Creates a labelled sample.
     *
     * @param label  display name of the sample, {@code null} for the default label
     * @param values measurements in observation order
     * @return validated sample
     * @throws InvalidInputException if fewer than five values are given or any value is NaN or infinite
     */
    public static Sample of(String label, double... values)
    {
        if (values == null) {
            throw InvalidInputException.insufficientData(MIN_SIZE, 0);
        }
        if (values.length < MIN_SIZE) {
            throw InvalidInputException.insufficientData(MIN_SIZE, values.length);
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw InvalidInputException.nonFinite(i, values[i]);
            }
        }
        return new Sample(label, values.clone());
    }

    /**
     * Creates a labelled sample from boxed values.
     *
     * @throws InvalidInputException if the list is too short or contains null, NaN or infinite values
     */
    public static Sample of(String label, List<Double> values)
    {
        if (values == null) {
            throw InvalidInputException.insufficientData(MIN_SIZE, 0);
        }
        double[] raw = new double[values.size()];
        for (int i = 0; i < raw.length; i++) {
            Double value = values.get(i);
            if (value == null) {
                throw InvalidInputException.invalidParameter("values[" + i + "]", null, "a finite number");
            }
            raw[i] = value;
        }
        return of(label, raw);
    }

    /** Trimmed label, or {@value #DEFAULT_LABEL} when blank. */
    public static String normalizeLabel(String label)
    {
        return (label == null || label.isBlank()) ? DEFAULT_LABEL : label.trim();
    }

    public String label()
    {
        return label;
    }

    public int size()
    {
        return values.length;
    }

    /** Returns a copy of the values in observation order. */
    public double[] values()
    {
        return values.clone();
    }

    /** Returns a copy of the values in ascending order. */
    public double[] sorted()
    {
        return sorted.clone();
    }

    /** Returns the value at the given observation index. */
    public double get(int index)
    {
        return values[index];
    }

    public double min()
    {
        return sorted[0];
    }

    public double max()
    {
        return sorted[sorted.length - 1];
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof Sample that)) return false;
        return label.equals(that.label) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(label, Arrays.hashCode(values));
    }

    @Override
    public String toString()
    {
        return "Sample{label='" + label + "', n=" + values.length + "}";
    }
}
