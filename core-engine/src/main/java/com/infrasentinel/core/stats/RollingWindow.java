package com.infrasentinel.core.stats;

import java.io.Serializable;
import java.util.Optional;

/**
 * Bounded window over the most recent observations of one metric.
 *
 * <h3>Implementation</h3>
 * <p>
 * A fixed-size ring buffer; once {@code capacity} values are held, each push
 * evicts the oldest one. Sum and sum of squares are maintained incrementally,
 * so push, mean and standard deviation are O(1). Both sums are taken relative
 * to a shift value (an element of the window) to limit cancellation, and are
 * rebuilt from the buffer every {@code capacity} pushes so rounding errors
 * cannot accumulate over an unbounded stream.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * {@link #std()} and {@link #previous()} are empty until at least
 * {@value #MIN_SAMPLES} values have been pushed.
 * </p>
 *
 * <p>
 * Not thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class RollingWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Observations needed before spread and previous value are defined. */
    public static final int MIN_SAMPLES = 2;

    private final double[] buffer;
    private int head;
    private int size;

    private double shift;
    private double sum;
    private double sumSquares;
    private int pushesSinceRebuild;

    /**
     * @param capacity maximum number of observations kept; must be positive
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public RollingWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Window capacity must be >= 1, got: " + capacity);
        }
        this.buffer = new double[capacity];
    }

    /**
     * Append an observation, evicting the oldest one when the window is full.
     *
     * @param value the observation
     */
    public void push(double value) {
        if (size == 0) {
            shift = value;
            sum = 0;
            sumSquares = 0;
        }

        if (size == buffer.length) {
            double evicted = buffer[head] - shift;
            sum -= evicted;
            sumSquares -= evicted * evicted;
            buffer[head] = value;
            head = (head + 1) % buffer.length;
        } else {
            buffer[(head + size) % buffer.length] = value;
            size++;
        }

        double d = value - shift;
        sum += d;
        sumSquares += d * d;

        if (++pushesSinceRebuild >= buffer.length) {
            rebuild();
        }
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return buffer.length;
    }

    /**
     * @return mean of the current contents, or empty when the window is empty
     */
    public Optional<Double> mean() {
        if (size == 0) {
            return Optional.empty();
        }
        return Optional.of(shift + sum / size);
    }

    /**
     * @return sample standard deviation (ddof = 1) of the current contents, or
     *         empty with fewer than {@value #MIN_SAMPLES} observations
     */
    public Optional<Double> std() {
        if (size < MIN_SAMPLES) {
            return Optional.empty();
        }
        double variance = (sumSquares - sum * sum / size) / (size - 1);
        return Optional.of(Math.sqrt(Math.max(0.0, variance)));
    }

    /**
     * @return the most recent observation, or empty when the window is empty
     */
    public Optional<Double> latest() {
        if (size == 0) {
            return Optional.empty();
        }
        return Optional.of(buffer[(head + size - 1) % buffer.length]);
    }

    /**
     * @return the observation pushed just before the most recent one, or empty
     *         with fewer than {@value #MIN_SAMPLES} observations
     */
    public Optional<Double> previous() {
        if (size < MIN_SAMPLES) {
            return Optional.empty();
        }
        return Optional.of(buffer[(head + size - 2) % buffer.length]);
    }

    /**
     * @return copy of the current contents, oldest first
     */
    public double[] toArray() {
        double[] copy = new double[size];
        for (int i = 0; i < size; i++) {
            copy[i] = buffer[(head + i) % buffer.length];
        }
        return copy;
    }

    /**
     * Copy of this window with a different capacity. The most recent
     * observations are kept, up to {@code capacity} of them.
     *
     * @param capacity capacity of the copy; must be positive
     * @return this window when the capacity is unchanged, a new window
     *         otherwise
     */
    public RollingWindow withCapacity(int capacity) {
        if (capacity == buffer.length) {
            return this;
        }
        RollingWindow resized = new RollingWindow(capacity);
        double[] values = toArray();
        for (int i = Math.max(0, values.length - capacity); i < values.length; i++) {
            resized.push(values[i]);
        }
        return resized;
    }

    private void rebuild() {
        pushesSinceRebuild = 0;
        shift = buffer[head];
        sum = 0;
        sumSquares = 0;
        for (int i = 0; i < size; i++) {
            double d = buffer[(head + i) % buffer.length] - shift;
            sum += d;
            sumSquares += d * d;
        }
    }

    @Override
    public String toString() {
        return "RollingWindow{size=" + size + ", capacity=" + buffer.length + '}';
    }
}
