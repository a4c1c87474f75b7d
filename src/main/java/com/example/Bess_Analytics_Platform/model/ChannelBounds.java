package com.example.Bess_Analytics_Platform.model;

import com.example.Bess_Analytics_Platform.exception.ConfigurationException;

/**
 * Inclusive operating band [min, max] for one channel. Values exactly on a
 * bound are normal.
 */
public final class ChannelBounds {

    private final double min;
    private final double max;

    private ChannelBounds(double min, double max) {
        this.min = min;
        this.max = max;
    }

    public static ChannelBounds of(double min, double max) {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new ConfigurationException(String.format("Bounds must be finite, got [%s, %s]", min, max));
        }
        if (min > max) {
            throw new ConfigurationException(String.format("Lower bound %.3f exceeds upper bound %.3f", min, max));
        }
        return new ChannelBounds(min, max);
    }

    public double getMin() { return min; }
    public double getMax() { return max; }

    public boolean isViolatedBy(double value) {
        return value < min || value > max;
    }

    /**
     * Distance outside the band relative to the band width (0 when inside).
     * A zero-width band reports the absolute distance.
     */
    public double relativeExceedance(double value) {
        double distance = value < min ? min - value : value > max ? value - max : 0.0;
        double width = max - min;
        return width > 0 ? distance / width : distance;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelBounds)) return false;
        ChannelBounds that = (ChannelBounds) o;
        return Double.compare(min, that.min) == 0 && Double.compare(max, that.max) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(min) * 31 + Double.hashCode(max);
    }

    @Override
    public String toString() {
        return String.format("[%.2f, %.2f]", min, max);
    }
}
