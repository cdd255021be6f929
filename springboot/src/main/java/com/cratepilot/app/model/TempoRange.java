package com.cratepilot.app.model;

import lombok.Value;

@Value
public class TempoRange {
    double min;
    double max;

    public static TempoRange of(double min, double max) {
        return new TempoRange(min, max);
    }

    public boolean isWellFormed() {
        return min > 0 && max > 0 && min <= max;
    }

    public boolean contains(double bpm) {
        return bpm >= min && bpm <= max;
    }

    public TempoRange widen(double tolerance) {
        return new TempoRange(min - tolerance, max + tolerance);
    }

    public double width() {
        return max - min;
    }

    @Override
    public String toString() {
        return min == max ? format(min) + " BPM" : format(min) + "-" + format(max) + " BPM";
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
