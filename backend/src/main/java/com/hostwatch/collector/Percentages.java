package com.hostwatch.collector;

final class Percentages {

    private Percentages() {}

    /** Percentage of {@code part} in {@code whole}, rounded to one decimal; 0 when whole is not positive. */
    static double of(double part, double whole) {
        if (whole <= 0) return 0.0;
        return round1(part * 100.0 / whole);
    }

    static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
