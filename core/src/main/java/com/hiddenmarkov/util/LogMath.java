package com.hiddenmarkov.util;

public class LogMath {

    private LogMath() {
    }

    /**
     * Element-wise natural logarithm. Zero entries map to negative infinity.
     */
    public static double[] log(double[] probs) {
        double[] logs = new double[probs.length];
        for (int i = 0; i < probs.length; i++) {
            logs[i] = Math.log(probs[i]);
        }
        return logs;
    }

    /**
     * Element-wise natural logarithm of every row.
     */
    public static double[][] log(double[][] probs) {
        double[][] logs = new double[probs.length][];
        for (int i = 0; i < probs.length; i++) {
            logs[i] = log(probs[i]);
        }
        return logs;
    }

    /**
     * Returns the index of the maximum value in the array.
     * Among equal maxima the lowest index wins; an array of only negative
     * infinities yields 0.
     */
    public static int argmax(double[] x) {
        return argmax(x, 0, x.length);
    }

    /**
     * Same as {@link #argmax(double[])} over the slice {@code x[from, from + length)},
     * returning an index relative to {@code from}.
     */
    public static int argmax(double[] x, int from, int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Cannot take argmax of an empty range");
        }
        int bestIdx = 0;
        double bestVal = x[from];
        for (int i = 1; i < length; i++) {
            if (x[from + i] > bestVal) {
                bestVal = x[from + i];
                bestIdx = i;
            }
        }
        return bestIdx;
    }

    /**
     * Sum of the array entries.
     */
    public static double sum(double[] x) {
        double total = 0.0;
        for (double v : x) {
            total += v;
        }
        return total;
    }
}
