package com.hiddenmarkov.inference;

import java.util.Arrays;

public class ViterbiResult {
    private final int[] path;
    private final double logProbability;

    public ViterbiResult(int[] path, double logProbability) {
        this.path = path.clone();
        this.logProbability = logProbability;
    }

    /**
     * Most likely state sequence, one state index per observation.
     */
    public int[] getPath() {
        return path.clone();
    }

    /**
     * Natural log of the joint probability of the path and the observations.
     */
    public double getLogProbability() {
        return logProbability;
    }

    public int length() {
        return path.length;
    }

    @Override
    public String toString() {
        return "ViterbiResult{" +
                "path=" + Arrays.toString(path) +
                ", logProbability=" + String.format("%.4f", logProbability) +
                '}';
    }
}
