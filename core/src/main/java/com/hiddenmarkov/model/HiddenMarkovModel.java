package com.hiddenmarkov.model;

import com.hiddenmarkov.util.LogMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First-order hidden Markov model over discrete observation symbols.
 * <p>
 * Instances are created only through {@link #create(double[], double[][], double[][])},
 * which validates every table, and are immutable afterwards. A single instance can be
 * shared by any number of concurrent decoders.
 */
public final class HiddenMarkovModel {
    private static final Logger logger = LoggerFactory.getLogger(HiddenMarkovModel.class);

    /** Maximum allowed deviation of a probability row sum from 1. */
    public static final double ROW_SUM_TOLERANCE = 1e-6;

    private final int numStates;
    private final int numSymbols;

    // [state]
    private final double[] initial;
    // [fromState][toState]
    private final double[][] transition;
    // [state][symbol]
    private final double[][] emission;

    private final double[] logInitial;
    private final double[][] logTransition;
    private final double[][] logEmission;

    private HiddenMarkovModel(double[] initial, double[][] transition, double[][] emission) {
        this.numStates = initial.length;
        this.numSymbols = emission[0].length;
        this.initial = initial;
        this.transition = transition;
        this.emission = emission;
        this.logInitial = LogMath.log(initial);
        this.logTransition = LogMath.log(transition);
        this.logEmission = LogMath.log(emission);
    }

    /**
     * Validates the three probability tables and builds a model from copies of them.
     *
     * @param initial    initial state distribution, length N
     * @param transition N x N matrix, {@code transition[i][j] = P(next = j | current = i)}
     * @param emission   N x M matrix, {@code emission[i][k] = P(symbol = k | state = i)}
     * @return the validated model
     * @throws ConfigurationException naming the first violated invariant
     */
    public static HiddenMarkovModel create(double[] initial, double[][] transition, double[][] emission) {
        checkDimensions(initial, transition, emission);

        double[] initialCopy = initial.clone();
        double[][] transitionCopy = copy(transition);
        double[][] emissionCopy = copy(emission);

        checkRange("initial", initialCopy);
        for (int i = 0; i < transitionCopy.length; i++) {
            checkRange("transition[" + i + "]", transitionCopy[i]);
        }
        for (int i = 0; i < emissionCopy.length; i++) {
            checkRange("emission[" + i + "]", emissionCopy[i]);
        }

        checkSum("initial probabilities", initialCopy);
        for (int i = 0; i < transitionCopy.length; i++) {
            checkSum("transition row " + i, transitionCopy[i]);
        }
        for (int i = 0; i < emissionCopy.length; i++) {
            checkSum("emission row " + i, emissionCopy[i]);
        }

        HiddenMarkovModel model = new HiddenMarkovModel(initialCopy, transitionCopy, emissionCopy);
        logger.debug("Created model with {} states and {} symbols", model.numStates, model.numSymbols);
        return model;
    }

    private static void checkDimensions(double[] initial, double[][] transition, double[][] emission) {
        if (initial == null) {
            throw new ConfigurationException("initial probabilities must not be null");
        }
        if (transition == null) {
            throw new ConfigurationException("transition matrix must not be null");
        }
        if (emission == null) {
            throw new ConfigurationException("emission matrix must not be null");
        }

        int n = initial.length;
        if (n < 1) {
            throw new ConfigurationException("model needs at least one state, initial probabilities are empty");
        }
        if (transition.length != n) {
            throw new ConfigurationException(
                    "transition matrix has " + transition.length + " rows, expected " + n + " (number of states)");
        }
        for (int i = 0; i < n; i++) {
            if (transition[i] == null) {
                throw new ConfigurationException("transition row " + i + " must not be null");
            }
            if (transition[i].length != n) {
                throw new ConfigurationException(
                        "transition row " + i + " has " + transition[i].length + " columns, expected " + n);
            }
        }
        if (emission.length != n) {
            throw new ConfigurationException(
                    "emission matrix has " + emission.length + " rows, expected " + n + " (number of states)");
        }
        if (emission[0] == null) {
            throw new ConfigurationException("emission row 0 must not be null");
        }
        int m = emission[0].length;
        if (m < 1) {
            throw new ConfigurationException("model needs at least one observation symbol, emission row 0 is empty");
        }
        for (int i = 1; i < n; i++) {
            if (emission[i] == null) {
                throw new ConfigurationException("emission row " + i + " must not be null");
            }
            if (emission[i].length != m) {
                throw new ConfigurationException(
                        "emission row " + i + " has " + emission[i].length + " columns, expected " + m
                                + " (columns of emission row 0)");
            }
        }
    }

    private static void checkRange(String table, double[] row) {
        for (int j = 0; j < row.length; j++) {
            double p = row[j];
            // also rejects NaN
            if (!(p >= 0.0 && p <= 1.0)) {
                throw new ConfigurationException(table + "[" + j + "] = " + p + " is outside [0, 1]");
            }
        }
    }

    private static void checkSum(String what, double[] row) {
        double sum = LogMath.sum(row);
        if (Math.abs(sum - 1.0) > ROW_SUM_TOLERANCE) {
            throw new ConfigurationException(
                    "sum of " + what + " is " + sum + ", expected 1 within " + ROW_SUM_TOLERANCE);
        }
    }

    private static double[][] copy(double[][] matrix) {
        double[][] out = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            out[i] = matrix[i].clone();
        }
        return out;
    }

    public int numStates() {
        return numStates;
    }

    public int numSymbols() {
        return numSymbols;
    }

    public double initialProbability(int state) {
        return initial[state];
    }

    public double transitionProbability(int from, int to) {
        return transition[from][to];
    }

    public double emissionProbability(int state, int symbol) {
        return emission[state][symbol];
    }

    public double logInitialProbability(int state) {
        return logInitial[state];
    }

    public double logTransitionProbability(int from, int to) {
        return logTransition[from][to];
    }

    public double logEmissionProbability(int state, int symbol) {
        return logEmission[state][symbol];
    }

    /** Copy of the initial distribution. */
    public double[] getInitial() {
        return initial.clone();
    }

    /** Copy of the transition matrix. */
    public double[][] getTransition() {
        return copy(transition);
    }

    /** Copy of the emission matrix. */
    public double[][] getEmission() {
        return copy(emission);
    }

    /**
     * Log of the joint probability P(path, observations) under this model.
     *
     * @return natural log, negative infinity for impossible paths, 0 for empty input
     * @throws IllegalArgumentException if lengths differ or an index is out of range
     */
    public double logJointProbability(int[] path, int[] observations) {
        if (path.length != observations.length) {
            throw new IllegalArgumentException(
                    "Path length " + path.length + " differs from observation length " + observations.length);
        }
        double logP = 0.0;
        for (int t = 0; t < path.length; t++) {
            int s = path[t];
            int o = observations[t];
            if (s < 0 || s >= numStates) {
                throw new IllegalArgumentException("State " + s + " at position " + t + " is not in [0, " + numStates + ")");
            }
            if (o < 0 || o >= numSymbols) {
                throw new IllegalArgumentException("Symbol " + o + " at position " + t + " is not in [0, " + numSymbols + ")");
            }
            logP += (t == 0 ? logInitial[s] : logTransition[path[t - 1]][s]) + logEmission[s][o];
        }
        return logP;
    }

    @Override
    public String toString() {
        return "HiddenMarkovModel{" +
                "states=" + numStates +
                ", symbols=" + numSymbols +
                '}';
    }
}
