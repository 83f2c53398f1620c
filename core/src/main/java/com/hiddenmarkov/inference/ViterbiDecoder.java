package com.hiddenmarkov.inference;

import com.hiddenmarkov.model.HiddenMarkovModel;
import com.hiddenmarkov.util.LogMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Maximum a posteriori decoding of hidden state sequences with the Viterbi algorithm.
 * <p>
 * Scores are accumulated as natural-log probabilities so long sequences do not underflow.
 * When several predecessor states (or final states) reach exactly the same score, the one
 * with the smallest index is chosen.
 * <p>
 * Decoding keeps no state between calls; any number of threads may decode against the
 * same model concurrently.
 */
public final class ViterbiDecoder {
    private static final Logger logger = LoggerFactory.getLogger(ViterbiDecoder.class);

    private ViterbiDecoder() {
    }

    /**
     * Computes the most likely hidden state sequence for the observations.
     *
     * @param model        the model to decode against
     * @param observations symbol indices, each in {@code [0, model.numSymbols())}
     * @return one state index per observation, empty for empty input
     * @throws DecodeException if a symbol is out of range
     */
    public static int[] decode(HiddenMarkovModel model, int[] observations) {
        return decodeWithScore(model, observations).getPath();
    }

    /**
     * Same as {@link #decode(HiddenMarkovModel, int[])} but also reports the joint log
     * probability of the returned path.
     */
    public static ViterbiResult decodeWithScore(HiddenMarkovModel model, int[] observations) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(observations, "observations must not be null");
        checkObservations(model, observations);

        int length = observations.length;
        if (length == 0) {
            return new ViterbiResult(new int[0], 0.0);
        }

        long startTime = System.nanoTime();
        int numStates = model.numStates();

        // score[t * numStates + s]: best log probability of a path ending in s at time t
        double[] score = new double[length * numStates];
        // backPointer[t * numStates + s]: predecessor of s on that path, unused for t = 0
        int[] backPointer = new int[length * numStates];

        int first = observations[0];
        for (int s = 0; s < numStates; s++) {
            score[s] = model.logInitialProbability(s) + model.logEmissionProbability(s, first);
        }

        for (int t = 1; t < length; t++) {
            int prevRow = (t - 1) * numStates;
            int row = t * numStates;
            int symbol = observations[t];
            for (int s = 0; s < numStates; s++) {
                int bestPrev = 0;
                double bestScore = score[prevRow] + model.logTransitionProbability(0, s);
                for (int prev = 1; prev < numStates; prev++) {
                    double candidate = score[prevRow + prev] + model.logTransitionProbability(prev, s);
                    if (candidate > bestScore) {
                        bestScore = candidate;
                        bestPrev = prev;
                    }
                }
                score[row + s] = bestScore + model.logEmissionProbability(s, symbol);
                backPointer[row + s] = bestPrev;
            }

            if (logger.isTraceEnabled()) {
                logger.trace("t={} scores={}", t, Arrays.toString(Arrays.copyOfRange(score, row, row + numStates)));
            }
        }

        int lastRow = (length - 1) * numStates;
        int finalState = LogMath.argmax(score, lastRow, numStates);
        double logProbability = score[lastRow + finalState];

        int[] path = new int[length];
        path[length - 1] = finalState;
        for (int t = length - 1; t > 0; t--) {
            path[t - 1] = backPointer[t * numStates + path[t]];
        }

        if (logger.isDebugEnabled()) {
            long micros = (System.nanoTime() - startTime) / 1000;
            logger.debug("Decoded {} observations over {} states in {} us, log probability {}",
                    length, numStates, micros, logProbability);
        }
        return new ViterbiResult(path, logProbability);
    }

    private static void checkObservations(HiddenMarkovModel model, int[] observations) {
        int numSymbols = model.numSymbols();
        for (int t = 0; t < observations.length; t++) {
            int symbol = observations[t];
            if (symbol < 0 || symbol >= numSymbols) {
                throw new DecodeException("Observation symbol " + symbol + " at position " + t
                        + " is outside [0, " + numSymbols + ")", t);
            }
        }
    }
}
