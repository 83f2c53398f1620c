package com.hiddenmarkov.config;

import com.hiddenmarkov.model.ConfigurationException;
import com.hiddenmarkov.model.HiddenMarkovModel;

import java.util.List;

/**
 * JSON description of a named model with labels for its states and symbols.
 */
public class ModelDefinition {
    public String name;
    public List<String> states;
    public List<String> symbols;
    public double[] initial;
    public double[][] transition;
    public double[][] emission;

    public ModelDefinition() {
    }

    public ModelDefinition(String name, List<String> states, List<String> symbols,
            double[] initial, double[][] transition, double[][] emission) {
        this.name = name;
        this.states = states;
        this.symbols = symbols;
        this.initial = initial;
        this.transition = transition;
        this.emission = emission;
    }

    /**
     * Validates the tables and labels and builds the model.
     *
     * @throws ConfigurationException if the tables are invalid or the label counts do not match them
     */
    public HiddenMarkovModel toModel() {
        HiddenMarkovModel model = HiddenMarkovModel.create(initial, transition, emission);
        if (states == null || states.size() != model.numStates()) {
            throw new ConfigurationException("Model '" + name + "' has " + (states == null ? 0 : states.size())
                    + " state labels, expected " + model.numStates());
        }
        if (symbols == null || symbols.size() != model.numSymbols()) {
            throw new ConfigurationException("Model '" + name + "' has " + (symbols == null ? 0 : symbols.size())
                    + " symbol labels, expected " + model.numSymbols());
        }
        return model;
    }
}
