package com.hiddenmarkov.inference;

import com.hiddenmarkov.config.ModelDefinition;
import com.hiddenmarkov.model.ConfigurationException;
import com.hiddenmarkov.model.HiddenMarkovModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes sequences of domain labels (bases, coin faces) and returns state labels,
 * using the label lists of a {@link ModelDefinition}.
 */
public class LabeledSequenceDecoder {
    private static final Logger logger = LoggerFactory.getLogger(LabeledSequenceDecoder.class);

    private final HiddenMarkovModel model;
    private final List<String> stateLabels;
    private final Map<String, Integer> symbolIndex = new HashMap<>();

    public LabeledSequenceDecoder(ModelDefinition definition) {
        this.model = definition.toModel();
        this.stateLabels = List.copyOf(definition.states);
        for (int i = 0; i < definition.symbols.size(); i++) {
            Integer previous = symbolIndex.put(definition.symbols.get(i), i);
            if (previous != null) {
                throw new ConfigurationException("Model '" + definition.name
                        + "' lists symbol '" + definition.symbols.get(i) + "' twice");
            }
        }
        logger.debug("Labeled decoder for '{}' with states {} and symbols {}", definition.name, stateLabels,
                definition.symbols);
    }

    public HiddenMarkovModel getModel() {
        return model;
    }

    /**
     * Maps symbol labels to observation indices.
     *
     * @throws DecodeException naming the first unknown label and its position
     */
    public int[] encode(List<String> symbols) {
        int[] observations = new int[symbols.size()];
        for (int t = 0; t < observations.length; t++) {
            Integer idx = symbolIndex.get(symbols.get(t));
            if (idx == null) {
                throw new DecodeException("Unknown symbol '" + symbols.get(t) + "' at position " + t, t);
            }
            observations[t] = idx;
        }
        return observations;
    }

    public List<String> labelStates(int[] path) {
        List<String> labels = new ArrayList<>(path.length);
        for (int s : path) {
            labels.add(stateLabels.get(s));
        }
        return labels;
    }

    public List<String> decode(List<String> symbols) {
        return labelStates(ViterbiDecoder.decode(model, encode(symbols)));
    }

    /**
     * Decodes a string in which every character is one symbol label, e.g. {@code "ATGCGA"}.
     */
    public List<String> decodeCharacters(CharSequence sequence) {
        List<String> symbols = new ArrayList<>(sequence.length());
        for (int i = 0; i < sequence.length(); i++) {
            symbols.add(String.valueOf(sequence.charAt(i)));
        }
        return decode(symbols);
    }
}
