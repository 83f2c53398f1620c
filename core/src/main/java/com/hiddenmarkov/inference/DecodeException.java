package com.hiddenmarkov.inference;

/**
 * Thrown when an observation sequence cannot be decoded against a model.
 */
public class DecodeException extends IllegalArgumentException {

    private final int position;

    public DecodeException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Position of the offending observation in the input sequence.
     */
    public int getPosition() {
        return position;
    }
}
