package org.trypticon.termfst;

import org.trypticon.termfst.util.BytesRef;

/**
 * Thrown when a builder rejects a key. The builder is left exactly as it was before the call,
 * so the caller can decide whether to skip the key or abandon the whole load.
 */
public abstract class InvalidKeyException extends Exception {
    private final BytesRef key;

    protected InvalidKeyException(String message, BytesRef key) {
        super(message);
        this.key = key;
    }

    /**
     * Gets the rejected key.
     *
     * @return a copy of the rejected key.
     */
    public BytesRef getKey() {
        return key;
    }
}
