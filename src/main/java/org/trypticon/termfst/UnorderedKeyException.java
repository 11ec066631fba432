package org.trypticon.termfst;

import org.trypticon.termfst.util.BytesRef;

/**
 * Thrown when a key sorts before the previously accepted key.
 */
public class UnorderedKeyException extends InvalidKeyException {
    private final BytesRef previous;

    public UnorderedKeyException(BytesRef key, BytesRef previous) {
        super("keys must be added in lexicographic order: " + key.utf8ToString()
              + " < " + previous.utf8ToString(), key);
        this.previous = previous;
    }

    /**
     * Gets the last key which was accepted before the rejected one.
     *
     * @return the previous key.
     */
    public BytesRef getPrevious() {
        return previous;
    }
}
