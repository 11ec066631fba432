package org.trypticon.termfst;

import org.trypticon.termfst.util.BytesRef;

/**
 * Thrown when a key equal to the previously accepted key is added.
 */
public class DuplicateKeyException extends InvalidKeyException {
    public DuplicateKeyException(BytesRef key) {
        super("duplicate key: " + key.utf8ToString(), key);
    }
}
