package org.trypticon.termfst;

import org.trypticon.termfst.util.BytesRef;

/**
 * Thrown when a zero-length key is added.
 */
public class EmptyKeyException extends InvalidKeyException {
    public EmptyKeyException() {
        super("empty keys are not supported", new BytesRef());
    }
}
