package org.trypticon.termfst;

/**
 * Sink for diagnostic messages from the builders and the dictionary.
 * Messages are tagged with a component: {@code "FST"} for automaton construction
 * and {@code "DICT"} for corpus loading.
 *
 * <p>Callers check {@link #isEnabled(String)} before formatting a message so that
 * a disabled stream costs nothing:</p>
 *
 * <pre>
 * if (infoStream.isEnabled("FST")) {
 *     infoStream.message("FST", "built " + count + " keys: " + stats);
 * }
 * </pre>
 */
public interface InfoStream {

    /**
     * Discards everything. Used when no stream is configured.
     */
    InfoStream NO_OUTPUT = new InfoStream() {
        @Override
        public void message(String component, String line) {
        }

        @Override
        public boolean isEnabled(String component) {
            return false;
        }
    };

    /**
     * Writes one message line. Only called when {@link #isEnabled(String)} is
     * {@code true} for the same component.
     *
     * @param component the component tag.
     * @param line the message.
     */
    void message(String component, String line);

    /**
     * @param component the component tag.
     * @return whether messages for the component are wanted.
     */
    boolean isEnabled(String component);
}
