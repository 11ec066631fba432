package org.trypticon.termfst.cli;

/**
 * Constants shared by the commands.
 */
class Constants {
    /**
     * Name the tool is invoked as.
     */
    static final String APP_NAME = "termfst";

    private Constants() {
    }
}
