package com.structds.cli;

/**
 * Process exit codes shared by all commands.
 */
public final class ExitCodes {

    /** Success, including runs where single files failed to parse. */
    public static final int OK = 0;

    /** Reading input or writing output failed. */
    public static final int IO_ERROR = 1;

    /** Unknown filter or invalid setting; nothing was processed. */
    public static final int CONFIGURATION_ERROR = 2;

    private ExitCodes() {
        // Constants only
    }
}
