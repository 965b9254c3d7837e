package com.framelint.cli;

/**
 * Process exit codes shared by all commands.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int ERROR = 1;
    /** The analysis ran but the requested generation gate is closed. */
    public static final int GATE_FAILED = 2;

    private ExitCodes() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
