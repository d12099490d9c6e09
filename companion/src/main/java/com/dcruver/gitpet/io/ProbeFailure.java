package com.dcruver.gitpet.io;

/**
 * Reasons a git probe can degrade instead of producing output.
 */
public enum ProbeFailure {
    /**
     * Process did not finish within its timeout budget and was killed
     */
    TIMED_OUT,

    /**
     * Process finished with a non-zero exit code (not a repository, no commits, no grep match...)
     */
    NON_ZERO_EXIT,

    /**
     * Process could not be started or its output could not be read
     */
    EXECUTION_FAILED,

    /**
     * Process wrote more than the probe's output limit
     */
    OUTPUT_TOO_LARGE,

    /**
     * Calling thread was interrupted while waiting
     */
    INTERRUPTED,

    /**
     * Output was produced but did not have the expected shape
     */
    MALFORMED_OUTPUT
}
