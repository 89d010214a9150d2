package ai.imagegraph.executor.model;

/**
 * How a finished image is handed back to the caller.
 */
public enum OutputMode {
    /** Return a backend locator without downloading. */
    URL,
    /** Download the bytes and write them below the save directory. */
    FILE
}
