package io.github.trackidity.flow_finder;

/**
 * A structural problem that makes the whole run fail. No partial result is produced.
 */
public class AnalysisException extends Exception {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
