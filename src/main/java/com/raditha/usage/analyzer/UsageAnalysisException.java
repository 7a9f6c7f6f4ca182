package com.raditha.usage.analyzer;

/**
 * Aborts an analysis run. Partial results are never reported.
 */
public class UsageAnalysisException extends RuntimeException {

    public UsageAnalysisException(String message) {
        super(message);
    }

    public UsageAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
