package com.reachscan.adapter.reachability;

/** Raised when a run is cancelled; no partial report is produced. */
public class AnalysisCancelledException extends RuntimeException {
    public AnalysisCancelledException(String message) {
        super(message);
    }
}
