package com.airgate.autoreply.buffer;

/**
 * Outcome of moving buffered turns into the durable record.
 *
 * @param committed         true once the store confirmed the write
 * @param mergedCount       buffered turns added
 * @param skippedDuplicates buffered turns already present
 * @param totalTurns        size of the record written
 * @param error             why the commit did not happen, null on success
 */
public record CommitResult(boolean committed, int mergedCount, int skippedDuplicates, int totalTurns,
        String error) {

    static CommitResult failed(String error) {
        return new CommitResult(false, 0, 0, 0, error);
    }
}
