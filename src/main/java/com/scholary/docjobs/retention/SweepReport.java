package com.scholary.docjobs.retention;

/**
 * Outcome of one retention sweep.
 *
 * @param skipped jobs whose outputs could not be deleted; they stay unpurged for the next sweep
 */
public record SweepReport(int candidates, int purged, int skipped, int historyEntriesDeleted) {}
