package com.fintech.candlesync.sync;

/**
 * Outcome of one gap repair pass over a series.
 */
public record GapRepairResult(int gapsFound, int gapsRepaired, int gapsFailed, int inserted) {

    public static final GapRepairResult EMPTY = new GapRepairResult(0, 0, 0, 0);
}
