package com.fintech.candlesync.sync;

/**
 * Outcome of a backfill or live collection for one series.
 *
 * @param fetched Candles returned by the source
 * @param inserted Candles that were new to the store
 */
public record SyncResult(int fetched, int inserted) {

    public static final SyncResult EMPTY = new SyncResult(0, 0);

    /** Candles the store already held: the overlap of this fetch with earlier ones. */
    public int alreadyKnown() {
        return fetched - inserted;
    }
}
