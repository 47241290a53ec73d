package com.di.awardscope.export;

/**
 * Called by the streamer after each batch has been flushed to the sink.
 */
@FunctionalInterface
public interface ExportProgressListener {

    ExportProgressListener NONE = (job, rowsEmitted, estimatedRows) -> { };

    /**
     * @param job           the export's job; listeners may cancel it
     * @param rowsEmitted   rows written so far
     * @param estimatedRows rows the estimate announced ({@code -1} when unknown)
     */
    void onBatch(ExportJob job, long rowsEmitted, long estimatedRows);

    /** {@code rowsEmitted / estimatedRows}, capped to [0, 1]; 0 when the estimate is unknown. */
    static double fraction(long rowsEmitted, long estimatedRows) {
        if (estimatedRows <= 0) {
            return estimatedRows == 0 ? 1.0 : 0.0;
        }
        return Math.min(1.0, Math.max(0.0, (double) rowsEmitted / estimatedRows));
    }
}
