package io.github.mandar2812.PlasmaML.wavpol;

/**
 * Exception thrown when a time series breaks up into so many batches
 * that analysing it would require unreasonable amounts of memory.
 *
 * @since    19 Oct 2026
 */
public class BatchOverflowException extends Exception {

    private final int batchCount_;
    private final int maxBatches_;

    /**
     * Constructor.
     *
     * @param  batchCount  number of batches that would be required
     * @param  maxBatches  largest number permitted
     */
    public BatchOverflowException( int batchCount, int maxBatches ) {
        super( "Large number of batches (" + batchCount + " > "
             + maxBatches + ")" );
        batchCount_ = batchCount;
        maxBatches_ = maxBatches;
    }

    /**
     * Returns the number of batches that would have been required.
     *
     * @return  batch count
     */
    public int getBatchCount() {
        return batchCount_;
    }

    /**
     * Returns the batch count ceiling.
     *
     * @return  maximum permitted batch count
     */
    public int getMaxBatches() {
        return maxBatches_;
    }
}
