package io.github.mandar2812.PlasmaML.wavpol;

/**
 * Contiguous run of samples within a time series over which the
 * sampling cadence is consistent.
 *
 * @since    19 Oct 2026
 */
public class Batch {

    private final int start_;
    private final int end_;
    private final double sampleFrequency_;

    /**
     * Constructor.
     *
     * @param  start  index of first sample, inclusive
     * @param  end   index of last sample, exclusive
     * @param  sampleFrequency   sampling frequency in Hz
     */
    public Batch( int start, int end, double sampleFrequency ) {
        if ( end <= start ) {
            throw new IllegalArgumentException( "Empty batch " + start
                                              + "-" + end );
        }
        start_ = start;
        end_ = end;
        sampleFrequency_ = sampleFrequency;
    }

    /**
     * Returns the index of the first sample.
     *
     * @return  inclusive start index
     */
    public int getStart() {
        return start_;
    }

    /**
     * Returns the index following the last sample.
     *
     * @return  exclusive end index
     */
    public int getEnd() {
        return end_;
    }

    /**
     * Returns the number of samples.
     *
     * @return  end - start
     */
    public int getLength() {
        return end_ - start_;
    }

    /**
     * Returns the sampling frequency inferred for this batch.
     *
     * @return  sampling frequency in Hz
     */
    public double getSampleFrequency() {
        return sampleFrequency_;
    }

    /**
     * Returns the number of FFT windows of a given size and stride
     * which fit entirely within this batch.
     *
     * @param  windowLength  window size
     * @param  stride   window advance
     * @return  window count, possibly zero
     */
    public int getWindowCount( int windowLength, int stride ) {
        int leng = getLength();
        return leng < windowLength ? 0
                                   : ( leng - windowLength ) / stride + 1;
    }

    @Override
    public String toString() {
        return "[" + start_ + "," + end_ + ")@" + sampleFrequency_ + "Hz";
    }
}
