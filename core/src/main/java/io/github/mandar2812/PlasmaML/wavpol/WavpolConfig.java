package io.github.mandar2812.PlasmaML.wavpol;

/**
 * Immutable set of parameters for a wave polarisation analysis run.
 *
 * <p>Negative values given to the constructor select the defaults,
 * so that callers passing through user-supplied "unset" values
 * do not have to work the defaults out for themselves.
 * All other values are checked on construction, and a
 * {@link WavpolConfigException} is thrown if they are unusable.
 *
 * @since    19 Oct 2026
 */
public class WavpolConfig {

    private final int windowLength_;
    private final int stride_;
    private final int smoothingWidth_;
    private final int threadCount_;

    /** Default number of points in each FFT window. */
    public static final int DEFAULT_WINDOW_LENGTH = 256;

    /** Default number of frequency bins combined by smoothing. */
    public static final int DEFAULT_SMOOTHING_WIDTH = 3;

    /** Largest permitted smoothing width (size of the smoothing profile). */
    public static final int MAX_SMOOTHING_WIDTH = 7;

    /**
     * Constructs a single-threaded configuration.
     *
     * @param  windowLength  number of points in each FFT window,
     *                       or negative for {@link #DEFAULT_WINDOW_LENGTH}
     * @param  stride   number of points by which successive windows are
     *                  advanced, or negative for half the window length
     * @param  smoothingWidth  odd number of frequency bins combined by
     *                         smoothing, or negative for
     *                         {@link #DEFAULT_SMOOTHING_WIDTH}
     */
    public WavpolConfig( int windowLength, int stride, int smoothingWidth ) {
        this( windowLength, stride, smoothingWidth, 1 );
    }

    /**
     * Constructs a configuration.
     *
     * @param  windowLength  number of points in each FFT window,
     *                       or negative for {@link #DEFAULT_WINDOW_LENGTH}
     * @param  stride   number of points by which successive windows are
     *                  advanced, or negative for half the window length
     * @param  smoothingWidth  odd number of frequency bins combined by
     *                         smoothing, or negative for
     *                         {@link #DEFAULT_SMOOTHING_WIDTH}
     * @param  threadCount  number of threads used to process windows,
     *                      or negative for 1
     * @throws  WavpolConfigException  if any value is unusable
     */
    public WavpolConfig( int windowLength, int stride, int smoothingWidth,
                         int threadCount ) {
        windowLength_ = windowLength < 0 ? DEFAULT_WINDOW_LENGTH
                                         : windowLength;
        stride_ = stride < 0 ? windowLength_ / 2 : stride;
        smoothingWidth_ = smoothingWidth < 0 ? DEFAULT_SMOOTHING_WIDTH
                                             : smoothingWidth;
        threadCount_ = threadCount < 0 ? 1 : threadCount;

        // The FFT is radix-2.
        if ( windowLength_ < 4 || Integer.bitCount( windowLength_ ) != 1 ) {
            throw new WavpolConfigException( "windowLength",
                                             "must be a power of two >= 4, "
                                           + "not " + windowLength_ );
        }
        if ( stride_ < 1 ) {
            throw new WavpolConfigException( "stride",
                                             "must be positive, not "
                                           + stride_ );
        }
        if ( smoothingWidth_ % 2 != 1 ||
             smoothingWidth_ > MAX_SMOOTHING_WIDTH ) {
            throw new WavpolConfigException( "smoothingWidth",
                                             "must be odd and in the range "
                                           + "1-" + MAX_SMOOTHING_WIDTH
                                           + ", not " + smoothingWidth_ );
        }
        if ( smoothingWidth_ > windowLength_ / 2 ) {
            throw new WavpolConfigException( "smoothingWidth",
                                             "wider than the "
                                           + windowLength_ / 2
                                           + " frequency bins available" );
        }
        if ( threadCount_ < 1 ) {
            throw new WavpolConfigException( "threadCount",
                                             "must be positive, not "
                                           + threadCount_ );
        }
    }

    /**
     * Returns a configuration with all default values.
     *
     * @return  default configuration
     */
    public static WavpolConfig createDefault() {
        return new WavpolConfig( -1, -1, -1, -1 );
    }

    /**
     * Returns the number of points in each FFT window.
     *
     * @return  window length, a power of two
     */
    public int getWindowLength() {
        return windowLength_;
    }

    /**
     * Returns the number of points by which successive windows
     * are advanced.
     *
     * @return  stride
     */
    public int getStride() {
        return stride_;
    }

    /**
     * Returns the number of frequency bins combined by smoothing.
     *
     * @return  odd smoothing width
     */
    public int getSmoothingWidth() {
        return smoothingWidth_;
    }

    /**
     * Returns the number of threads used to process windows.
     *
     * @return  thread count, 1 for processing in the calling thread
     */
    public int getThreadCount() {
        return threadCount_;
    }

    /**
     * Returns the number of frequency bins in each output spectrum.
     *
     * @return  half the window length
     */
    public int getFrequencyCount() {
        return windowLength_ / 2;
    }

    @Override
    public String toString() {
        return "windowLength=" + windowLength_
             + ", stride=" + stride_
             + ", smoothingWidth=" + smoothingWidth_
             + ", threads=" + threadCount_;
    }
}
