package io.github.mandar2812.PlasmaML.wavpol;

/**
 * Three-component time series supplied for polarisation analysis.
 *
 * <p>The arrays are not copied; they remain owned by the caller and
 * are only read by the analysis.
 * Times are in seconds and are expected, but not required,
 * to be monotonically increasing.  Both times and channel values
 * may contain non-finite values.
 *
 * @since    19 Oct 2026
 */
public class TimeSeries {

    private final double[] times_;
    private final double[][] channels_;

    /**
     * Constructor.
     *
     * @param  times  sample times in seconds
     * @param  x    first component, conventionally perpendicular to
     *              the ambient field
     * @param  y    second component
     * @param  z    third component, conventionally along the ambient field
     * @throws  IllegalArgumentException  if the arrays are of different
     *          lengths or contain fewer than two samples
     */
    public TimeSeries( double[] times, double[] x, double[] y, double[] z ) {
        if ( times == null || x == null || y == null || z == null ) {
            throw new IllegalArgumentException( "Null array" );
        }
        int n = times.length;
        if ( x.length != n || y.length != n || z.length != n ) {
            throw new IllegalArgumentException( "Array length mismatch: "
                                              + n + ", " + x.length + ", "
                                              + y.length + ", " + z.length );
        }
        if ( n < 2 ) {
            throw new IllegalArgumentException( "Not enough samples ("
                                              + n + ")" );
        }
        times_ = times;
        channels_ = new double[][] { x, y, z };
    }

    /**
     * Returns the number of samples.
     *
     * @return  sample count
     */
    public int getSampleCount() {
        return times_.length;
    }

    /**
     * Returns the sample times.
     *
     * @return  time array, not copied
     */
    public double[] getTimes() {
        return times_;
    }

    /**
     * Returns the values of one component.
     *
     * @param  ic  component index, 0, 1 or 2 for x, y or z
     * @return  value array, not copied
     */
    public double[] getChannel( int ic ) {
        return channels_[ ic ];
    }

    /**
     * Counts the samples in a range at which all three components
     * have finite values.
     *
     * @param  start  first index, inclusive
     * @param  end   last index, exclusive
     * @return  number of fully finite samples
     */
    public int countFinite( int start, int end ) {
        int count = 0;
        double[] x = channels_[ 0 ];
        double[] y = channels_[ 1 ];
        double[] z = channels_[ 2 ];
        for ( int i = start; i < end; i++ ) {
            if ( isFinite( x[ i ] ) && isFinite( y[ i ] ) &&
                 isFinite( z[ i ] ) ) {
                count++;
            }
        }
        return count;
    }

    /**
     * Indicates whether a value is neither NaN nor infinite.
     *
     * @param  value  value to test
     * @return  true iff finite
     */
    public static boolean isFinite( double value ) {
        return ! Double.isNaN( value ) && ! Double.isInfinite( value );
    }
}
