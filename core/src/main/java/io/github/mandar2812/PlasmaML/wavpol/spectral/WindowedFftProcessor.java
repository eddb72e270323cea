package io.github.mandar2812.PlasmaML.wavpol.spectral;

import java.util.Arrays;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

import io.github.mandar2812.PlasmaML.wavpol.TimeSeries;

/**
 * Produces the one-sided spectra of fixed-length windows of a time series.
 *
 * <p>For each component, the window's raw samples are copied out
 * (the input arrays are never modified), any non-finite samples are
 * replaced by linear interpolation on sample index between the
 * neighbouring finite samples, the taper is applied, and a forward FFT
 * normalised by the window length is taken.  Only the first half of
 * the transform is retained.
 *
 * <p>Instances are immutable and may be used from multiple threads.
 *
 * @since    19 Oct 2026
 */
public class WindowedFftProcessor {

    private final int windowLength_;
    private final Taper taper_;
    private final FastFourierTransformer fft_;

    /**
     * Constructor.
     *
     * @param  windowLength  number of points per window, a power of two
     */
    public WindowedFftProcessor( int windowLength ) {
        windowLength_ = windowLength;
        taper_ = new Taper( windowLength );
        fft_ = new FastFourierTransformer( DftNormalization.STANDARD );
    }

    /**
     * Returns the taper applied to each window.
     *
     * @return  taper
     */
    public Taper getTaper() {
        return taper_;
    }

    /**
     * Transforms the window of a time series starting at a given index.
     *
     * @param  ts  time series
     * @param  start  index of first sample in window; the window must
     *                lie entirely within the series
     * @return  one-sided spectra of the three components
     */
    public WindowSpectra transform( TimeSeries ts, int start ) {
        Complex[][] spectra = new Complex[ 3 ][];
        for ( int ic = 0; ic < 3; ic++ ) {
            double[] data = new double[ windowLength_ ];
            System.arraycopy( ts.getChannel( ic ), start, data, 0,
                              windowLength_ );
            spectra[ ic ] = transformWindow( data );
        }
        return new WindowSpectra( spectra[ 0 ], spectra[ 1 ], spectra[ 2 ] );
    }

    /**
     * Transforms a single window of raw samples.
     * The supplied array is used as workspace.
     *
     * @param  data  window samples, overwritten
     * @return  first half of the normalised forward transform;
     *          all NaN if the window contains no finite samples
     */
    Complex[] transformWindow( double[] data ) {
        int nhalf = windowLength_ / 2;
        Complex[] half = new Complex[ nhalf ];
        if ( ! fillGaps( data ) ) {
            Arrays.fill( half, Complex.NaN );
            return half;
        }
        taper_.apply( data );
        Complex[] full = fft_.transform( data, TransformType.FORWARD );
        double scale = 1.0 / windowLength_;
        for ( int i = 0; i < nhalf; i++ ) {
            half[ i ] = full[ i ].multiply( scale );
        }
        return half;
    }

    /**
     * Replaces non-finite values in an array by linear interpolation
     * on index.  Values before the first finite value take the first
     * finite value, and those after the last take the last.
     *
     * @param  data  array to be filled in place
     * @return  true if the array contains at least one finite value;
     *          if false the array is untouched
     */
    static boolean fillGaps( double[] data ) {
        int n = data.length;
        int iprev = -1;
        for ( int i = 0; i < n; i++ ) {
            if ( TimeSeries.isFinite( data[ i ] ) ) {
                if ( iprev < 0 ) {
                    for ( int j = 0; j < i; j++ ) {
                        data[ j ] = data[ i ];
                    }
                }
                else if ( i - iprev > 1 ) {
                    double v0 = data[ iprev ];
                    double dv = ( data[ i ] - v0 ) / ( i - iprev );
                    for ( int j = iprev + 1; j < i; j++ ) {
                        data[ j ] = v0 + dv * ( j - iprev );
                    }
                }
                iprev = i;
            }
        }
        if ( iprev < 0 ) {
            return false;
        }
        for ( int j = iprev + 1; j < n; j++ ) {
            data[ j ] = data[ iprev ];
        }
        return true;
    }
}
