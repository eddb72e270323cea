package io.github.mandar2812.PlasmaML.wavpol.spectral;

import org.apache.commons.math3.complex.Complex;

/**
 * Smooths a spectral matrix along the frequency axis to reduce
 * the variance of the polarisation estimates.
 *
 * <p>Each element is convolved with the central taps of a fixed
 * 7-point Hanning-like profile.  The weights are applied as they are,
 * without renormalisation.  Only bins with a complete smoothing
 * neighbourhood, <code>h &lt;= k &lt;= nbin-1-h</code> where
 * <code>h = (width-1)/2</code>, are defined in the result.
 *
 * @since    19 Oct 2026
 */
public class SpectralSmoother {

    private final double[] weights_;

    private static final double[] PROFILE = {
        0.024, 0.093, 0.232, 0.301, 0.232, 0.093, 0.024,
    };

    /**
     * Constructor.
     *
     * @param  width  odd number of bins combined, at most the profile length
     */
    public SpectralSmoother( int width ) {
        if ( width < 1 || width % 2 != 1 || width > PROFILE.length ) {
            throw new IllegalArgumentException( "Bad smoothing width "
                                              + width );
        }
        weights_ = new double[ width ];
        System.arraycopy( PROFILE, ( PROFILE.length - width ) / 2,
                          weights_, 0, width );
    }

    /**
     * Returns the weights applied to neighbouring bins.
     *
     * @return  weight array, length equal to smoothing width
     */
    public double[] getWeights() {
        return weights_.clone();
    }

    /**
     * Returns the number of bins at each end of the spectrum
     * for which no smoothed value is available.
     *
     * @return  half width
     */
    public int getHalfWidth() {
        return ( weights_.length - 1 ) / 2;
    }

    /**
     * Smooths a spectral matrix.
     * The input is not modified.
     *
     * @param  raw  unsmoothed matrix, defined for all bins
     * @return  smoothed matrix; NaN outside the interior bin range
     */
    public SpectralMatrix smooth( SpectralMatrix raw ) {
        int nbin = raw.getBinCount();
        int h = getHalfWidth();
        int first = h;
        int last = nbin - 1 - h;
        SpectralMatrix smoothed = new SpectralMatrix( nbin, first, last );
        for ( int k = first; k <= last; k++ ) {
            for ( int i = 0; i < 3; i++ ) {
                for ( int j = 0; j < 3; j++ ) {
                    double re = 0;
                    double im = 0;
                    for ( int m = 0; m < weights_.length; m++ ) {
                        Complex c = raw.get( k - h + m, i, j );
                        re += weights_[ m ] * c.getReal();
                        im += weights_[ m ] * c.getImaginary();
                    }
                    smoothed.set( k, i, j, new Complex( re, im ) );
                }
            }
        }
        return smoothed;
    }
}
