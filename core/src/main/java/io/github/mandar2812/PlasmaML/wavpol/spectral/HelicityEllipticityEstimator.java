package io.github.mandar2812.PlasmaML.wavpol.spectral;

import org.apache.commons.math3.complex.Complex;

import io.github.mandar2812.PlasmaML.wavpol.ComplexArctan;
import io.github.mandar2812.PlasmaML.wavpol.TimeSeries;

/**
 * Estimates helicity and ellipticity from a smoothed spectral matrix.
 *
 * <p>For each component <code>a</code>, a complex state vector is formed
 * from row <code>a</code> of the matrix normalised by the square root
 * of its auto-power, with the auto-power element first and the other
 * two components following in ascending order.
 * The vector is rotated in the complex plane by <code>exp(-i gamma/2)</code>,
 * where <code>gamma</code> is chosen to remove the correlation between
 * its real and imaginary parts; the ratio of the imaginary to the real
 * part magnitudes is then the helicity, the minor/major axis ratio of
 * the polarisation ellipse.
 * The ellipticity is got in the same way from the first two elements
 * of the rotated vector, and is signed by the rotation sense implied by
 * <code>Im(M<sub>xy</sub>)</code>: negative values indicate left-handed
 * rotation about z.
 *
 * <p>The three per-component estimates are averaged.  A component
 * with no power gives no estimate and is left out of the average.
 *
 * @since    19 Oct 2026
 */
public class HelicityEllipticityEstimator {

    /** Order in which components appear in the state vector for each row. */
    private static final int[][] ROW_ORDER = {
        { 0, 1, 2 },
        { 1, 0, 2 },
        { 2, 0, 1 },
    };

    /**
     * Private constructor prevents instantiation.
     */
    private HelicityEllipticityEstimator() {
    }

    /**
     * Fills in helicity and ellipticity for the defined bins of a smoothed
     * matrix.  The wavenormal angle must already have been filled in.
     *
     * @param  matrix  smoothed spectral matrix
     * @param  estimates  per-window results to populate
     */
    public static void estimate( SpectralMatrix matrix,
                                 PolarizationEstimates estimates ) {
        double[] helicity = estimates.getHelicity();
        double[] ellipticity = estimates.getEllipticity();
        double[] angle = estimates.getWavenormalAngle();
        double[] hel3 = new double[ 3 ];
        double[] ell3 = new double[ 3 ];
        for ( int k = matrix.getFirstValidBin();
              k <= matrix.getLastValidBin(); k++ ) {
            double sign =
                getHandedness( matrix.get( k, 0, 1 ).getImaginary(),
                               angle[ k ] );
            for ( int a = 0; a < 3; a++ ) {
                Complex[] lambda =
                    rotate( getStateVector( matrix, k, a ) );
                double[] ratios = getAxisRatios( lambda );
                hel3[ a ] = ratios[ 0 ];
                ell3[ a ] = sign * ratios[ 1 ];
            }
            helicity[ k ] = finiteMean( hel3 );
            ellipticity[ k ] = finiteMean( ell3 );
        }
    }

    /**
     * Returns the normalised state vector for one row of the matrix.
     *
     * @param  matrix  spectral matrix
     * @param  k  frequency bin
     * @param  a  row index
     * @return  3-element complex vector
     */
    static Complex[] getStateVector( SpectralMatrix matrix, int k, int a ) {
        int[] order = ROW_ORDER[ a ];
        double amp = Math.sqrt( matrix.get( k, a, a ).getReal() );
        Complex[] lambda = new Complex[ 3 ];
        lambda[ 0 ] = new Complex( amp );
        for ( int m = 1; m < 3; m++ ) {
            Complex el = matrix.get( k, a, order[ m ] );
            lambda[ m ] = new Complex( el.getReal() / amp,
                                       el.getImaginary() / amp );
        }
        return lambda;
    }

    /**
     * Rotates a complex vector so that the real and imaginary parts
     * of its elements are uncorrelated.
     *
     * @param  lambda  input vector
     * @return  rotated vector
     */
    static Complex[] rotate( Complex[] lambda ) {
        double upper = 0;
        double lower = 0;
        for ( int i = 0; i < lambda.length; i++ ) {
            double re = lambda[ i ].getReal();
            double im = lambda[ i ].getImaginary();
            upper += 2 * re * im;
            lower += re * re - im * im;
        }
        double gamma = getRotationAngle( upper, lower );
        Complex phase = new Complex( Math.cos( 0.5 * gamma ),
                                     -Math.sin( 0.5 * gamma ) );
        Complex[] rotated = new Complex[ lambda.length ];
        for ( int i = 0; i < lambda.length; i++ ) {
            rotated[ i ] = phase.multiply( lambda[ i ] );
        }
        return rotated;
    }

    /**
     * Returns the angle by which to rotate given the correlation terms.
     *
     * @param  upper   sum of 2 Re Im products
     * @param  lower   sum of Re<sup>2</sup> - Im<sup>2</sup> differences
     * @return  rotation angle in radians, or NaN if either sum
     *          is not finite
     */
    static double getRotationAngle( double upper, double lower ) {
        if ( ! TimeSeries.isFinite( upper ) ||
             ! TimeSeries.isFinite( lower ) ) {
            return Double.NaN;
        }
        double gamma = ComplexArctan.atan2( upper, lower );
        return upper > 0 ? gamma : 2 * Math.PI + gamma;
    }

    /**
     * Returns the minor/major axis ratios for a rotated state vector.
     *
     * @param  lambda  rotated 3-element state vector
     * @return  2-element array (helicity, unsigned ellipticity)
     */
    static double[] getAxisRatios( Complex[] lambda ) {
        double re2 = 0;
        double im2 = 0;
        for ( int i = 0; i < 3; i++ ) {
            re2 += lambda[ i ].getReal() * lambda[ i ].getReal();
            im2 += lambda[ i ].getImaginary() * lambda[ i ].getImaginary();
        }
        double helicity = Math.sqrt( im2 ) / Math.sqrt( re2 );

        // The transverse pair gets its own decorrelating rotation.
        Complex[] pair = rotate( new Complex[] { lambda[ 0 ], lambda[ 1 ] } );
        double pre2 = 0;
        double pim2 = 0;
        for ( int i = 0; i < 2; i++ ) {
            pre2 += pair[ i ].getReal() * pair[ i ].getReal();
            pim2 += pair[ i ].getImaginary() * pair[ i ].getImaginary();
        }
        double ellipticity = Math.sqrt( pim2 ) / Math.sqrt( pre2 );
        return new double[] { helicity, ellipticity };
    }

    /**
     * Returns the sign to apply to the ellipticity.
     * Since sin(angle) is non-negative over the wavenormal angle range,
     * a vanishing product carries no handedness; in that case the sign
     * of the xy element alone is used, and failing that +1.
     *
     * @param  imXy  imaginary part of the xy spectral matrix element
     * @param  angle  wavenormal angle
     * @return  +1 or -1
     */
    static double getHandedness( double imXy, double angle ) {
        double sign = Math.signum( imXy * Math.sin( angle ) );
        if ( ! ( sign != 0 ) ) {
            sign = Math.signum( imXy );
        }
        return sign != 0 && ! Double.isNaN( sign ) ? sign : 1;
    }

    /**
     * Returns the mean of the finite values in an array.
     *
     * @param  values  values
     * @return  mean of finite values, or NaN if there are none
     */
    static double finiteMean( double[] values ) {
        double sum = 0;
        int n = 0;
        for ( int i = 0; i < values.length; i++ ) {
            if ( TimeSeries.isFinite( values[ i ] ) ) {
                sum += values[ i ];
                n++;
            }
        }
        return n > 0 ? sum / n : Double.NaN;
    }
}
