package io.github.mandar2812.PlasmaML.wavpol;

import org.apache.commons.math3.complex.Complex;

/**
 * Two-argument arctangent for real and complex arguments.
 *
 * <p>Both variants return the angle whose tangent is <code>y/x</code>.
 * The real variant is the usual quadrant-aware {@link Math#atan2}.
 * The complex variant is defined via the principal complex logarithm as
 * <pre>
 *    -i log( (x + i y) / sqrt(x<sup>2</sup> + y<sup>2</sup>) )
 * </pre>
 * which agrees with the real variant for real arguments.
 * Callers choose the variant according to the type of their arguments.
 *
 * @since    19 Oct 2026
 */
public class ComplexArctan {

    private static final Complex MINUS_I = Complex.I.negate();

    /**
     * Private constructor prevents instantiation.
     */
    private ComplexArctan() {
    }

    /**
     * Real two-argument arctangent.
     *
     * @param  y   ordinate
     * @param  x   abscissa
     * @return  angle in the range -pi..pi, NaN if either argument is NaN
     */
    public static double atan2( double y, double x ) {
        return Math.atan2( y, x );
    }

    /**
     * Complex two-argument arctangent.
     * If both arguments are zero the result is NaN.
     *
     * @param  y   ordinate
     * @param  x   abscissa
     * @return  complex angle
     */
    public static Complex atan2( Complex y, Complex x ) {
        Complex num = x.add( y.multiply( Complex.I ) );
        Complex den = x.multiply( x ).add( y.multiply( y ) ).sqrt();
        return num.divide( den ).log().multiply( MINUS_I );
    }
}
