package io.github.mandar2812.PlasmaML.wavpol.spectral;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

class HelicityEllipticityEstimatorTest {

    @Test
    void circularStateHasUnitAxisRatio() {
        // x leads y by a quarter cycle: left-handed about z.
        Complex[] v = { Complex.ONE, Complex.I, Complex.ZERO };
        PolarizationEstimates est = estimate( v );
        assertThat( est.getHelicity()[ 2 ] ).isCloseTo( 1.0, within( 1e-9 ) );
        assertThat( est.getEllipticity()[ 2 ] )
            .isCloseTo( -1.0, within( 1e-9 ) );
    }

    @Test
    void oppositeRotationFlipsSign() {
        Complex[] v = { Complex.ONE, Complex.I.negate(), Complex.ZERO };
        PolarizationEstimates est = estimate( v );
        assertThat( est.getEllipticity()[ 2 ] )
            .isCloseTo( 1.0, within( 1e-9 ) );
    }

    @Test
    void linearStateHasZeroAxisRatio() {
        Complex[] v = { new Complex( 1 ), new Complex( 2 ), Complex.ZERO };
        PolarizationEstimates est = estimate( v );
        assertThat( est.getHelicity()[ 2 ] ).isCloseTo( 0.0, within( 1e-9 ) );
        assertThat( est.getEllipticity()[ 2 ] )
            .isCloseTo( 0.0, within( 1e-9 ) );
    }

    @Test
    void ellipticalState() {
        Complex[] v = { new Complex( 2 ), new Complex( 0, 1 ),
                        Complex.ZERO };
        Complex[] lambda = HelicityEllipticityEstimator.rotate(
            HelicityEllipticityEstimator
           .getStateVector( PolarizationAnalyzerTest.outerProduct( 1, v ),
                            0, 0 ) );
        double[] ratios = HelicityEllipticityEstimator.getAxisRatios( lambda );
        assertThat( ratios[ 0 ] ).isCloseTo( 0.5, within( 1e-9 ) );
        assertThat( ratios[ 1 ] ).isCloseTo( 0.5, within( 1e-9 ) );
    }

    @Test
    void handedness() {
        assertThat( HelicityEllipticityEstimator.getHandedness( -2, 0.3 ) )
            .isEqualTo( -1.0 );
        assertThat( HelicityEllipticityEstimator.getHandedness( 2, 0.3 ) )
            .isEqualTo( 1.0 );
        assertThat( HelicityEllipticityEstimator.getHandedness( -2, 0 ) )
            .isEqualTo( -1.0 );
        assertThat( HelicityEllipticityEstimator.getHandedness( 0, 0 ) )
            .isEqualTo( 1.0 );
        assertThat( HelicityEllipticityEstimator
                   .getHandedness( Double.NaN, Double.NaN ) )
            .isEqualTo( 1.0 );
        assertThat( HelicityEllipticityEstimator.getHandedness( 1, Double.NaN ) )
            .isEqualTo( 1.0 );
    }

    @Test
    void rotationAngle() {
        assertThat( HelicityEllipticityEstimator.getRotationAngle( 1, 0 ) )
            .isCloseTo( 0.5 * Math.PI, within( 1e-12 ) );
        assertThat( HelicityEllipticityEstimator.getRotationAngle( -1, 0 ) )
            .isCloseTo( 1.5 * Math.PI, within( 1e-12 ) );
        assertThat( HelicityEllipticityEstimator
                   .getRotationAngle( Double.NaN, 1 ) ).isNaN();
        assertThat( HelicityEllipticityEstimator
                   .getRotationAngle( 1, Double.POSITIVE_INFINITY ) ).isNaN();
    }

    @Test
    void meanIgnoresNonFinite() {
        assertThat( HelicityEllipticityEstimator
                   .finiteMean( new double[] { 1, Double.NaN, 3 } ) )
            .isEqualTo( 2.0 );
        assertThat( HelicityEllipticityEstimator
                   .finiteMean( new double[] { Double.NaN,
                                               Double.POSITIVE_INFINITY } ) )
            .isNaN();
    }

    private static PolarizationEstimates estimate( Complex[] v ) {
        SpectralMatrix m = PolarizationAnalyzerTest.outerProduct( 5, v );
        PolarizationEstimates est = new PolarizationEstimates( 5 );
        Arrays.fill( est.getWavenormalAngle(), 0.0 );
        HelicityEllipticityEstimator.estimate( m, est );
        return est;
    }
}
