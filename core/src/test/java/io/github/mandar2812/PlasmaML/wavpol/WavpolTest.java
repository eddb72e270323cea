package io.github.mandar2812.PlasmaML.wavpol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;

import io.github.mandar2812.PlasmaML.wavpol.spectral.Taper;

class WavpolTest {

    @Test
    void circularExample() {
        int n = 401;
        double[] t = new double[ n ];
        double[] x = new double[ n ];
        double[] y = new double[ n ];
        double[] z = new double[ n ];
        for ( int i = 0; i < n; i++ ) {
            t[ i ] = i / 10.0;
            x[ i ] = Math.sin( 2 * Math.PI * t[ i ] );
            y[ i ] = Math.cos( 2 * Math.PI * t[ i ] );
        }
        WavpolResult result =
            new Wavpol( new WavpolConfig( 128, 64, 3 ) ).analyze( t, x, y, z );

        assertThat( result.isError() ).isFalse();
        assertThat( result.getRowCount() ).isEqualTo( 5 );
        assertThat( result.getFrequencyCount() ).isEqualTo( 64 );
        assertThat( result.getTimeline() )
            .containsExactly( new double[] { 6.4, 12.8, 19.2, 25.6, 32.0 },
                              within( 1e-9 ) );
        assertThat( result.getFreqline()[ 13 ] )
            .isCloseTo( 1.015625, within( 1e-12 ) );
        for ( int ir = 0; ir < 5; ir++ ) {
            int kpeak = argmax( result.getPower()[ ir ] );
            assertThat( kpeak ).isEqualTo( 13 );
            assertThat( result.getDegreeOfPolarization()[ ir ][ kpeak ] )
               .isGreaterThan( 0.9 );
            assertThat( result.getHelicity()[ ir ][ kpeak ] )
               .isGreaterThan( 0.9 );
            assertThat( result.getWavenormalAngle()[ ir ][ kpeak ] )
               .isCloseTo( 0.0, within( 1e-9 ) );

            // x leads y, so left-handed about z.
            assertThat( result.getEllipticity()[ ir ][ kpeak ] )
               .isCloseTo( -1.0, within( 0.1 ) );
            assertThat( result.getAxisPower()[ ir ][ kpeak ][ 2 ] )
               .isEqualTo( 0.0 );
        }
    }

    @Test
    void rightHandedCircularSignal() {
        int n = 300;
        double[] t = new double[ n ];
        double[] x = new double[ n ];
        double[] y = new double[ n ];
        double[] z = new double[ n ];
        for ( int i = 0; i < n; i++ ) {
            t[ i ] = 1000.0 + i;
            double phase = 2 * Math.PI * 8 * i / 64.0;
            x[ i ] = 3 * Math.cos( phase );
            y[ i ] = 3 * Math.sin( phase );
        }
        WavpolResult result =
            new Wavpol( new WavpolConfig( 64, 32, 5 ) ).analyze( t, x, y, z );
        assertThat( result.getRowCount() ).isEqualTo( ( n - 64 ) / 32 + 1 );
        for ( int ir = 0; ir < result.getRowCount(); ir++ ) {
            assertThat( result.getDegreeOfPolarization()[ ir ][ 8 ] )
               .isGreaterThan( 0.95 );
            assertThat( result.getEllipticity()[ ir ][ 8 ] )
               .isGreaterThan( 0.9 );
        }
    }

    @Test
    void linearSignalHasNoEllipticity() {
        int n = 600;
        double[] t = new double[ n ];
        double[] x = new double[ n ];
        double[] y = new double[ n ];
        double[] z = new double[ n ];
        for ( int i = 0; i < n; i++ ) {
            t[ i ] = i * 0.5;
            x[ i ] = Math.sin( 2 * Math.PI * 10 * i / 128.0 );
            y[ i ] = 0.5 * x[ i ];
        }
        WavpolResult result =
            new Wavpol( new WavpolConfig( 128, -1, 3 ) ).analyze( t, x, y, z );
        for ( int ir = 0; ir < result.getRowCount(); ir++ ) {
            assertThat( argmax( result.getPower()[ ir ] ) ).isEqualTo( 10 );
            assertThat( Math.abs( result.getEllipticity()[ ir ][ 10 ] ) )
               .isLessThan( 0.05 );
            assertThat( result.getDegreeOfPolarization()[ ir ][ 10 ] )
               .isCloseTo( 1.0, within( 1e-6 ) );
        }
    }

    @Test
    void powerSatisfiesParseval() {
        int wlen = 256;
        int n = wlen + 1;
        double[] t = new double[ n ];
        double[][] data = new double[ 3 ][ n ];
        for ( int i = 0; i < n; i++ ) {
            t[ i ] = i / 256.0;
            double phase = 2 * Math.PI * 32 * i / 256.0;
            data[ 0 ][ i ] = Math.sin( phase );
            data[ 1 ][ i ] = 0.5 * Math.cos( phase );
            data[ 2 ][ i ] = 0.2 * Math.sin( phase + 1.0 );
        }
        WavpolResult result = new Wavpol( new WavpolConfig( wlen, -1, 7 ) )
                             .analyze( t, data[ 0 ], data[ 1 ], data[ 2 ] );
        assertThat( result.getRowCount() ).isEqualTo( 1 );

        double df = result.getFreqline()[ 1 ];
        assertThat( df ).isEqualTo( 1.0 );
        double sum = 0;
        for ( double p : result.getPower()[ 0 ] ) {
            if ( TimeSeries.isFinite( p ) ) {
                sum += p * df;
            }
        }

        // Smoothing kernel weights sum to 0.999.
        Taper taper = new Taper( wlen );
        double meanSq = 0;
        for ( int ic = 0; ic < 3; ic++ ) {
            for ( int i = 0; i < wlen; i++ ) {
                double v = taper.getWeight( i ) * data[ ic ][ i ];
                meanSq += v * v / wlen;
            }
        }
        double expected = 0.999 * meanSq / taper.getEnergyFactor();
        assertThat( sum ).isCloseTo( expected, within( 1e-9 * expected ) );
    }

    @Test
    void analysisIsDeterministic() {
        double[][] data = noisyInput( 1000, 5L );
        Wavpol wavpol = new Wavpol( new WavpolConfig( 64, 16, 3 ) );
        WavpolResult r1 = wavpol.analyze( data[ 0 ], data[ 1 ], data[ 2 ],
                                          data[ 3 ] );
        WavpolResult r2 = wavpol.analyze( data[ 0 ], data[ 1 ], data[ 2 ],
                                          data[ 3 ] );
        assertSameResult( r1, r2 );
    }

    @Test
    void threadCountDoesNotChangeOutput() {
        double[][] data = noisyInput( 2000, 11L );
        WavpolResult r1 = new Wavpol( new WavpolConfig( 128, 32, 5, 1 ) )
                         .analyze( data[ 0 ], data[ 1 ], data[ 2 ],
                                   data[ 3 ] );
        WavpolResult r4 = new Wavpol( new WavpolConfig( 128, 32, 5, 4 ) )
                         .analyze( data[ 0 ], data[ 1 ], data[ 2 ],
                                   data[ 3 ] );
        assertThat( r1.getRowCount() ).isEqualTo( ( 2000 - 128 ) / 32 + 1 );
        assertSameResult( r1, r4 );
    }

    @Test
    void gapsAndShortBatchesLayout() {
        double[] t = new double[ 45 ];
        for ( int i = 0; i < 45; i++ ) {
            t[ i ] = i < 20 ? i
                   : i < 25 ? 100 + ( i - 20 )
                   : 200 + ( i - 25 );
        }
        double[][] xyz = sines( t );
        WavpolResult result = new Wavpol( new WavpolConfig( 8, 4, 3 ) )
                             .analyze( t, xyz[ 0 ], xyz[ 1 ], xyz[ 2 ] );
        assertThat( result.getTimeline() )
            .containsExactly( new double[] { 4, 8, 12, 16, 20,
                                             108,
                                             204, 208, 212, 216 },
                              within( 1e-9 ) );
        assertThat( result.getFreqline() )
            .containsExactly( new double[] { 0, 0.125, 0.25, 0.375 },
                              within( 1e-12 ) );
        for ( int ir : new int[] { 4, 5 } ) {
            for ( double p : result.getPower()[ ir ] ) {
                assertThat( p ).isNaN();
            }
            assertThat( result.getAxisPower()[ ir ][ 1 ][ 0 ] ).isNaN();
        }
        assertThat( result.getPower()[ 3 ][ 1 ] ).isPositive();
        assertThat( result.getPower()[ 6 ][ 2 ] ).isPositive();

        // Bins beyond the smoothing reach are never defined.
        assertThat( result.getPower()[ 6 ][ 0 ] ).isNaN();
        assertThat( result.getPower()[ 6 ][ 3 ] ).isNaN();
    }

    @Test
    void missingValuesAreInterpolated() {
        double[][] data = noisyInput( 600, 3L );
        double[] x = data[ 1 ];
        x[ 50 ] = Double.NaN;
        x[ 51 ] = Double.NaN;
        data[ 3 ][ 300 ] = Double.POSITIVE_INFINITY;
        double[] xcopy = x.clone();
        WavpolResult result = new Wavpol( new WavpolConfig( 128, 64, 3 ) )
                             .analyze( data[ 0 ], x, data[ 2 ], data[ 3 ] );
        assertThat( result.getRowCount() ).isEqualTo( ( 600 - 128 ) / 64 + 1 );
        for ( int ir = 0; ir < result.getRowCount(); ir++ ) {
            for ( int k = 1; k < 63; k++ ) {
                assertThat( TimeSeries.isFinite( result.getPower()[ ir ][ k ] ) )
                   .isTrue();
            }
        }
        assertThat( Arrays.equals( x, xcopy ) ).isTrue();
    }

    @Test
    void missingChannelGivesBlankRow() {
        double[] t = new double[ 300 ];
        double[] nan = new double[ 300 ];
        for ( int i = 0; i < 300; i++ ) {
            t[ i ] = i;
        }
        Arrays.fill( nan, Double.NaN );
        double[][] xyz = sines( t );
        WavpolResult result = new Wavpol( new WavpolConfig( 64, 32, 3 ) )
                             .analyze( t, xyz[ 0 ], xyz[ 1 ], nan );
        assertThat( result.isError() ).isFalse();
        assertThat( result.getRowCount() ).isEqualTo( 1 );
        assertThat( result.getTimeline()[ 0 ] ).isEqualTo( 32.0 + 32.0 );
        assertThat( result.getPower()[ 0 ][ 10 ] ).isNaN();
    }

    @Test
    void tooManyBatchesIsError() {
        WavpolResult result = analyzeSquares( 80003 );
        assertThat( result.isError() ).isTrue();
        assertThat( result.getRowCount() ).isEqualTo( 0 );
        assertThat( result.getFreqline() ).isEmpty();
        assertThat( result.getPower() ).isEmpty();
    }

    @Test
    void manyBatchesBelowCeilingProceed() {
        WavpolResult result = analyzeSquares( 80001 );
        assertThat( result.isError() ).isFalse();
        assertThat( result.getRowCount() ).isEqualTo( Batcher.MAX_BATCHES );
        assertThat( Double.isNaN( result.getPower()[ 0 ][ 1 ] ) ).isTrue();
    }

    @Test
    void batchCeilingIsConfigurable() {
        double[] t = { 0, 1, 2, 10, 11, 12, 20, 21 };
        double[] v = new double[ t.length ];
        WavpolResult result = new Wavpol( new WavpolConfig( 4, 2, 1 ),
                                          new Batcher( 2 ) )
                             .analyze( t, v, v, v );
        assertThat( result.isError() ).isTrue();
    }

    @Test
    void badInputRejected() {
        Wavpol wavpol = new Wavpol( WavpolConfig.createDefault() );
        assertThatThrownBy( () -> wavpol.analyze( new double[ 3 ],
                                                  new double[ 3 ],
                                                  new double[ 2 ],
                                                  new double[ 3 ] ) )
            .isInstanceOf( IllegalArgumentException.class );
        assertThatThrownBy( () -> wavpol.analyze( new double[ 1 ],
                                                  new double[ 1 ],
                                                  new double[ 1 ],
                                                  new double[ 1 ] ) )
            .isInstanceOf( IllegalArgumentException.class );
    }

    /**
     * Analyses a series with times i<sup>2</sup>, in which every
     * interval after the first is a discontinuity.
     */
    private static WavpolResult analyzeSquares( int n ) {
        double[] t = new double[ n ];
        double[] v = new double[ n ];
        for ( int i = 0; i < n; i++ ) {
            t[ i ] = (double) i * i;
            v[ i ] = i % 3;
        }
        return new Wavpol( new WavpolConfig( 4, -1, 1 ) )
              .analyze( t, v, v, v );
    }

    private static double[][] sines( double[] t ) {
        int n = t.length;
        double[][] xyz = new double[ 3 ][ n ];
        for ( int i = 0; i < n; i++ ) {
            xyz[ 0 ][ i ] = Math.sin( 0.7 * t[ i ] );
            xyz[ 1 ][ i ] = Math.cos( 0.7 * t[ i ] );
            xyz[ 2 ][ i ] = 0.3 * Math.sin( 1.9 * t[ i ] );
        }
        return xyz;
    }

    /**
     * Returns arrays t, x, y, z of an elliptically polarised wave
     * plus pseudo-random noise.
     */
    private static double[][] noisyInput( int n, long seed ) {
        Random rnd = new Random( seed );
        double[][] data = new double[ 4 ][ n ];
        for ( int i = 0; i < n; i++ ) {
            double phase = 0.4 * i;
            data[ 0 ][ i ] = 0.125 * i;
            data[ 1 ][ i ] = Math.cos( phase ) + 0.2 * rnd.nextGaussian();
            data[ 2 ][ i ] = 0.6 * Math.sin( phase )
                           + 0.2 * rnd.nextGaussian();
            data[ 3 ][ i ] = 0.2 * rnd.nextGaussian();
        }
        return data;
    }

    private static int argmax( double[] values ) {
        int imax = -1;
        double vmax = Double.NEGATIVE_INFINITY;
        for ( int i = 0; i < values.length; i++ ) {
            if ( values[ i ] > vmax ) {
                vmax = values[ i ];
                imax = i;
            }
        }
        return imax;
    }

    private static void assertSameResult( WavpolResult r1, WavpolResult r2 ) {
        assertThat( Arrays.equals( r1.getTimeline(), r2.getTimeline() ) )
            .isTrue();
        assertThat( Arrays.equals( r1.getFreqline(), r2.getFreqline() ) )
            .isTrue();
        assertThat( Arrays.deepEquals( r1.getPower(), r2.getPower() ) )
            .isTrue();
        assertThat( Arrays.deepEquals( r1.getDegreeOfPolarization(),
                                       r2.getDegreeOfPolarization() ) )
            .isTrue();
        assertThat( Arrays.deepEquals( r1.getWavenormalAngle(),
                                       r2.getWavenormalAngle() ) )
            .isTrue();
        assertThat( Arrays.deepEquals( r1.getEllipticity(),
                                       r2.getEllipticity() ) )
            .isTrue();
        assertThat( Arrays.deepEquals( r1.getHelicity(), r2.getHelicity() ) )
            .isTrue();
        assertThat( Arrays.deepEquals( r1.getAxisPower(),
                                       r2.getAxisPower() ) )
            .isTrue();
    }
}
