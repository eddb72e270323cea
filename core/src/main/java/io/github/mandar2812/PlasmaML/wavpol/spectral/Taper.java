package io.github.mandar2812.PlasmaML.wavpol.spectral;

/**
 * Smoothing function applied to each window before Fourier transformation
 * to reduce spectral leakage.
 * The weight for point <code>n</code> of an <code>N</code>-point window is
 * <pre>
 *    w[n] = 0.08 + 0.46 * (1 - cos(2 pi n / N))
 * </pre>
 *
 * @since    19 Oct 2026
 */
public class Taper {

    private final double[] weights_;
    private final double energyFactor_;

    /**
     * Constructor.
     *
     * @param  n  window length
     */
    public Taper( int n ) {
        weights_ = new double[ n ];
        double sum2 = 0;
        for ( int i = 0; i < n; i++ ) {
            double w = 0.08 + 0.46 * ( 1 - Math.cos( 2 * Math.PI * i / n ) );
            weights_[ i ] = w;
            sum2 += w * w;
        }
        energyFactor_ = sum2 / n;
    }

    /**
     * Returns the window length.
     *
     * @return  number of weights
     */
    public int getLength() {
        return weights_.length;
    }

    /**
     * Returns the weight for a given point.
     *
     * @param  i  point index
     * @return  weight
     */
    public double getWeight( int i ) {
        return weights_[ i ];
    }

    /**
     * Returns the mean square weight, which is the factor by which
     * tapering reduces the power of a stationary signal.
     *
     * @return  sum of squared weights divided by window length
     */
    public double getEnergyFactor() {
        return energyFactor_;
    }

    /**
     * Multiplies an array in place by the taper weights.
     *
     * @param  data  array of the same length as this taper
     */
    public void apply( double[] data ) {
        for ( int i = 0; i < weights_.length; i++ ) {
            data[ i ] *= weights_[ i ];
        }
    }
}
