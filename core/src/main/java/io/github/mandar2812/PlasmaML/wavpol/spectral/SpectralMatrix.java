package io.github.mandar2812.PlasmaML.wavpol.spectral;

import java.util.Arrays;

import org.apache.commons.math3.complex.Complex;

/**
 * Complex 3x3 spectral (cross-power) matrix for each frequency bin
 * of one window.
 *
 * <p>Element <code>[i][j]</code> of bin <code>k</code> is
 * <code>S<sub>i</sub>[k] conj(S<sub>j</sub>[k])</code>,
 * where S<sub>i</sub> is the spectrum of component <code>i</code>,
 * so each matrix is Hermitian with real non-negative diagonal.
 *
 * <p>Only a contiguous range of bins may hold defined values;
 * bins outside it are filled with NaN.  A freshly built matrix is
 * defined everywhere; a smoothed one only over the bins for which the
 * full smoothing neighbourhood is available.
 *
 * @since    19 Oct 2026
 */
public class SpectralMatrix {

    private final Complex[][][] elements_;
    private final int firstValid_;
    private final int lastValid_;

    /**
     * Constructs a matrix with all elements NaN.
     *
     * @param  nbin  number of frequency bins
     * @param  firstValid  index of first bin that will hold defined values
     * @param  lastValid  index of last bin that will hold defined values
     */
    public SpectralMatrix( int nbin, int firstValid, int lastValid ) {
        elements_ = new Complex[ nbin ][ 3 ][ 3 ];
        for ( int k = 0; k < nbin; k++ ) {
            for ( int i = 0; i < 3; i++ ) {
                Arrays.fill( elements_[ k ][ i ], Complex.NaN );
            }
        }
        firstValid_ = firstValid;
        lastValid_ = lastValid;
    }

    /**
     * Returns the number of frequency bins.
     *
     * @return  bin count
     */
    public int getBinCount() {
        return elements_.length;
    }

    /**
     * Returns the index of the first bin holding defined values.
     *
     * @return  first valid bin index
     */
    public int getFirstValidBin() {
        return firstValid_;
    }

    /**
     * Returns the index of the last bin holding defined values.
     *
     * @return  last valid bin index, inclusive
     */
    public int getLastValidBin() {
        return lastValid_;
    }

    /**
     * Returns an element.
     *
     * @param  k  frequency bin
     * @param  i  row (component) index
     * @param  j  column (component) index
     * @return  complex element value
     */
    public Complex get( int k, int i, int j ) {
        return elements_[ k ][ i ][ j ];
    }

    /**
     * Sets an element.
     *
     * @param  k  frequency bin
     * @param  i  row (component) index
     * @param  j  column (component) index
     * @param  value  complex element value
     */
    public void set( int k, int i, int j, Complex value ) {
        elements_[ k ][ i ][ j ] = value;
    }

    /**
     * Returns the real part of the trace for one bin, that is the total
     * power summed over the three components.
     *
     * @param  k  frequency bin
     * @return  real trace
     */
    public double getTrace( int k ) {
        Complex[][] m = elements_[ k ];
        return m[ 0 ][ 0 ].getReal() + m[ 1 ][ 1 ].getReal()
             + m[ 2 ][ 2 ].getReal();
    }

    /**
     * Returns the real part of the trace of the matrix square for one bin.
     *
     * @param  k  frequency bin
     * @return  real part of trace(M<sup>2</sup>)
     */
    public double getSquareTrace( int k ) {
        Complex[][] m = elements_[ k ];
        double sum = 0;
        for ( int i = 0; i < 3; i++ ) {
            for ( int j = 0; j < 3; j++ ) {
                Complex a = m[ i ][ j ];
                Complex b = m[ j ][ i ];
                sum += a.getReal() * b.getReal()
                     - a.getImaginary() * b.getImaginary();
            }
        }
        return sum;
    }
}
