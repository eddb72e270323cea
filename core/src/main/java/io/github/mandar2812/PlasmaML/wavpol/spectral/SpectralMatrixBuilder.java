package io.github.mandar2812.PlasmaML.wavpol.spectral;

import org.apache.commons.math3.complex.Complex;

/**
 * Builds the spectral matrix of a window from its component spectra.
 *
 * @since    19 Oct 2026
 */
public class SpectralMatrixBuilder {

    /**
     * Private constructor prevents instantiation.
     */
    private SpectralMatrixBuilder() {
    }

    /**
     * Builds the unsmoothed spectral matrix.
     * No normalisation is applied.
     *
     * @param  spectra  one-sided spectra of the three components
     * @return  matrix defined for every bin
     */
    public static SpectralMatrix buildMatrix( WindowSpectra spectra ) {
        int nbin = spectra.getBinCount();
        SpectralMatrix matrix = new SpectralMatrix( nbin, 0, nbin - 1 );
        for ( int k = 0; k < nbin; k++ ) {
            for ( int i = 0; i < 3; i++ ) {
                Complex si = spectra.getSpectrum( i )[ k ];
                for ( int j = 0; j < 3; j++ ) {
                    Complex sj = spectra.getSpectrum( j )[ k ];
                    matrix.set( k, i, j, si.multiply( sj.conjugate() ) );
                }
            }
        }
        return matrix;
    }
}
