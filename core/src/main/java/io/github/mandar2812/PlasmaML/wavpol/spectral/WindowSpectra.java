package io.github.mandar2812.PlasmaML.wavpol.spectral;

import org.apache.commons.math3.complex.Complex;

/**
 * One-sided complex spectra of the three components for a single window.
 *
 * @since    19 Oct 2026
 */
public class WindowSpectra {

    private final Complex[][] spectra_;

    /**
     * Constructor.
     *
     * @param  sx  spectrum of x component
     * @param  sy  spectrum of y component
     * @param  sz  spectrum of z component
     */
    public WindowSpectra( Complex[] sx, Complex[] sy, Complex[] sz ) {
        if ( sy.length != sx.length || sz.length != sx.length ) {
            throw new IllegalArgumentException( "Spectrum length mismatch" );
        }
        spectra_ = new Complex[][] { sx, sy, sz };
    }

    /**
     * Returns the number of frequency bins.
     *
     * @return  spectrum length
     */
    public int getBinCount() {
        return spectra_[ 0 ].length;
    }

    /**
     * Returns the spectrum for one component.
     *
     * @param  ic  component index 0, 1 or 2
     * @return  complex spectrum
     */
    public Complex[] getSpectrum( int ic ) {
        return spectra_[ ic ];
    }
}
