package io.github.mandar2812.PlasmaML.wavpol.spectral;

import java.util.Arrays;

/**
 * Per-frequency results of the polarisation analysis of a single window.
 * All values start off as NaN and are filled in by the analysis stages
 * for those bins which they are able to evaluate.
 *
 * @since    19 Oct 2026
 */
public class PolarizationEstimates {

    private final double[] power_;
    private final double[][] axisPower_;
    private final double[] degreeOfPolarization_;
    private final double[] wavenormalAngle_;
    private final double[] ellipticity_;
    private final double[] helicity_;

    /**
     * Constructor.
     *
     * @param  nbin  number of frequency bins
     */
    public PolarizationEstimates( int nbin ) {
        power_ = nanArray( nbin );
        axisPower_ = new double[ nbin ][];
        for ( int k = 0; k < nbin; k++ ) {
            axisPower_[ k ] = nanArray( 3 );
        }
        degreeOfPolarization_ = nanArray( nbin );
        wavenormalAngle_ = nanArray( nbin );
        ellipticity_ = nanArray( nbin );
        helicity_ = nanArray( nbin );
    }

    /**
     * Returns the number of frequency bins.
     *
     * @return  bin count
     */
    public int getBinCount() {
        return power_.length;
    }

    /**
     * Returns the total wave power spectral density.
     *
     * @return  power array indexed by bin; live, not copied
     */
    public double[] getPower() {
        return power_;
    }

    /**
     * Returns the per-component power spectral density.
     *
     * @return  array indexed by bin then component; live, not copied
     */
    public double[][] getAxisPower() {
        return axisPower_;
    }

    /**
     * Returns the degree of polarisation.
     *
     * @return  array indexed by bin; live, not copied
     */
    public double[] getDegreeOfPolarization() {
        return degreeOfPolarization_;
    }

    /**
     * Returns the wavenormal angle in radians.
     *
     * @return  array indexed by bin; live, not copied
     */
    public double[] getWavenormalAngle() {
        return wavenormalAngle_;
    }

    /**
     * Returns the signed ellipticity.
     *
     * @return  array indexed by bin; live, not copied
     */
    public double[] getEllipticity() {
        return ellipticity_;
    }

    /**
     * Returns the helicity.
     *
     * @return  array indexed by bin; live, not copied
     */
    public double[] getHelicity() {
        return helicity_;
    }

    private static double[] nanArray( int n ) {
        double[] array = new double[ n ];
        Arrays.fill( array, Double.NaN );
        return array;
    }
}
