package io.github.mandar2812.PlasmaML.wavpol;

import java.util.Arrays;

import io.github.mandar2812.PlasmaML.wavpol.spectral.PolarizationEstimates;

/**
 * Collects per-window polarisation estimates into dense output grids.
 *
 * <p>All grids are NaN-filled on construction, so rows that are never
 * populated (gap rows, under-length batches) and bins that could not be
 * evaluated come out as NaN.
 * Different rows may be populated concurrently from different threads,
 * as long as no row is written by more than one thread and
 * {@link #createResult} is only called once all writers have finished.
 *
 * @since    19 Oct 2026
 */
public class ResultAssembler {

    private final int nbin_;
    private final double[] timeline_;
    private final double[][] power_;
    private final double[][] degpol_;
    private final double[][] waveangle_;
    private final double[][] ellipticity_;
    private final double[][] helicity_;
    private final double[][][] axisPower_;
    private double binWidth_;

    /**
     * Constructor.
     *
     * @param  nrow  number of output rows
     * @param  nbin  number of frequency bins
     */
    public ResultAssembler( int nrow, int nbin ) {
        nbin_ = nbin;
        timeline_ = new double[ nrow ];
        Arrays.fill( timeline_, Double.NaN );
        power_ = createGrid( nrow, nbin );
        degpol_ = createGrid( nrow, nbin );
        waveangle_ = createGrid( nrow, nbin );
        ellipticity_ = createGrid( nrow, nbin );
        helicity_ = createGrid( nrow, nbin );
        axisPower_ = new double[ nrow ][][];
        for ( int ir = 0; ir < nrow; ir++ ) {
            axisPower_[ ir ] = createGrid( nbin, 3 );
        }
        binWidth_ = Double.NaN;
    }

    /**
     * Returns the number of rows.
     *
     * @return  row count
     */
    public int getRowCount() {
        return timeline_.length;
    }

    /**
     * Sets the time of a row without supplying any values for it.
     *
     * @param  irow  row index
     * @param  time  row time in seconds
     */
    public void setBlankRow( int irow, double time ) {
        timeline_[ irow ] = time;
    }

    /**
     * Sets the time and values of a row.
     *
     * @param  irow  row index
     * @param  time  row time in seconds
     * @param  estimates  per-window estimates
     */
    public void setRow( int irow, double time,
                        PolarizationEstimates estimates ) {
        if ( estimates.getBinCount() != nbin_ ) {
            throw new IllegalArgumentException( "Bin count mismatch "
                                              + estimates.getBinCount()
                                              + " != " + nbin_ );
        }
        timeline_[ irow ] = time;
        copy( estimates.getPower(), power_[ irow ] );
        copy( estimates.getDegreeOfPolarization(), degpol_[ irow ] );
        copy( estimates.getWavenormalAngle(), waveangle_[ irow ] );
        copy( estimates.getEllipticity(), ellipticity_[ irow ] );
        copy( estimates.getHelicity(), helicity_[ irow ] );
        double[][] axisPower = estimates.getAxisPower();
        for ( int k = 0; k < nbin_; k++ ) {
            copy( axisPower[ k ], axisPower_[ irow ][ k ] );
        }
    }

    /**
     * Sets the frequency bin width used for the frequency line.
     * The last value set wins.
     *
     * @param  binWidth  bin width in Hz
     */
    public void setBinWidth( double binWidth ) {
        binWidth_ = binWidth;
    }

    /**
     * Returns the assembled result.
     *
     * @return  result
     */
    public WavpolResult createResult() {
        double[] freqline = new double[ nbin_ ];
        for ( int k = 0; k < nbin_; k++ ) {
            freqline[ k ] = k * binWidth_;
        }
        return new WavpolResult( timeline_, freqline, power_, degpol_,
                                 waveangle_, ellipticity_, helicity_,
                                 axisPower_, false );
    }

    private static void copy( double[] src, double[] dest ) {
        System.arraycopy( src, 0, dest, 0, dest.length );
    }

    private static double[][] createGrid( int n1, int n2 ) {
        double[][] grid = new double[ n1 ][ n2 ];
        for ( int i = 0; i < n1; i++ ) {
            Arrays.fill( grid[ i ], Double.NaN );
        }
        return grid;
    }
}
