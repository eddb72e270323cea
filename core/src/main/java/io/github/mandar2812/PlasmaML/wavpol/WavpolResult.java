package io.github.mandar2812.PlasmaML.wavpol;

/**
 * Output of a wave polarisation analysis.
 *
 * <p>Two-dimensional grids are indexed by <code>[row][bin]</code>,
 * where rows correspond to elements of the timeline and bins to
 * elements of the frequency line.  The per-component power grid
 * has a third index for the component.
 * Values which could not be determined are NaN.
 *
 * <p>If the analysis was aborted, {@link #isError} returns true
 * and all arrays are empty.
 *
 * @since    19 Oct 2026
 */
public class WavpolResult {

    private final double[] timeline_;
    private final double[] freqline_;
    private final double[][] power_;
    private final double[][] degreeOfPolarization_;
    private final double[][] wavenormalAngle_;
    private final double[][] ellipticity_;
    private final double[][] helicity_;
    private final double[][][] axisPower_;
    private final boolean error_;

    /**
     * Constructor.
     *
     * @param  timeline  centre time of each row in seconds
     * @param  freqline  frequency of each bin in Hz
     * @param  power   total wave power spectral density
     * @param  degreeOfPolarization  degree of polarisation
     * @param  wavenormalAngle  wavenormal angle in radians
     * @param  ellipticity  signed ellipticity
     * @param  helicity  helicity
     * @param  axisPower  per-component power spectral density
     * @param  error   true iff the analysis was aborted
     */
    public WavpolResult( double[] timeline, double[] freqline,
                         double[][] power, double[][] degreeOfPolarization,
                         double[][] wavenormalAngle, double[][] ellipticity,
                         double[][] helicity, double[][][] axisPower,
                         boolean error ) {
        timeline_ = timeline;
        freqline_ = freqline;
        power_ = power;
        degreeOfPolarization_ = degreeOfPolarization;
        wavenormalAngle_ = wavenormalAngle;
        ellipticity_ = ellipticity;
        helicity_ = helicity;
        axisPower_ = axisPower;
        error_ = error;
    }

    /**
     * Returns a result representing an aborted analysis.
     *
     * @return  result with error flag set and empty arrays
     */
    public static WavpolResult createError() {
        return new WavpolResult( new double[ 0 ], new double[ 0 ],
                                 new double[ 0 ][], new double[ 0 ][],
                                 new double[ 0 ][], new double[ 0 ][],
                                 new double[ 0 ][], new double[ 0 ][][],
                                 true );
    }

    /**
     * Indicates whether the analysis was aborted.
     *
     * @return  true iff the batch count ceiling was exceeded
     */
    public boolean isError() {
        return error_;
    }

    /**
     * Returns the number of rows.
     *
     * @return  timeline length
     */
    public int getRowCount() {
        return timeline_.length;
    }

    /**
     * Returns the number of frequency bins.
     *
     * @return  freqline length
     */
    public int getFrequencyCount() {
        return freqline_.length;
    }

    /**
     * Returns the row times.
     *
     * @return  centre time of each analysis window in seconds
     */
    public double[] getTimeline() {
        return timeline_;
    }

    /**
     * Returns the frequency axis.
     *
     * @return  bin frequencies in Hz
     */
    public double[] getFreqline() {
        return freqline_;
    }

    /**
     * Returns the total wave power.
     * Units are input units squared per Hz.
     *
     * @return  power grid
     */
    public double[][] getPower() {
        return power_;
    }

    /**
     * Returns the degree of polarisation.
     *
     * @return  degree of polarisation grid, nominally 0..1
     */
    public double[][] getDegreeOfPolarization() {
        return degreeOfPolarization_;
    }

    /**
     * Returns the wavenormal angle.
     *
     * @return  angle grid, radians in range 0..pi/2
     */
    public double[][] getWavenormalAngle() {
        return wavenormalAngle_;
    }

    /**
     * Returns the ellipticity.
     *
     * @return  ellipticity grid, negative for left-handed
     */
    public double[][] getEllipticity() {
        return ellipticity_;
    }

    /**
     * Returns the helicity.
     *
     * @return  helicity grid
     */
    public double[][] getHelicity() {
        return helicity_;
    }

    /**
     * Returns the per-component power.
     *
     * @return  grid indexed by row, bin, component
     */
    public double[][][] getAxisPower() {
        return axisPower_;
    }
}
