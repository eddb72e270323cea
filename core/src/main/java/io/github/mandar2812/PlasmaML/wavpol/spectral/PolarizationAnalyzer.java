package io.github.mandar2812.PlasmaML.wavpol.spectral;

/**
 * Derives wave power, degree of polarisation and wavenormal angle
 * from a smoothed spectral matrix.
 *
 * <p>Power is the real trace of the matrix scaled to a one-sided
 * power spectral density: multiplied by <code>2/(W df)</code>
 * for interior bins and by <code>1/(W df)</code> for the first and
 * last bins, where <code>W</code> is the taper energy factor and
 * <code>df</code> the bin width.
 *
 * <p>The degree of polarisation is the Samson &amp; Olson (1980) estimator
 * <pre>
 *    (3 tr(M<sup>2</sup>) - tr(M)<sup>2</sup>) / (2 tr(M)<sup>2</sup>)
 * </pre>
 * which is 1 for a pure state and near 0 for incoherent noise.
 * It is not clamped.
 *
 * <p>The wavenormal angle is the angle between the z axis and the
 * minimum variance direction estimated from the imaginary parts of the
 * off-diagonal elements (Means, 1972).
 *
 * <p>Degenerate bins give NaN results.
 *
 * @since    19 Oct 2026
 */
public class PolarizationAnalyzer {

    private final int windowLength_;
    private final double energyFactor_;

    /**
     * Constructor.
     *
     * @param  taper  taper applied to the windows before transformation
     */
    public PolarizationAnalyzer( Taper taper ) {
        windowLength_ = taper.getLength();
        energyFactor_ = taper.getEnergyFactor();
    }

    /**
     * Fills in the power, per-component power, degree of polarisation
     * and wavenormal angle for the defined bins of a smoothed matrix.
     *
     * @param  matrix  smoothed spectral matrix
     * @param  sampleFrequency   sampling frequency in Hz
     * @param  estimates  per-window results to populate
     */
    public void analyze( SpectralMatrix matrix, double sampleFrequency,
                         PolarizationEstimates estimates ) {
        int nbin = matrix.getBinCount();
        double binWidth = sampleFrequency / windowLength_;
        double scale = 1.0 / ( energyFactor_ * binWidth );
        double[] power = estimates.getPower();
        double[][] axisPower = estimates.getAxisPower();
        double[] degpol = estimates.getDegreeOfPolarization();
        double[] angle = estimates.getWavenormalAngle();
        for ( int k = matrix.getFirstValidBin();
              k <= matrix.getLastValidBin(); k++ ) {

            // Power scaling; only interior bins have a mirror image
            // in the discarded half of the spectrum.
            double factor = k == 0 || k == nbin - 1 ? scale : 2 * scale;
            double trace = matrix.getTrace( k );
            power[ k ] = factor * trace;
            for ( int ic = 0; ic < 3; ic++ ) {
                axisPower[ k ][ ic ] =
                    factor * matrix.get( k, ic, ic ).getReal();
            }

            degpol[ k ] = ( 3 * matrix.getSquareTrace( k ) - trace * trace )
                        / ( 2 * trace * trace );
            angle[ k ] = getWavenormalAngle( matrix, k );
        }
    }

    /**
     * Returns the wavenormal angle for one bin.
     *
     * @param  matrix  smoothed spectral matrix
     * @param  k   frequency bin
     * @return  angle from z axis in radians, in range 0..pi/2,
     *          or NaN if the off-diagonal imaginary parts all vanish
     */
    static double getWavenormalAngle( SpectralMatrix matrix, int k ) {
        double imXy = matrix.get( k, 0, 1 ).getImaginary();
        double imXz = matrix.get( k, 0, 2 ).getImaginary();
        double imYz = matrix.get( k, 1, 2 ).getImaginary();
        double norm = Math.sqrt( imXy * imXy + imXz * imXz + imYz * imYz );
        double wnx = Math.abs( imYz / norm );
        double wny = -Math.abs( imXz / norm );
        double wnz = imXy / norm;
        return Math.atan2( Math.sqrt( wnx * wnx + wny * wny ),
                           Math.abs( wnz ) );
    }
}
