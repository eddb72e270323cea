/**
 * Pure java wave polarisation analysis of three-component field data,
 * in the manner of the SPEDAS <code>wavpol</code> routine.
 *
 * <p>Set up a {@link io.github.mandar2812.PlasmaML.wavpol.WavpolConfig},
 * construct a {@link io.github.mandar2812.PlasmaML.wavpol.Wavpol} with it,
 * and feed it a {@link io.github.mandar2812.PlasmaML.wavpol.TimeSeries}.
 * The resulting {@link io.github.mandar2812.PlasmaML.wavpol.WavpolResult}
 * contains time-frequency grids of wave power, degree of polarisation,
 * wavenormal angle, ellipticity and helicity, plus per-component power.
 *
 * <p>The analysis works entirely on in-memory arrays and performs no I/O.
 * Gaps and sampling changes in the input are handled by splitting
 * it into batches.  Isolated NaN values are interpolated over within
 * each window, and missing data never causes failure, only NaN outputs
 * where there is too little data to work with.
 *
 * <p>For more information on the quantities calculated see
 * J. C. Samson and J. V. Olson, "Some comments on the description of
 * the polarization states of waves", Geophys. J. R. Astr. Soc. (1980)
 * v61 115-130, and J. D. Means, "Use of the three-dimensional covariance
 * matrix in analyzing the polarization properties of plane waves",
 * J. Geophys. Res. (1972) 77(28) 5551-5559.
 */
package io.github.mandar2812.PlasmaML.wavpol;
