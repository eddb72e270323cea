/**
 * Per-window stages of the polarisation analysis: tapering and FFT,
 * spectral matrix construction, frequency smoothing, and the derived
 * polarisation parameters.
 */
package io.github.mandar2812.PlasmaML.wavpol.spectral;
