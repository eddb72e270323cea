package io.github.mandar2812.PlasmaML.wavpol;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.github.mandar2812.PlasmaML.wavpol.spectral.HelicityEllipticityEstimator;
import io.github.mandar2812.PlasmaML.wavpol.spectral.PolarizationAnalyzer;
import io.github.mandar2812.PlasmaML.wavpol.spectral.PolarizationEstimates;
import io.github.mandar2812.PlasmaML.wavpol.spectral.SpectralMatrix;
import io.github.mandar2812.PlasmaML.wavpol.spectral.SpectralMatrixBuilder;
import io.github.mandar2812.PlasmaML.wavpol.spectral.SpectralSmoother;
import io.github.mandar2812.PlasmaML.wavpol.spectral.WindowSpectra;
import io.github.mandar2812.PlasmaML.wavpol.spectral.WindowedFftProcessor;

/**
 * Performs polarisation analysis of three orthogonal component
 * time series.
 *
 * <p>The data are assumed to be in a right-handed field-aligned
 * coordinate system with z along the ambient magnetic field.
 * The series is split into batches of consistent sampling, each batch
 * is divided into overlapping windows, and for each window the
 * spectral matrix is computed, smoothed in frequency and used to derive
 * wave power, degree of polarisation, wavenormal angle, ellipticity
 * and helicity as a function of frequency.
 *
 * <p>Output rows are laid out batch by batch:
 * <ul>
 * <li>a batch with more fully finite samples than the window length
 *     contributes one row per window, followed, unless it is the
 *     last batch, by a single blank row marking the gap</li>
 * <li>any other batch contributes a single blank row</li>
 * </ul>
 * Blank rows have a time but all-NaN values.
 *
 * <p>If the number of batches exceeds the batcher's ceiling the analysis
 * is abandoned and an error result is returned.
 * Non-finite input values never cause an exception; they just lead to
 * NaN outputs where they have an effect.
 *
 * <p>Instances hold no state between calls and may be reused.
 *
 * @since    19 Oct 2026
 */
public class Wavpol {

    private final WavpolConfig config_;
    private final Batcher batcher_;
    private final WindowedFftProcessor fftProcessor_;
    private final SpectralSmoother smoother_;
    private final PolarizationAnalyzer analyzer_;

    private static final Logger logger_ =
        Logger.getLogger( Wavpol.class.getName() );

    /**
     * Constructs an analyser with the default batch ceiling.
     *
     * @param  config  configuration
     */
    public Wavpol( WavpolConfig config ) {
        this( config, new Batcher() );
    }

    /**
     * Constructs an analyser with a given batcher.
     *
     * @param  config  configuration
     * @param  batcher  splits input into batches
     */
    public Wavpol( WavpolConfig config, Batcher batcher ) {
        config_ = config;
        batcher_ = batcher;
        fftProcessor_ = new WindowedFftProcessor( config.getWindowLength() );
        smoother_ = new SpectralSmoother( config.getSmoothingWidth() );
        analyzer_ = new PolarizationAnalyzer( fftProcessor_.getTaper() );
    }

    /**
     * Returns the configuration.
     *
     * @return  configuration
     */
    public WavpolConfig getConfig() {
        return config_;
    }

    /**
     * Analyses arrays of times and component values.
     *
     * @param  times  sample times in seconds
     * @param  x   x component
     * @param  y   y component
     * @param  z   z component, along the ambient field
     * @return  analysis result
     */
    public WavpolResult analyze( double[] times, double[] x, double[] y,
                                 double[] z ) {
        return analyze( new TimeSeries( times, x, y, z ) );
    }

    /**
     * Analyses a time series.
     *
     * @param  ts  time series
     * @return  analysis result
     */
    public WavpolResult analyze( TimeSeries ts ) {
        Batch[] batches;
        try {
            batches = batcher_.createBatches( ts.getTimes() );
        }
        catch ( BatchOverflowException e ) {
            logger_.severe( e.getMessage()
                          + " - returning to avoid memory runaway" );
            return WavpolResult.createError();
        }
        int nbatch = batches.length;
        int wlen = config_.getWindowLength();
        int stride = config_.getStride();
        double[] times = ts.getTimes();

        // Work out how many rows each batch contributes.
        int[] nwins = new int[ nbatch ];
        int nrow = 0;
        int nshort = 0;
        for ( int ib = 0; ib < nbatch; ib++ ) {
            Batch batch = batches[ ib ];
            int ngood = ts.countFinite( batch.getStart(), batch.getEnd() );
            if ( ngood > wlen ) {
                nwins[ ib ] = batch.getWindowCount( wlen, stride );
                logger_.config( "FFT count for batch " + ib + ": "
                              + nwins[ ib ] );
                nrow += nwins[ ib ] + ( ib < nbatch - 1 ? 1 : 0 );
            }
            else {
                logger_.fine( "Fourier transform not possible for batch "
                            + ib + ": " + ngood + " good points, "
                            + wlen + " required" );
                nshort++;
                nrow += 1;
            }
        }
        if ( nshort > 0 ) {
            logger_.warning( "Fourier transform not possible for "
                           + nshort + "/" + nbatch + " batches"
                           + " with no more than " + wlen + " good points" );
        }
        logger_.config( "Total number of rows: " + nrow );

        // Lay out rows and plan the window calculations.
        ResultAssembler assembler =
            new ResultAssembler( nrow, config_.getFrequencyCount() );
        assembler.setBinWidth( Batcher.getNominalFrequency( times ) / wlen );
        List<WindowTask> tasks = new ArrayList<WindowTask>();
        int irow = 0;
        for ( int ib = 0; ib < nbatch; ib++ ) {
            Batch batch = batches[ ib ];
            double fs = batch.getSampleFrequency();
            double t0 = times[ batch.getStart() ] + ( wlen / 2 ) / fs;
            int nwin = nwins[ ib ];
            if ( nwin > 0 ) {
                for ( int iw = 0; iw < nwin; iw++ ) {
                    tasks.add( new WindowTask( ts, assembler, irow++,
                                               batch.getStart() + iw * stride,
                                               fs,
                                               t0 + iw * stride / fs ) );
                }
                if ( ib < nbatch - 1 ) {
                    assembler.setBlankRow( irow++, t0 + nwin * stride / fs );
                }
                assembler.setBinWidth( fs / wlen );
            }
            else {
                assembler.setBlankRow( irow++, t0 + stride / fs );
            }
        }
        assert irow == nrow;

        runTasks( tasks );
        logger_.config( "Polarisation analysis completed" );
        return assembler.createResult();
    }

    /**
     * Performs the whole per-window analysis chain for one window.
     *
     * @param  ts  time series
     * @param  start  index of first sample in window
     * @param  sampleFrequency  sampling frequency in Hz
     * @return  estimates for the window
     */
    PolarizationEstimates analyzeWindow( TimeSeries ts, int start,
                                         double sampleFrequency ) {
        WindowSpectra spectra = fftProcessor_.transform( ts, start );
        SpectralMatrix smoothed =
            smoother_.smooth( SpectralMatrixBuilder.buildMatrix( spectra ) );
        PolarizationEstimates estimates =
            new PolarizationEstimates( spectra.getBinCount() );
        analyzer_.analyze( smoothed, sampleFrequency, estimates );
        HelicityEllipticityEstimator.estimate( smoothed, estimates );
        return estimates;
    }

    /**
     * Executes window tasks, in this thread or in a pool according
     * to configuration.
     *
     * @param  tasks  tasks to run
     */
    private void runTasks( List<WindowTask> tasks ) {
        int nthread = Math.min( config_.getThreadCount(), tasks.size() );
        if ( nthread <= 1 ) {
            for ( WindowTask task : tasks ) {
                task.run();
            }
            return;
        }
        logger_.config( "Running " + tasks.size() + " windows on "
                      + nthread + " threads" );
        ExecutorService executor = Executors.newFixedThreadPool( nthread );
        try {
            List<Future<?>> futures = new ArrayList<Future<?>>();
            for ( WindowTask task : tasks ) {
                futures.add( executor.submit( task ) );
            }
            for ( Future<?> future : futures ) {
                future.get();
            }
        }
        catch ( InterruptedException e ) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException( "Analysis interrupted", e );
        }
        catch ( ExecutionException e ) {
            Throwable cause = e.getCause();
            if ( cause instanceof RuntimeException ) {
                throw (RuntimeException) cause;
            }
            else if ( cause instanceof Error ) {
                throw (Error) cause;
            }
            else {
                throw new IllegalStateException( "Analysis failed", cause );
            }
        }
        finally {
            executor.shutdownNow();
        }
    }

    /**
     * Analyses one window and writes its row of the output.
     */
    private class WindowTask implements Runnable {
        private final TimeSeries ts_;
        private final ResultAssembler assembler_;
        private final int irow_;
        private final int start_;
        private final double fs_;
        private final double time_;

        /**
         * Constructor.
         *
         * @param  ts  time series
         * @param  assembler  output destination
         * @param  irow  output row index
         * @param  start  index of first sample in window
         * @param  fs  sampling frequency
         * @param  time  centre time of window
         */
        WindowTask( TimeSeries ts, ResultAssembler assembler, int irow,
                    int start, double fs, double time ) {
            ts_ = ts;
            assembler_ = assembler;
            irow_ = irow;
            start_ = start;
            fs_ = fs;
            time_ = time;
        }

        public void run() {
            assembler_.setRow( irow_, time_,
                               analyzeWindow( ts_, start_, fs_ ) );
            if ( irow_ % 40 == 0 && logger_.isLoggable( Level.FINE ) ) {
                logger_.fine( "wavpol step: " + irow_ );
            }
        }
    }
}
