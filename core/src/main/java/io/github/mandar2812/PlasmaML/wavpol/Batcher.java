package io.github.mandar2812.PlasmaML.wavpol;

import java.util.logging.Logger;

/**
 * Splits a time series into batches of consistent sampling cadence.
 *
 * <p>The nominal sampling period is taken from the first pair of samples.
 * A break is placed after every sample which is followed by
 * a time reversal, a non-finite time step, or a time step differing
 * from the nominal period by more than 1%.
 * The final sample always terminates the last batch.
 * Each break closes one batch, and the next one starts at the
 * sample immediately following it.
 *
 * <p>Since every batch later gets its own full-width spectral arrays,
 * the number of batches is capped; exceeding the cap is fatal for
 * the whole analysis.
 *
 * @since    19 Oct 2026
 */
public class Batcher {

    private final int maxBatches_;

    /** Default ceiling on the number of batches. */
    public static final int MAX_BATCHES = 80000;

    /** Relative tolerance on time steps within a batch. */
    public static final double ACCURACY = 0.01;

    private static final Logger logger_ =
        Logger.getLogger( Batcher.class.getName() );

    /**
     * Constructs a batcher with the default batch ceiling.
     */
    public Batcher() {
        this( MAX_BATCHES );
    }

    /**
     * Constructs a batcher with a given batch ceiling.
     *
     * @param  maxBatches  largest number of batches permitted
     */
    public Batcher( int maxBatches ) {
        maxBatches_ = maxBatches;
    }

    /**
     * Returns the batch ceiling.
     *
     * @return  maximum number of batches
     */
    public int getMaxBatches() {
        return maxBatches_;
    }

    /**
     * Returns the nominal sampling frequency of a time array,
     * inferred from its first two samples.
     *
     * @param  times  time array, at least two elements
     * @return  sampling frequency in Hz
     */
    public static double getNominalFrequency( double[] times ) {
        return 1. / ( times[ 1 ] - times[ 0 ] );
    }

    /**
     * Splits a time array into batches.
     *
     * @param  times  time array, at least two elements
     * @return  batches in order, covering the whole array
     * @throws  BatchOverflowException  if the number of batches would
     *          exceed the ceiling; in this case no batches are created
     */
    public Batch[] createBatches( double[] times )
            throws BatchOverflowException {
        int n = times.length;
        double beginFreq = getNominalFrequency( times );
        double endFreq = 1. / ( times[ n - 1 ] - times[ n - 2 ] );
        if ( beginFreq != endFreq ) {
            logger_.warning( "Sampling frequency changes from "
                           + beginFreq + "Hz to " + endFreq + "Hz" );
        }
        else {
            logger_.info( "Sampling frequency " + beginFreq + "Hz" );
        }
        double period = 1. / beginFreq;
        double trigger = ACCURACY * period;

        // Mark breaks.
        boolean[] breaks = new boolean[ n ];
        int nbreak = 0;
        for ( int i = 0; i < n - 1; i++ ) {
            double dt = times[ i + 1 ] - times[ i ];
            if ( ! TimeSeries.isFinite( dt ) || dt < 0 ||
                 Math.abs( dt - period ) > trigger ) {
                breaks[ i ] = true;
                nbreak++;
            }
        }
        breaks[ n - 1 ] = true;
        nbreak++;
        logger_.config( "Batch count: " + nbreak );
        if ( nbreak > maxBatches_ ) {
            throw new BatchOverflowException( nbreak, maxBatches_ );
        }

        // Turn breaks into batches.
        Batch[] batches = new Batch[ nbreak ];
        int ib = 0;
        int start = 0;
        for ( int i = 0; i < n; i++ ) {
            if ( breaks[ i ] ) {
                int end = i + 1;
                double freq = end - start > 1
                            ? 1. / ( times[ start + 1 ] - times[ start ] )
                            : beginFreq;
                batches[ ib++ ] = new Batch( start, end, freq );
                start = end;
            }
        }
        assert ib == nbreak;
        return batches;
    }
}
