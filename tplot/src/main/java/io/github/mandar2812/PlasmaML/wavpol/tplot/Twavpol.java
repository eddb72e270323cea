package io.github.mandar2812.PlasmaML.wavpol.tplot;

import java.util.logging.Logger;

import io.github.mandar2812.PlasmaML.wavpol.Wavpol;
import io.github.mandar2812.PlasmaML.wavpol.WavpolConfig;
import io.github.mandar2812.PlasmaML.wavpol.WavpolResult;

/**
 * Applies wave polarisation analysis to a stored three-component
 * variable, storing the results as spectrogram variables.
 *
 * <p>For a prefix <code>P</code> the following variables are written,
 * each with the analysis timeline as times and the frequency line
 * as its column axis:
 * <ul>
 * <li><code>P_powspec</code>: total power</li>
 * <li><code>P_degpol</code>: degree of polarisation</li>
 * <li><code>P_waveangle</code>: wavenormal angle</li>
 * <li><code>P_elliptict</code>: ellipticity</li>
 * <li><code>P_helict</code>: helicity</li>
 * <li><code>P_pspec3_x</code>, <code>P_pspec3_y</code>,
 *     <code>P_pspec3_z</code>: per-component power</li>
 * </ul>
 *
 * @since    19 Oct 2026
 */
public class Twavpol {

    private final TplotStore store_;
    private final Wavpol wavpol_;

    /** Option marking a variable for display as a spectrogram. */
    public static final String SPEC_OPTION = "spec";

    private static final String[] AXIS_SUFFIXES = { "_x", "_y", "_z" };
    private static final Logger logger_ =
        Logger.getLogger( Twavpol.class.getName() );

    /**
     * Constructs an instance with default analysis parameters.
     *
     * @param  store  variable store
     */
    public Twavpol( TplotStore store ) {
        this( store, WavpolConfig.createDefault() );
    }

    /**
     * Constructor.
     *
     * @param  store  variable store
     * @param  config  analysis configuration
     */
    public Twavpol( TplotStore store, WavpolConfig config ) {
        store_ = store;
        wavpol_ = new Wavpol( config );
    }

    /**
     * Runs the analysis, using the input variable name as prefix.
     *
     * @param  tvarname  name of input variable
     * @return  true on success
     */
    public boolean run( String tvarname ) {
        return run( tvarname, "" );
    }

    /**
     * Runs the analysis.
     * Problems are logged, and signalled by the return value.
     *
     * @param  tvarname  name of input variable, with three columns
     * @param  prefix  prefix for output variable names;
     *                 if null or empty the input name is used
     * @return  true on success, false if nothing was stored
     */
    public boolean run( String tvarname, String prefix ) {
        if ( prefix == null || prefix.length() == 0 ) {
            prefix = tvarname;
        }
        if ( store_.getNames( tvarname ).length < 1 ) {
            logger_.severe( "twavpol error: No variables match "
                          + tvarname );
            return false;
        }
        TplotVariable var = store_.getVariable( tvarname );
        if ( var == null ) {
            logger_.severe( "twavpol error: " + tvarname
                          + " is a pattern, not a variable name" );
            return false;
        }
        double[] times = var.getTimes();
        if ( times.length < 2 ) {
            logger_.severe( "twavpol error: Time variable does not have "
                          + "enough points" );
            return false;
        }
        double[][] values = var.getValues();
        if ( values.length != times.length ) {
            logger_.severe( "twavpol error: Number of time elements ("
                          + times.length + ") does not match number of "
                          + "field elements (" + values.length + ")" );
            return false;
        }
        for ( int ir = 0; ir < values.length; ir++ ) {
            if ( values[ ir ] == null || values[ ir ].length != 3 ) {
                logger_.severe( "twavpol error: Data should have "
                              + "3 columns" );
                return false;
            }
        }

        WavpolResult result =
            wavpol_.analyze( times, var.getColumn( 0 ), var.getColumn( 1 ),
                             var.getColumn( 2 ) );
        if ( result.isError() ) {
            logger_.severe( "twavpol error: There were errors while "
                          + "applying wavpol" );
            return false;
        }

        double[] timeline = result.getTimeline();
        double[] freqline = result.getFreqline();
        storeSpec( prefix + "_powspec", timeline, result.getPower(),
                   freqline );
        storeSpec( prefix + "_degpol", timeline,
                   result.getDegreeOfPolarization(), freqline );
        storeSpec( prefix + "_waveangle", timeline,
                   result.getWavenormalAngle(), freqline );
        storeSpec( prefix + "_elliptict", timeline, result.getEllipticity(),
                   freqline );
        storeSpec( prefix + "_helict", timeline, result.getHelicity(),
                   freqline );
        double[][][] axisPower = result.getAxisPower();
        for ( int ic = 0; ic < 3; ic++ ) {
            storeSpec( prefix + "_pspec3" + AXIS_SUFFIXES[ ic ], timeline,
                       getAxisGrid( axisPower, ic ), freqline );
        }
        logger_.info( "twavpol: stored " + prefix + "_* ("
                    + timeline.length + " rows, " + freqline.length
                    + " frequencies)" );
        return true;
    }

    private void storeSpec( String name, double[] times, double[][] grid,
                            double[] freqs ) {
        TplotVariable var = new TplotVariable( times, grid, freqs );
        var.setOption( SPEC_OPTION, Integer.valueOf( 1 ) );
        store_.storeVariable( name, var );
    }

    /**
     * Extracts one component's grid from the per-component power.
     *
     * @param  axisPower  grid indexed by row, bin, component
     * @param  ic  component index
     * @return  grid indexed by row, bin
     */
    private static double[][] getAxisGrid( double[][][] axisPower, int ic ) {
        int nrow = axisPower.length;
        double[][] grid = new double[ nrow ][];
        for ( int ir = 0; ir < nrow; ir++ ) {
            int nbin = axisPower[ ir ].length;
            grid[ ir ] = new double[ nbin ];
            for ( int k = 0; k < nbin; k++ ) {
                grid[ ir ][ k ] = axisPower[ ir ][ k ][ ic ];
            }
        }
        return grid;
    }
}
