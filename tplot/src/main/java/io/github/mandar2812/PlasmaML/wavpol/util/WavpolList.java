package io.github.mandar2812.PlasmaML.wavpol.util;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import io.github.mandar2812.PlasmaML.wavpol.TimeSeries;
import io.github.mandar2812.PlasmaML.wavpol.Wavpol;
import io.github.mandar2812.PlasmaML.wavpol.WavpolConfig;
import io.github.mandar2812.PlasmaML.wavpol.WavpolConfigException;
import io.github.mandar2812.PlasmaML.wavpol.WavpolResult;

/**
 * Utility to run wave polarisation analysis on a text file of
 * three-component samples and summarise the result.
 * Intended to be used from the commandline via the <code>main</code> method.
 *
 * <p>The input has one sample per line, giving time in seconds followed
 * by the x, y and z components, separated by whitespace or commas.
 * Blank lines and lines starting with <code>#</code> are ignored.
 *
 * @since    19 Oct 2026
 */
public class WavpolList {

    private final TimeSeries ts_;
    private final WavpolConfig config_;
    private final PrintStream out_;
    private final boolean writeData_;

    /**
     * Constructor.
     *
     * @param   ts   input time series
     * @param   config  analysis configuration
     * @param   out   output stream for listing
     * @param   writeData  true if per-row values as well as the summary
     *                     are to be written
     */
    public WavpolList( TimeSeries ts, WavpolConfig config, PrintStream out,
                       boolean writeData ) {
        ts_ = ts;
        config_ = config;
        out_ = out;
        writeData_ = writeData;
    }

    /**
     * Does the work, writing output.
     *
     * @return  analysis result
     */
    public WavpolResult run() {
        WavpolResult result = new Wavpol( config_ ).analyze( ts_ );
        if ( result.isError() ) {
            return result;
        }
        double[] freqs = result.getFreqline();
        header( "Wave polarisation: " + config_ );
        out_.println( "    Samples:     " + ts_.getSampleCount() );
        out_.println( "    Rows:        " + result.getRowCount() );
        out_.println( "    Frequencies: " + freqs.length );
        out_.println( "    Bin width:   "
                    + ( freqs.length > 1 ? freqs[ 1 ] : Double.NaN ) + " Hz" );

        if ( writeData_ ) {
            out_.println();
            header( "time\tfreq\tpower\tdegpol\twaveangle\telliptict\thelict" );
            double[] times = result.getTimeline();
            for ( int ir = 0; ir < times.length; ir++ ) {
                StringBuffer sbuf = new StringBuffer()
                    .append( times[ ir ] );
                int kpeak = getPeakBin( result.getPower()[ ir ] );
                if ( kpeak < 0 ) {
                    sbuf.append( "\t--" );
                }
                else {
                    sbuf.append( '\t' ).append( freqs[ kpeak ] )
                        .append( '\t' )
                        .append( result.getPower()[ ir ][ kpeak ] )
                        .append( '\t' )
                        .append( result.getDegreeOfPolarization()[ ir ]
                                                                  [ kpeak ] )
                        .append( '\t' )
                        .append( result.getWavenormalAngle()[ ir ][ kpeak ] )
                        .append( '\t' )
                        .append( result.getEllipticity()[ ir ][ kpeak ] )
                        .append( '\t' )
                        .append( result.getHelicity()[ ir ][ kpeak ] );
                }
                out_.println( sbuf.toString() );
            }
        }
        return result;
    }

    /**
     * Returns the index of the largest finite value.
     *
     * @param  power  power spectrum
     * @return  peak index, or -1 if no value is finite
     */
    static int getPeakBin( double[] power ) {
        int kpeak = -1;
        for ( int k = 0; k < power.length; k++ ) {
            if ( TimeSeries.isFinite( power[ k ] ) &&
                 ( kpeak < 0 || power[ k ] > power[ kpeak ] ) ) {
                kpeak = k;
            }
        }
        return kpeak;
    }

    /**
     * Writes a header to the output listing.
     *
     * @param  txt  header text
     */
    private void header( String txt ) {
        out_.println( txt );
        StringBuffer sbuf = new StringBuffer( txt.length() );
        for ( int i = 0; i < txt.length(); i++ ) {
            sbuf.append( txt.charAt( i ) == '\t' ? '\t' : '-' );
        }
        out_.println( sbuf.toString() );
    }

    /**
     * Reads a time series from a column-oriented text file.
     *
     * @param  file  input file
     * @return  time series
     * @throws  IOException  if the file cannot be read or has
     *          an unparseable line
     */
    public static TimeSeries readTimeSeries( File file ) throws IOException {
        BufferedReader in =
            new BufferedReader(
                new InputStreamReader( new FileInputStream( file ),
                                       StandardCharsets.UTF_8 ) );
        try {
            return readTimeSeries( in );
        }
        finally {
            in.close();
        }
    }

    /**
     * Reads a time series from a column-oriented text stream.
     *
     * @param  in  input reader
     * @return  time series
     * @throws  IOException  if the input cannot be read or has
     *          an unparseable line
     */
    public static TimeSeries readTimeSeries( BufferedReader in )
            throws IOException {
        List<double[]> rows = new ArrayList<double[]>();
        int iline = 0;
        for ( String line; ( line = in.readLine() ) != null; ) {
            iline++;
            line = line.trim();
            if ( line.length() == 0 || line.startsWith( "#" ) ) {
                continue;
            }
            String[] words = line.split( "[\\s,]+" );
            if ( words.length < 4 ) {
                throw new IOException( "Line " + iline + ": expected 4 "
                                     + "columns, found " + words.length );
            }
            double[] row = new double[ 4 ];
            for ( int ic = 0; ic < 4; ic++ ) {
                try {
                    row[ ic ] = Double.parseDouble( words[ ic ] );
                }
                catch ( NumberFormatException e ) {
                    throw new IOException( "Line " + iline + ": bad number \""
                                         + words[ ic ] + "\"", e );
                }
            }
            rows.add( row );
        }
        int n = rows.size();
        double[][] cols = new double[ 4 ][ n ];
        for ( int ir = 0; ir < n; ir++ ) {
            double[] row = rows.get( ir );
            for ( int ic = 0; ic < 4; ic++ ) {
                cols[ ic ][ ir ] = row[ ic ];
            }
        }
        try {
            return new TimeSeries( cols[ 0 ], cols[ 1 ], cols[ 2 ], cols[ 3 ] );
        }
        catch ( IllegalArgumentException e ) {
            throw new IOException( e.getMessage(), e );
        }
    }

    /**
     * Does the work for the command line tool, handling arguments.
     * Sucess is indicated by the return value.
     *
     * @param  args   command-line arguments
     * @return   0 for success, non-zero for failure
     */
    public static int runMain( String[] args ) throws IOException {
        return runMain( args, System.out, System.err );
    }

    /**
     * Does the work for the command line tool with given output streams.
     *
     * @param  args   command-line arguments
     * @param  out   destination for listing
     * @param  err   destination for error messages
     * @return   0 for success, non-zero for failure
     */
    static int runMain( String[] args, PrintStream out, PrintStream err )
            throws IOException {

        // Usage string.
        String usage = new StringBuffer()
           .append( "\n   Usage: " )
           .append( WavpolList.class.getName() )
           .append( " [-help]" )
           .append( " [-verbose|+verbose]" )
           .append( " [-data]" )
           .append( " [-nopfft <n>]" )
           .append( " [-steplength <n>]" )
           .append( " [-binfreq <n>]" )
           .append( " [-threads <n>]" )
           .append( " <txt-file>" )
           .append( "\n" )
           .toString();

        // Process arguments.
        List<String> argList = new ArrayList<String>( Arrays.asList( args ) );
        File file = null;
        boolean writeData = false;
        int verb = 0;
        int nopfft = -1;
        int steplength = -1;
        int binfreq = -1;
        int nthread = -1;
        try {
            for ( Iterator<String> it = argList.iterator(); it.hasNext(); ) {
                String arg = it.next();
                if ( arg.startsWith( "-h" ) ) {
                    it.remove();
                    out.println( usage );
                    return 0;
                }
                else if ( arg.equals( "-verbose" ) || arg.equals( "-v" ) ) {
                    it.remove();
                    verb++;
                }
                else if ( arg.equals( "+verbose" ) || arg.equals( "+v" ) ) {
                    it.remove();
                    verb--;
                }
                else if ( arg.equals( "-data" ) ) {
                    it.remove();
                    writeData = true;
                }
                else if ( arg.equals( "-nopfft" ) && it.hasNext() ) {
                    it.remove();
                    nopfft = Integer.parseInt( it.next() );
                    it.remove();
                }
                else if ( arg.equals( "-steplength" ) && it.hasNext() ) {
                    it.remove();
                    steplength = Integer.parseInt( it.next() );
                    it.remove();
                }
                else if ( arg.equals( "-binfreq" ) && it.hasNext() ) {
                    it.remove();
                    binfreq = Integer.parseInt( it.next() );
                    it.remove();
                }
                else if ( arg.equals( "-threads" ) && it.hasNext() ) {
                    it.remove();
                    nthread = Integer.parseInt( it.next() );
                    it.remove();
                }
                else if ( file == null && ! arg.startsWith( "-" ) ) {
                    it.remove();
                    file = new File( arg );
                }
            }
        }
        catch ( NumberFormatException e ) {
            err.println( "Bad number: " + e.getMessage() );
            err.println( usage );
            return 1;
        }

        // Validate arguments.
        if ( ! argList.isEmpty() ) {
            err.println( "Unused args: " + argList );
            err.println( usage );
            return 1;
        }
        if ( file == null ) {
            err.println( usage );
            return 1;
        }
        WavpolConfig config;
        try {
            config = new WavpolConfig( nopfft, steplength, binfreq, nthread );
        }
        catch ( WavpolConfigException e ) {
            err.println( "Bad configuration: " + e.getMessage() );
            err.println( usage );
            return 1;
        }

        // Configure and run.
        LogUtil.setVerbosity( verb );
        WavpolResult result =
            new WavpolList( readTimeSeries( file ), config, out, writeData )
           .run();
        if ( result.isError() ) {
            err.println( "Analysis abandoned: too many data gaps" );
            return 1;
        }
        return 0;
    }

    /**
     * Main method.  Use -help for arguments.
     */
    public static void main( String[] args ) throws IOException {
        int status = runMain( args );
        if ( status != 0 ) {
            System.exit( status );
        }
    }
}
