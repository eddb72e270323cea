package io.github.mandar2812.PlasmaML.wavpol.util;

import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Utilities for controlling the logging of the analysis classes.
 *
 * @since    19 Oct 2026
 */
public class LogUtil {

    /** Name of the logger parent to all analysis loggers. */
    public static final String WAVPOL_LOGGER = "io.github.mandar2812.PlasmaML.wavpol";

    /**
     * Private constructor prevents instantiation.
     */
    private LogUtil() {
    }

    /**
     * Converts a verbosity count to a logging level.
     *
     * @param   verbose  0 for normal, positive for more, negative for less
     *          (0=INFO, +1=CONFIG, -1=WARNING)
     * @return  level
     */
    public static Level getLevel( int verbose ) {
        int ilevel = Level.INFO.intValue() - ( verbose * 100 );
        return Level.parse( Integer.toString( ilevel ) );
    }

    /**
     * Sets the logging verbosity of the analysis loggers and ensures that
     * messages at that level are reported to the console in compact form.
     *
     * @param   verbose  0 for normal, positive for more, negative for less
     *          (0=INFO, +1=CONFIG, -1=WARNING)
     * @return  the level set
     */
    public static Level setVerbosity( int verbose ) {
        Level level = getLevel( verbose );
        Logger.getLogger( WAVPOL_LOGGER ).setLevel( level );

        // The root console handler squashes anything below INFO
        // unless told otherwise.
        Logger rootLogger = Logger.getLogger( "" );
        Level rootLevel = rootLogger.getLevel();
        if ( rootLevel == null || level.intValue() < rootLevel.intValue() ) {
            rootLogger.setLevel( level );
        }
        for ( Handler handler : rootLogger.getHandlers() ) {
            if ( handler instanceof ConsoleHandler ) {
                handler.setLevel( level );
                handler.setFormatter( new LineFormatter( verbose > 1 ) );
            }
        }
        return level;
    }

    /**
     * Compact log record formatter.  Unlike the default
     * {@link java.util.logging.SimpleFormatter} this uses only
     * a single line for each record.
     */
    public static class LineFormatter extends Formatter {

        private final boolean debug_;

        /**
         * Constructor.
         *
         * @param   debug  iff true, appends the logging class and method
         */
        public LineFormatter( boolean debug ) {
            debug_ = debug;
        }

        public String format( LogRecord record ) {
            StringBuffer sbuf = new StringBuffer()
                .append( record.getLevel().toString() )
                .append( ": " )
                .append( formatMessage( record ) );
            if ( debug_ ) {
                String clazz = record.getSourceClassName();
                sbuf.append( " (" )
                    .append( clazz == null
                             ? record.getLoggerName()
                             : clazz.substring( clazz.lastIndexOf( '.' )
                                              + 1 ) )
                    .append( '.' )
                    .append( record.getSourceMethodName() )
                    .append( ')' );
            }
            sbuf.append( '\n' );
            return sbuf.toString();
        }
    }
}
