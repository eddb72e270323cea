package io.github.mandar2812.PlasmaML.wavpol.tplot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * TplotStore implementation which keeps variables in memory
 * in insertion order.
 *
 * @since    19 Oct 2026
 */
public class MemoryTplotStore implements TplotStore {

    private final Map<String,TplotVariable> varMap_;

    /**
     * Constructs an empty store.
     */
    public MemoryTplotStore() {
        varMap_ = new LinkedHashMap<String,TplotVariable>();
    }

    public synchronized TplotVariable getVariable( String name ) {
        return varMap_.get( name );
    }

    public synchronized void storeVariable( String name, TplotVariable var ) {
        varMap_.put( name, var );
    }

    public synchronized String[] getNames( String pattern ) {
        Pattern regex = globToRegex( pattern );
        List<String> names = new ArrayList<String>();
        for ( String name : varMap_.keySet() ) {
            if ( regex.matcher( name ).matches() ) {
                names.add( name );
            }
        }
        return names.toArray( new String[ 0 ] );
    }

    /**
     * Converts a glob pattern to a regular expression.
     *
     * @param  glob  pattern using <code>*</code> and <code>?</code>
     * @return  compiled regular expression
     */
    static Pattern globToRegex( String glob ) {
        StringBuffer sbuf = new StringBuffer();
        StringBuffer literal = new StringBuffer();
        for ( int i = 0; i < glob.length(); i++ ) {
            char c = glob.charAt( i );
            if ( c == '*' || c == '?' ) {
                if ( literal.length() > 0 ) {
                    sbuf.append( Pattern.quote( literal.toString() ) );
                    literal.setLength( 0 );
                }
                sbuf.append( c == '*' ? ".*" : "." );
            }
            else {
                literal.append( c );
            }
        }
        if ( literal.length() > 0 ) {
            sbuf.append( Pattern.quote( literal.toString() ) );
        }
        return Pattern.compile( sbuf.toString() );
    }
}
