package io.github.mandar2812.PlasmaML.wavpol.tplot;

/**
 * Store of named data variables.
 *
 * @since    19 Oct 2026
 */
public interface TplotStore {

    /**
     * Returns the variable with a given name.
     *
     * @param  name  variable name
     * @return  variable, or null if none is stored under that name
     */
    TplotVariable getVariable( String name );

    /**
     * Stores a variable, replacing any existing one of the same name.
     *
     * @param  name  variable name
     * @param  var   variable
     */
    void storeVariable( String name, TplotVariable var );

    /**
     * Returns the names of stored variables matching a pattern.
     * In the pattern, <code>*</code> matches any sequence of characters
     * and <code>?</code> any single character.
     *
     * @param  pattern  name or glob pattern
     * @return  matching names in storage order
     */
    String[] getNames( String pattern );
}
