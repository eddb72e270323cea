package io.github.mandar2812.PlasmaML.wavpol.tplot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named-variable data item: a time axis, a value array with one row
 * per time, and optionally a second axis giving the value of each
 * column, for instance frequency for a spectrogram.
 *
 * <p>Display options are held in a mutable map.
 *
 * @since    19 Oct 2026
 */
public class TplotVariable {

    private final double[] times_;
    private final double[][] values_;
    private final double[] v_;
    private final Map<String,Object> options_;

    /**
     * Constructs a variable with no column axis.
     *
     * @param  times  time values in seconds
     * @param  values  values indexed by <code>[time][column]</code>
     */
    public TplotVariable( double[] times, double[][] values ) {
        this( times, values, null );
    }

    /**
     * Constructor.
     *
     * @param  times  time values in seconds
     * @param  values  values indexed by <code>[time][column]</code>
     * @param  v   column axis values, or null
     */
    public TplotVariable( double[] times, double[][] values, double[] v ) {
        times_ = times;
        values_ = values;
        v_ = v;
        options_ = new LinkedHashMap<String,Object>();
    }

    /**
     * Returns the time values.
     *
     * @return  times array, not copied
     */
    public double[] getTimes() {
        return times_;
    }

    /**
     * Returns the data values.
     *
     * @return  value array indexed by time then column, not copied
     */
    public double[][] getValues() {
        return values_;
    }

    /**
     * Returns the column axis.
     *
     * @return  column axis values, or null
     */
    public double[] getV() {
        return v_;
    }

    /**
     * Returns the number of columns, taken from the first row.
     *
     * @return  column count, or 0 if there are no rows
     */
    public int getColumnCount() {
        return values_.length > 0 && values_[ 0 ] != null
             ? values_[ 0 ].length
             : 0;
    }

    /**
     * Returns one column of the value array.
     *
     * @param  icol  column index
     * @return  new array with one element per row
     */
    public double[] getColumn( int icol ) {
        double[] col = new double[ values_.length ];
        for ( int ir = 0; ir < values_.length; ir++ ) {
            col[ ir ] = values_[ ir ][ icol ];
        }
        return col;
    }

    /**
     * Returns the mutable map of display options.
     *
     * @return  option map
     */
    public Map<String,Object> getOptions() {
        return options_;
    }

    /**
     * Sets a display option.
     *
     * @param  key  option name
     * @param  value  option value
     */
    public void setOption( String key, Object value ) {
        options_.put( key, value );
    }

    @Override
    public String toString() {
        return times_.length + " x " + getColumnCount()
             + ( v_ == null ? "" : " (v: " + v_.length + ")" );
    }
}
