package io.github.mandar2812.PlasmaML.wavpol;

/**
 * Exception thrown when a wave polarisation analysis is configured
 * with parameters that the analysis cannot work with.
 *
 * @since    19 Oct 2026
 */
public class WavpolConfigException extends IllegalArgumentException {

    private final String paramName_;

    /**
     * Constructor.
     *
     * @param  paramName  name of the offending configuration parameter
     * @param  msg   message
     */
    public WavpolConfigException( String paramName, String msg ) {
        super( paramName + ": " + msg );
        paramName_ = paramName;
    }

    /**
     * Returns the name of the parameter which caused the trouble.
     *
     * @return  parameter name
     */
    public String getParamName() {
        return paramName_;
    }
}
