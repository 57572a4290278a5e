package com.deporacle.engine.upstream;

/**
 * An upstream API answered with something the engine cannot use: a missing
 * resource, a malformed payload, or no usable data at all.
 *
 * @author Naveed Gung
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
