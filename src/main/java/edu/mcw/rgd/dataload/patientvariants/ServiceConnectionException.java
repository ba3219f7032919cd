package edu.mcw.rgd.dataload.patientvariants;

/**
 * @since 10/6/26
 * annotation service could not be reached in time, or its reply was unusable
 */
public class ServiceConnectionException extends AnnotationException {

    public ServiceConnectionException(String message) {
        super(message);
    }

    public ServiceConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
