package edu.mcw.rgd.dataload.patientvariants;

/**
 * @since 10/6/26
 * base class for all failures raised while annotating a single variant;
 * callers may degrade the affected fields and continue with the next row
 */
public class AnnotationException extends Exception {

    public AnnotationException(String message) {
        super(message);
    }

    public AnnotationException(String message, Throwable cause) {
        super(message, cause);
    }
}
