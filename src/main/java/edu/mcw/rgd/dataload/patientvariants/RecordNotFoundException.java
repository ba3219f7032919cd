package edu.mcw.rgd.dataload.patientvariants;

/**
 * @since 10/6/26
 * annotation service was reached, but it has no record for the query
 */
public class RecordNotFoundException extends AnnotationException {

    public RecordNotFoundException(String message) {
        super(message);
    }
}
