package edu.mcw.rgd.dataload.patientvariants;

/**
 * @since 10/6/26
 * raised before any network call when a genomic key, an HGVS name or a ClinVar id is malformed
 */
public class InputFormatException extends AnnotationException {

    public InputFormatException(String message) {
        super(message);
    }
}
