package edu.mcw.rgd.dataload.patientvariants;

/**
 * @since 10/6/26
 * VariantValidator response did not contain any transcript-level (c.) description
 */
public class TranscriptNotFoundException extends RecordNotFoundException {

    public TranscriptNotFoundException(String message) {
        super(message);
    }
}
