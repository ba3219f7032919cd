package edu.mcw.rgd.dataload.patientvariants;

/**
 * @since 10/10/26
 */
public class NoMatchingRecordsException extends SearchException {

    public NoMatchingRecordsException(String msg) {
        super(msg);
    }
}
