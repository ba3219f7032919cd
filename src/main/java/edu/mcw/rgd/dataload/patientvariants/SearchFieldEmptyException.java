package edu.mcw.rgd.dataload.patientvariants;

/**
 * @since 10/10/26
 */
public class SearchFieldEmptyException extends SearchException {

    public SearchFieldEmptyException(String msg) {
        super(msg);
    }
}
