package edu.mcw.rgd.dataload.patientvariants;

/**
 * @since 10/10/26
 * search of stored variants could not produce any results
 */
public class SearchException extends Exception {

    public SearchException(String msg) {
        super(msg);
    }
}
