package edu.mcw.rgd.dataload.patientvariants;

import org.apache.commons.lang3.StringUtils;

import java.util.Set;
import java.util.TreeSet;

/**
 * @since 10/6/26
 * canonical genomic key of a variant: CHROM:POS:REF:ALT, f.e. '17:45983420:G:T'
 */
public class VariantKey {

    static final Set<String> CHROMOSOMES = new TreeSet<>();
    static {
        for( int i=1; i<=22; i++ ) {
            CHROMOSOMES.add(Integer.toString(i));
        }
        CHROMOSOMES.add("X");
        CHROMOSOMES.add("Y");
    }

    static final Set<String> BASES = Set.of("A", "C", "G", "T");

    private final String chromosome;
    private final String position;
    private final String ref;
    private final String alt;

    private VariantKey(String chromosome, String position, String ref, String alt) {
        this.chromosome = chromosome;
        this.position = position;
        this.ref = ref;
        this.alt = alt;
    }

    /**
     * build the canonical key from the four fields of a variant row; no validation beyond presence
     * @return canonical key 'chromosome:position:ref:alt'
     * @throws InputFormatException if any of the fields is missing
     */
    public static String canonicalKey(String chromosome, String position, String ref, String alt) throws InputFormatException {
        return required("chromosome", chromosome)
            + ":" + required("position", position)
            + ":" + required("ref", ref)
            + ":" + required("alt", alt);
    }

    static String required(String fieldName, String value) throws InputFormatException {
        if( StringUtils.isBlank(value) ) {
            throw new InputFormatException("missing required field '"+fieldName+"'");
        }
        return value.trim();
    }

    /**
     * parse and validate a canonical key: chromosome must be 1-22, X or Y,
     * position a non-negative integer, ref and alt a single base A, C, G or T
     * @param variantDescription key, f.e. '17:45983420:G:T'
     * @return validated key
     * @throws InputFormatException if the key does not conform
     */
    public static VariantKey parse(String variantDescription) throws InputFormatException {

        if( variantDescription==null ) {
            throw new InputFormatException("Invalid VCF-style format: null. Expected 4 colon-separated fields, e.g. '17:45983420:G:T'.");
        }

        String[] fields = variantDescription.split(":", -1);
        if( fields.length!=4 ) {
            throw new InputFormatException("Invalid VCF-style format: '"+variantDescription+"'. "
                +"Expected 4 colon-separated fields, e.g. '17:45983420:G:T'.");
        }

        if( !CHROMOSOMES.contains(fields[0]) ) {
            throw new InputFormatException("Invalid chromosome '"+fields[0]+"' in '"+variantDescription+"'. Expected 1-22, X or Y.");
        }
        if( !fields[1].matches("[0-9]+") ) {
            throw new InputFormatException("Invalid position '"+fields[1]+"' in '"+variantDescription+"'. Expected a non-negative integer.");
        }
        if( !BASES.contains(fields[2]) ) {
            throw new InputFormatException("Invalid reference base '"+fields[2]+"' in '"+variantDescription+"'. Expected A, C, G or T.");
        }
        if( !BASES.contains(fields[3]) ) {
            throw new InputFormatException("Invalid alternate base '"+fields[3]+"' in '"+variantDescription+"'. Expected A, C, G or T.");
        }
        return new VariantKey(fields[0], fields[1], fields[2], fields[3]);
    }

    public String getChromosome() {
        return chromosome;
    }

    public String getPosition() {
        return position;
    }

    public String getRef() {
        return ref;
    }

    public String getAlt() {
        return alt;
    }

    @Override
    public String toString() {
        return chromosome+":"+position+":"+ref+":"+alt;
    }
}
