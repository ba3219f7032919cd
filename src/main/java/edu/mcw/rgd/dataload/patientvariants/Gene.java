package edu.mcw.rgd.dataload.patientvariants;

/**
 * @since 10/6/26
 * represents a row in GENES table
 */
public class Gene {

    public static final String UNKNOWN_SYMBOL = "UNKNOWN";

    public static final String HGNC_REPORT_URL = "https://www.genenames.org/data/gene-symbol-report/#!/hgnc_id/";

    private final String geneSymbol;
    private final String geneUrl;

    public Gene(String geneSymbol, String geneUrl) {
        this.geneSymbol = geneSymbol;
        this.geneUrl = geneUrl;
    }

    public String dump(String delimiter) {
        return geneSymbol + delimiter + geneUrl;
    }

    public String getGeneSymbol() {
        return geneSymbol;
    }

    public String getGeneUrl() {
        return geneUrl;
    }
}
