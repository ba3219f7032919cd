package edu.mcw.rgd.dataload.patientvariants;

/**
 * @since 10/7/26
 * transcript-level HGVS name with the gene ids returned by VariantValidator
 */
public class HgvsResult {

    private final String nomenclature;
    private final String hgncId;
    private final String omimId;

    public HgvsResult(String nomenclature, String hgncId, String omimId) {
        this.nomenclature = nomenclature;
        this.hgncId = hgncId;
        this.omimId = omimId;
    }

    public String getNomenclature() {
        return nomenclature;
    }

    public String getHgncId() {
        return hgncId;
    }

    public String getOmimId() {
        return omimId;
    }
}
