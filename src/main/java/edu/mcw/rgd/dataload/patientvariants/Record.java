package edu.mcw.rgd.dataload.patientvariants;

/**
 * @since 10/6/26
 * represents a line read from a patient variant file
 */
public class Record {

    private String chromosome;
    private String position;
    private String ref;
    private String alt;

    // variant as read from file and enriched by the annotator
    private Variant varIncoming = new Variant();
    // variant as currently stored in the database, or null if not there yet
    private Variant varInDb;

    // gene ids returned by VariantValidator; not stored with the variant
    private String hgncId;
    private String omimId;

    public String getVcfForm() {
        return varIncoming.getVcfForm();
    }

    public String getChromosome() {
        return chromosome;
    }

    public void setChromosome(String chromosome) {
        this.chromosome = chromosome;
    }

    public String getPosition() {
        return position;
    }

    public void setPosition(String position) {
        this.position = position;
    }

    public String getRef() {
        return ref;
    }

    public void setRef(String ref) {
        this.ref = ref;
    }

    public String getAlt() {
        return alt;
    }

    public void setAlt(String alt) {
        this.alt = alt;
    }

    public Variant getVarIncoming() {
        return varIncoming;
    }

    public void setVarIncoming(Variant varIncoming) {
        this.varIncoming = varIncoming;
    }

    public Variant getVarInDb() {
        return varInDb;
    }

    public void setVarInDb(Variant varInDb) {
        this.varInDb = varInDb;
    }

    public String getHgncId() {
        return hgncId;
    }

    public void setHgncId(String hgncId) {
        this.hgncId = hgncId;
    }

    public String getOmimId() {
        return omimId;
    }

    public void setOmimId(String omimId) {
        this.omimId = omimId;
    }
}
