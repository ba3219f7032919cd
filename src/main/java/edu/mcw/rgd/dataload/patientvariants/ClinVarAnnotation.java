package edu.mcw.rgd.dataload.patientvariants;

/**
 * @since 10/7/26
 * clinical annotation of a variant, as extracted from a ClinVar ESummary document;
 * fields that could not be extracted hold {@link #NOT_AVAILABLE}
 */
public class ClinVarAnnotation {

    public static final String NOT_AVAILABLE = "N/A";

    private String geneSymbol;
    private String cdnaChange;
    private String clinvarId;
    private String accession;
    private String classification;
    private String numRecords;
    private String reviewStatus;
    private String associatedCondition;
    private String recordUrl;

    /**
     * copy the annotation into those ClinVar fields of the variant that are still empty
     * @param var variant to be filled
     */
    public void fillInto(Variant var) {
        Variant src = new Variant();
        src.setClinvarId(clinvarId);
        src.setGeneSymbol(geneSymbol);
        src.setClassification(classification);
        src.setCdnaChange(cdnaChange);
        src.setClinvarAccession(accession);
        src.setNumRecords(numRecords);
        src.setReviewStatus(reviewStatus);
        src.setAssociatedCondition(associatedCondition);
        src.setClinvarUrl(recordUrl);
        var.fillClinVarFieldsFrom(src);
    }

    public String getGeneSymbol() {
        return geneSymbol;
    }

    public void setGeneSymbol(String geneSymbol) {
        this.geneSymbol = geneSymbol;
    }

    public String getCdnaChange() {
        return cdnaChange;
    }

    public void setCdnaChange(String cdnaChange) {
        this.cdnaChange = cdnaChange;
    }

    public String getClinvarId() {
        return clinvarId;
    }

    public void setClinvarId(String clinvarId) {
        this.clinvarId = clinvarId;
    }

    public String getAccession() {
        return accession;
    }

    public void setAccession(String accession) {
        this.accession = accession;
    }

    public String getClassification() {
        return classification;
    }

    public void setClassification(String classification) {
        this.classification = classification;
    }

    public String getNumRecords() {
        return numRecords;
    }

    public void setNumRecords(String numRecords) {
        this.numRecords = numRecords;
    }

    public String getReviewStatus() {
        return reviewStatus;
    }

    public void setReviewStatus(String reviewStatus) {
        this.reviewStatus = reviewStatus;
    }

    public String getAssociatedCondition() {
        return associatedCondition;
    }

    public void setAssociatedCondition(String associatedCondition) {
        this.associatedCondition = associatedCondition;
    }

    public String getRecordUrl() {
        return recordUrl;
    }

    public void setRecordUrl(String recordUrl) {
        this.recordUrl = recordUrl;
    }
}
