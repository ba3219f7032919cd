package edu.mcw.rgd.dataload.patientvariants;

import org.apache.commons.lang3.StringUtils;

/**
 * @since 10/6/26
 * represents a row in VARIANTS table; identified by its canonical genomic key (vcf form)
 */
public class Variant {

    private String vcfForm;
    private String hgvs;
    private String clinvarId;
    private String geneSymbol;
    private String classification;
    private String cdnaChange;
    private String clinvarAccession;
    private String numRecords;
    private String reviewStatus;
    private String associatedCondition;
    private String clinvarUrl;

    /**
     * @return true if the variant carries a ClinVar id and a classification
     */
    public boolean hasClinVarAnnotation() {
        return StringUtils.isNotEmpty(clinvarId) && StringUtils.isNotEmpty(classification);
    }

    /**
     * copy ClinVar fields from other variant, but only into fields that are empty in this variant
     * @param other source of the ClinVar fields
     */
    public void fillClinVarFieldsFrom(Variant other) {
        if( StringUtils.isEmpty(clinvarId) )
            clinvarId = other.getClinvarId();
        if( StringUtils.isEmpty(geneSymbol) )
            geneSymbol = other.getGeneSymbol();
        if( StringUtils.isEmpty(classification) )
            classification = other.getClassification();
        if( StringUtils.isEmpty(cdnaChange) )
            cdnaChange = other.getCdnaChange();
        if( StringUtils.isEmpty(clinvarAccession) )
            clinvarAccession = other.getClinvarAccession();
        if( StringUtils.isEmpty(numRecords) )
            numRecords = other.getNumRecords();
        if( StringUtils.isEmpty(reviewStatus) )
            reviewStatus = other.getReviewStatus();
        if( StringUtils.isEmpty(associatedCondition) )
            associatedCondition = other.getAssociatedCondition();
        if( StringUtils.isEmpty(clinvarUrl) )
            clinvarUrl = other.getClinvarUrl();
    }

    public String dump(String delimiter) {
        return vcfForm
            + delimiter + hgvs
            + delimiter + clinvarId
            + delimiter + geneSymbol
            + delimiter + classification
            + delimiter + cdnaChange
            + delimiter + clinvarAccession
            + delimiter + numRecords
            + delimiter + reviewStatus
            + delimiter + associatedCondition
            + delimiter + clinvarUrl;
    }

    public String getVcfForm() {
        return vcfForm;
    }

    public void setVcfForm(String vcfForm) {
        this.vcfForm = vcfForm;
    }

    public String getHgvs() {
        return hgvs;
    }

    public void setHgvs(String hgvs) {
        this.hgvs = hgvs;
    }

    public String getClinvarId() {
        return clinvarId;
    }

    public void setClinvarId(String clinvarId) {
        this.clinvarId = clinvarId;
    }

    public String getGeneSymbol() {
        return geneSymbol;
    }

    public void setGeneSymbol(String geneSymbol) {
        this.geneSymbol = geneSymbol;
    }

    public String getClassification() {
        return classification;
    }

    public void setClassification(String classification) {
        this.classification = classification;
    }

    public String getCdnaChange() {
        return cdnaChange;
    }

    public void setCdnaChange(String cdnaChange) {
        this.cdnaChange = cdnaChange;
    }

    public String getClinvarAccession() {
        return clinvarAccession;
    }

    public void setClinvarAccession(String clinvarAccession) {
        this.clinvarAccession = clinvarAccession;
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

    public String getClinvarUrl() {
        return clinvarUrl;
    }

    public void setClinvarUrl(String clinvarUrl) {
        this.clinvarUrl = clinvarUrl;
    }
}
