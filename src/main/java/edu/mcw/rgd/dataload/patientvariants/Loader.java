package edu.mcw.rgd.dataload.patientvariants;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * @since 10/9/26
 * load data into database if needed: patient, genes, variants and patient-variant links;
 * rows are only inserted when absent, and stored variants only get their empty fields filled
 */
public class Loader {

    Logger log = LogManager.getLogger("loader");

    private Dao dao;

    public Dao getDao() {
        return dao;
    }

    public void setDao(Dao dao) {
        this.dao = dao;
    }

    public void run(Batch batch) {

        Counters counters = batch.getCounters();
        String patientName = batch.getPatientName();

        if( dao.insertPatient(patientName)>0 ) {
            counters.increment("PATIENTS_INSERTED");
        }

        for( Record rec: batch.getRecords() ) {
            run(rec, patientName, counters);
        }
        log.info(patientName+": loaded "+batch.getRecords().size()+" rows");
    }

    void run(Record rec, String patientName, Counters counters) {

        Variant varIncoming = rec.getVarIncoming();
        varIncoming.setGeneSymbol(resolveGeneSymbol(varIncoming.getGeneSymbol()));

        // variant may have been written by an earlier row of the same batch
        Variant varInDb = dao.getVariant(rec.getVcfForm());
        Variant varFinal = varInDb==null ? varIncoming : fill(varInDb, varIncoming);

        // gene must be there before the variant referencing it
        String geneSymbol = varFinal.getGeneSymbol();
        if( dao.getGene(geneSymbol)==null ) {
            dao.insertGene(new Gene(geneSymbol, getGeneUrl(geneSymbol, rec.getHgncId())));
            counters.increment("GENES_INSERTED");
        }

        if( varInDb==null ) {
            dao.insertVariant(varIncoming);
            counters.increment("VARIANTS_INSERTED");
        }
        else if( !varFinal.dump("|").equals(varInDb.dump("|")) ) {
            dao.fillVariant(varIncoming);
            counters.increment("VARIANTS_FILLED");
        }
        else {
            counters.increment("VARIANTS_MATCHING");
        }
        rec.setVarInDb(varFinal);

        if( dao.linkExists(patientName, rec.getVcfForm()) ) {
            counters.increment("LINKS_MATCHING");
        } else {
            dao.insertLink(patientName, rec.getVcfForm());
            counters.increment("LINKS_INSERTED");
        }
    }

    /**
     * @return gene symbol, or placeholder 'UNKNOWN' if the symbol is not known
     */
    static String resolveGeneSymbol(String geneSymbol) {
        if( StringUtils.isBlank(geneSymbol) || geneSymbol.equals(ClinVarAnnotation.NOT_AVAILABLE) ) {
            return Gene.UNKNOWN_SYMBOL;
        }
        return geneSymbol;
    }

    /**
     * @return HGNC symbol report url, or null if there is no HGNC id or the gene is the placeholder
     */
    static String getGeneUrl(String geneSymbol, String hgncId) {
        if( Gene.UNKNOWN_SYMBOL.equals(geneSymbol)
            || StringUtils.isBlank(hgncId)
            || hgncId.equals(ClinVarAnnotation.NOT_AVAILABLE) ) {
            return null;
        }
        return Gene.HGNC_REPORT_URL+hgncId;
    }

    /**
     * variant as it will be stored after its empty fields are filled with incoming values
     */
    static Variant fill(Variant varInDb, Variant varIncoming) {
        Variant v = new Variant();
        v.setVcfForm(varInDb.getVcfForm());
        v.setHgvs(firstNonNull(varInDb.getHgvs(), varIncoming.getHgvs()));
        v.setClinvarId(firstNonNull(varInDb.getClinvarId(), varIncoming.getClinvarId()));
        v.setGeneSymbol(varInDb.getGeneSymbol()==null || varInDb.getGeneSymbol().equals(Gene.UNKNOWN_SYMBOL)
            ? varIncoming.getGeneSymbol() : varInDb.getGeneSymbol());
        v.setClassification(firstNonNull(varInDb.getClassification(), varIncoming.getClassification()));
        v.setCdnaChange(firstNonNull(varInDb.getCdnaChange(), varIncoming.getCdnaChange()));
        v.setClinvarAccession(firstNonNull(varInDb.getClinvarAccession(), varIncoming.getClinvarAccession()));
        v.setNumRecords(firstNonNull(varInDb.getNumRecords(), varIncoming.getNumRecords()));
        v.setReviewStatus(firstNonNull(varInDb.getReviewStatus(), varIncoming.getReviewStatus()));
        v.setAssociatedCondition(firstNonNull(varInDb.getAssociatedCondition(), varIncoming.getAssociatedCondition()));
        v.setClinvarUrl(firstNonNull(varInDb.getClinvarUrl(), varIncoming.getClinvarUrl()));
        return v;
    }

    static String firstNonNull(String stored, String incoming) {
        return stored!=null ? stored : incoming;
    }
}
