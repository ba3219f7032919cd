package edu.mcw.rgd.dataload.patientvariants;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * @since 10/9/26
 * fills missing HGVS names and ClinVar annotations of incoming variants;
 * values already present in the file or in the database are reused, and only
 * the remaining ones are requested from VariantValidator and ClinVar
 */
public class VariantAnnotator {

    Logger log = LogManager.getLogger("annotator");
    Logger logDebug = LogManager.getLogger("dbg");

    /**
     * where the value of an annotation comes from
     */
    public enum Enrichment {
        /** already present in the incoming row */
        SATISFIED,
        /** present in the variant stored in database */
        KNOWN_TO_STORE,
        /** must be requested from the web service */
        MUST_FETCH
    }

    private VariantValidatorClient variantValidatorClient;
    private ClinVarClient clinVarClient;

    /**
     * annotate all records of the batch; a failed lookup degrades the affected fields of that record only
     */
    public void run(Batch batch) {

        for( Record rec: batch.getRecords() ) {
            annotateHgvs(rec, batch.getCounters());
            annotateClinVar(rec, batch.getCounters());
        }
        log.info(batch.getPatientName()+": annotated "+batch.getRecords().size()+" rows");
    }

    static Enrichment getHgvsState(Record rec) {
        if( StringUtils.isNotEmpty(rec.getVarIncoming().getHgvs()) ) {
            return Enrichment.SATISFIED;
        }
        if( rec.getVarInDb()!=null && StringUtils.isNotEmpty(rec.getVarInDb().getHgvs()) ) {
            return Enrichment.KNOWN_TO_STORE;
        }
        return Enrichment.MUST_FETCH;
    }

    static Enrichment getClinVarState(Record rec) {
        if( rec.getVarIncoming().hasClinVarAnnotation() ) {
            return Enrichment.SATISFIED;
        }
        if( rec.getVarInDb()!=null && rec.getVarInDb().hasClinVarAnnotation() ) {
            return Enrichment.KNOWN_TO_STORE;
        }
        return Enrichment.MUST_FETCH;
    }

    void annotateHgvs(Record rec, Counters counters) {

        Variant var = rec.getVarIncoming();
        Enrichment state = getHgvsState(rec);
        logDebug.debug(rec.getVcfForm()+" HGVS "+state);

        switch( state ) {
            case SATISFIED:
                counters.increment("HGVS_SATISFIED");
                break;

            case KNOWN_TO_STORE:
                var.setHgvs(rec.getVarInDb().getHgvs());
                counters.increment("HGVS_FROM_STORE");
                break;

            case MUST_FETCH:
                try {
                    HgvsResult result = variantValidatorClient.resolve(rec.getVcfForm());
                    var.setHgvs(result.getNomenclature());
                    rec.setHgncId(result.getHgncId());
                    rec.setOmimId(result.getOmimId());
                    logDebug.debug(rec.getVcfForm()+" HGVS "+result.getNomenclature()+" HGNC "+rec.getHgncId()+" OMIM "+rec.getOmimId());
                    counters.increment("HGVS_FETCHED");
                } catch( AnnotationException e ) {
                    log.warn("HGVS not resolved for "+rec.getVcfForm()+": "+e.getMessage());
                    counters.increment("HGVS_FAILED");
                }
                break;
        }
    }

    void annotateClinVar(Record rec, Counters counters) {

        Variant var = rec.getVarIncoming();
        Enrichment state = getClinVarState(rec);
        logDebug.debug(rec.getVcfForm()+" CLINVAR "+state);

        switch( state ) {
            case SATISFIED:
                counters.increment("CLINVAR_SATISFIED");
                break;

            case KNOWN_TO_STORE:
                var.fillClinVarFieldsFrom(rec.getVarInDb());
                counters.increment("CLINVAR_FROM_STORE");
                break;

            case MUST_FETCH:
                fetchClinVar(rec, counters);
                break;
        }
    }

    void fetchClinVar(Record rec, Counters counters) {

        Variant var = rec.getVarIncoming();

        // a known ClinVar id makes the id search unnecessary
        String clinvarId = var.getClinvarId();
        if( StringUtils.isEmpty(clinvarId) && rec.getVarInDb()!=null ) {
            clinvarId = rec.getVarInDb().getClinvarId();
        }

        try {
            if( StringUtils.isNotEmpty(clinvarId) ) {
                JsonNode doc = clinVarClient.fetchSummary(clinvarId);
                clinVarClient.extractAnnotation(clinvarId, doc).fillInto(var);
                counters.increment("CLINVAR_SUMMARY_ONLY");
            }
            else if( StringUtils.isEmpty(var.getHgvs()) ) {
                log.warn("ClinVar lookup skipped for "+rec.getVcfForm()+": no HGVS name");
                counters.increment("CLINVAR_SKIPPED_NO_HGVS");
            }
            else {
                clinVarClient.fetchAnnotation(var.getHgvs()).fillInto(var);
                counters.increment("CLINVAR_FETCHED");
            }
        } catch( AnnotationException e ) {
            log.warn("ClinVar annotation not resolved for "+rec.getVcfForm()+": "+e.getMessage());
            counters.increment("CLINVAR_FAILED");
        }
    }

    public VariantValidatorClient getVariantValidatorClient() {
        return variantValidatorClient;
    }

    public void setVariantValidatorClient(VariantValidatorClient variantValidatorClient) {
        this.variantValidatorClient = variantValidatorClient;
    }

    public ClinVarClient getClinVarClient() {
        return clinVarClient;
    }

    public void setClinVarClient(ClinVarClient clinVarClient) {
        this.clinVarClient = clinVarClient;
    }
}
