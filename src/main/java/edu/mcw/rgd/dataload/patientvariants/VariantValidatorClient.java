package edu.mcw.rgd.dataload.patientvariants;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.util.Iterator;
import java.util.Map;

/**
 * @since 10/7/26
 * maps genomic coordinates to transcript-level HGVS nomenclature through the VariantValidator REST API;
 * for a variant like '17:45983420:G:T' it returns the name on the MANE Select transcript, 'NM_001377265.1:c.841G>T'
 */
public class VariantValidatorClient extends RestClient {

    public static final String CDNA_MARKER = "c.";

    Logger log = LogManager.getLogger("annotator");

    private String baseUrl = "https://rest.variantvalidator.org/VariantValidator/variantvalidator";
    private String genomeBuild = "GRCh38";
    private String selectTranscripts = "mane_select";

    @Override
    String getServiceName() {
        return "VariantValidator";
    }

    /**
     * resolve a variant in canonical 'CHROM:POS:REF:ALT' form to HGVS nomenclature;
     * the variant is validated before any request is made
     * @param variantDescription canonical key
     * @return HGVS name, HGNC id and OMIM id; missing ids are returned as 'N/A'
     * @throws InputFormatException if the key is malformed
     * @throws ServiceConnectionException if VariantValidator cannot be reached or replies with garbage
     * @throws TranscriptNotFoundException if the reply has no transcript-level description
     */
    public HgvsResult resolve(String variantDescription) throws AnnotationException {

        VariantKey key = VariantKey.parse(variantDescription);

        URI uri = URI.create(getBaseUrl()+"/"+getGenomeBuild()+"/"+key+"/"+getSelectTranscripts()+"?content-type=application%2Fjson");
        JsonNode summary = getJson(uri);

        // the reply is keyed by HGVS names, next to 'flag' and 'metadata' entries
        Iterator<Map.Entry<String, JsonNode>> it = summary.fields();
        while( it.hasNext() ) {
            Map.Entry<String, JsonNode> entry = it.next();
            if( entry.getKey().contains(CDNA_MARKER) ) {
                return extract(entry.getKey(), entry.getValue());
            }
        }
        throw new TranscriptNotFoundException("No variant data found in VariantValidator response for "+key);
    }

    HgvsResult extract(String hgvsName, JsonNode hgvsRecord) {

        JsonNode geneIds = hgvsRecord.path("gene_ids");

        FieldValue<String> hgncId = FieldValue.text("HGNC ID", geneIds.path("hgnc_id"));
        FieldValue<String> omimId = FieldValue.firstText("OMIM ID", geneIds.path("omim_id"));

        return new HgvsResult(hgvsName, value(hgncId, hgvsName), value(omimId, hgvsName));
    }

    String value(FieldValue<String> field, String hgvsName) {
        if( !field.isPresent() ) {
            log.warn(field.getFieldName()+" "+field.getState().name().toLowerCase()+" in VariantValidator response for "+hgvsName);
        }
        return field.orElse(ClinVarAnnotation.NOT_AVAILABLE);
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setGenomeBuild(String genomeBuild) {
        this.genomeBuild = genomeBuild;
    }

    public String getGenomeBuild() {
        return genomeBuild;
    }

    public void setSelectTranscripts(String selectTranscripts) {
        this.selectTranscripts = selectTranscripts;
    }

    public String getSelectTranscripts() {
        return selectTranscripts;
    }
}
