package edu.mcw.rgd.dataload.patientvariants;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * @since 10/7/26
 * queries ClinVar through NCBI E-utilities:
 * <ol>
 * <li>ESearch: HGVS name, f.e. 'NM_001377265.1:c.841G>T', to ClinVar variation id, f.e. '578075'</li>
 * <li>ESummary: ClinVar variation id to the summary document</li>
 * </ol>
 * both steps are available separately, so a known ClinVar id does not have to be searched again
 */
public class ClinVarClient extends RestClient {

    public static final String TRANSCRIPT_PREFIX = "NM_";

    Logger log = LogManager.getLogger("annotator");

    private String baseUrl = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils";
    private String recordUrlPrefix = "https://www.ncbi.nlm.nih.gov/clinvar/variation/";
    private String email;
    private String tool;
    private String apiKey;

    @Override
    String getServiceName() {
        return "NCBI ClinVar";
    }

    /**
     * validate HGVS name: it must start with transcript accession 'NM_' and contain ':' and 'c.'
     * @throws InputFormatException if the name is not in transcript HGVS format
     */
    public static void validateHgvs(String hgvsVariant) throws InputFormatException {
        if( hgvsVariant==null
            || !hgvsVariant.startsWith(TRANSCRIPT_PREFIX)
            || !hgvsVariant.contains(":")
            || !hgvsVariant.contains(VariantValidatorClient.CDNA_MARKER) ) {

            throw new InputFormatException("Invalid HGVS format: "+hgvsVariant+". "
                +"Expected transcript HGVS e.g. 'NM_001377265.1:c.841G>T'.");
        }
    }

    /**
     * search ClinVar for the variation id of a variant given in HGVS notation
     * @param hgvsVariant HGVS name, f.e. 'NM_001377265.1:c.841G>T'
     * @return first ClinVar variation id found
     * @throws InputFormatException if the HGVS name is malformed; no request is made then
     * @throws ServiceConnectionException if ESearch cannot be performed
     * @throws RecordNotFoundException if ClinVar has no record for the variant
     */
    public String fetchClinVarId(String hgvsVariant) throws AnnotationException {

        validateHgvs(hgvsVariant);
        log.info("Fetching ClinVar ID for the variant: "+hgvsVariant);

        URI uri = URI.create(getBaseUrl()+"/esearch.fcgi?db=clinvar&retmode=json&term="+encode(hgvsVariant)+getIdentityParams());
        JsonNode reply = getJson(uri);

        JsonNode searchResult = reply.path("esearchresult");
        if( !searchResult.isObject() ) {
            throw new ServiceConnectionException("ClinVar ESearch response did not contain 'esearchresult' for "+hgvsVariant);
        }

        FieldValue<String> clinvarId = FieldValue.firstText("IdList", searchResult.path("idlist"));
        if( !clinvarId.isPresent() ) {
            throw new RecordNotFoundException("Variant '"+hgvsVariant+"' not found in ClinVar.");
        }
        return clinvarId.getValue();
    }

    /**
     * fetch ClinVar ESummary document for a ClinVar variation id
     * @param clinvarId ClinVar variation id, f.e. '578075'
     * @return the document summary for the id
     * @throws InputFormatException if the id is not numeric; no request is made then
     * @throws ServiceConnectionException if ESummary cannot be performed
     * @throws RecordNotFoundException if the response does not carry a document for the id
     */
    public JsonNode fetchSummary(String clinvarId) throws AnnotationException {

        if( clinvarId==null || !clinvarId.matches("[0-9]+") ) {
            throw new InputFormatException("Invalid ClinVar ID: "+clinvarId+". Expected a numeric variation id.");
        }
        log.info("Fetching ClinVar ESummary for the ClinVar ID: "+clinvarId);

        URI uri = URI.create(getBaseUrl()+"/esummary.fcgi?db=clinvar&retmode=json&id="+clinvarId+getIdentityParams());
        JsonNode reply = getJson(uri);

        JsonNode doc = reply.path("result").path(clinvarId);
        if( !doc.isObject() || doc.has("error") ) {
            throw new RecordNotFoundException("ClinVar ESummary response did not contain a document for ClinVar ID "+clinvarId);
        }
        return doc;
    }

    /**
     * extract the annotation fields from an ESummary document;
     * every field is extracted independently, a missing one is set to 'N/A'
     * @param clinvarId ClinVar variation id the document belongs to
     * @param doc ESummary document
     * @return ClinVar annotation
     */
    public ClinVarAnnotation extractAnnotation(String clinvarId, JsonNode doc) {

        JsonNode classification = doc.path("germline_classification");

        ClinVarAnnotation info = new ClinVarAnnotation();
        info.setClinvarId(clinvarId);
        info.setGeneSymbol(value(FieldValue.text("gene symbol", doc.path("genes").path(0).path("symbol")), clinvarId));
        info.setCdnaChange(value(FieldValue.text("cDNA change", doc.path("variation_set").path(0).path("cdna_change")), clinvarId));
        info.setAccession(value(FieldValue.text("ClinVar accession", doc.path("accession")), clinvarId));
        info.setClassification(value(FieldValue.text("consensus classification", classification.path("description")), clinvarId));
        info.setReviewStatus(value(FieldValue.text("review status", classification.path("review_status")), clinvarId));
        info.setAssociatedCondition(value(FieldValue.text("associated condition", classification.path("trait_set").path(0).path("trait_name")), clinvarId));

        info.setNumRecords(value(FieldValue.count("number of submitted records", doc.path("supporting_submissions").path("scv")), clinvarId));

        info.setRecordUrl(getRecordUrl(clinvarId));
        return info;
    }

    /**
     * resolve HGVS name to ClinVar id, fetch its summary and extract the annotation
     * @param hgvsVariant HGVS name, f.e. 'NM_001377265.1:c.841G>T'
     * @return ClinVar annotation, including the record url
     * @throws AnnotationException on any failure of the two steps
     */
    public ClinVarAnnotation fetchAnnotation(String hgvsVariant) throws AnnotationException {

        validateHgvs(hgvsVariant);
        log.info("Fetching ClinVar annotation for the variant: "+hgvsVariant);

        String clinvarId = fetchClinVarId(hgvsVariant);
        JsonNode doc = fetchSummary(clinvarId);
        return extractAnnotation(clinvarId, doc);
    }

    public String getRecordUrl(String clinvarId) {
        return getRecordUrlPrefix()+clinvarId;
    }

    <T> String value(FieldValue<T> field, String clinvarId) {
        if( !field.isPresent() ) {
            log.warn(StringUtils.capitalize(field.getFieldName())+" "+field.getState().name().toLowerCase()
                +" in ClinVar ESummary for ClinVar ID "+clinvarId);
            return ClinVarAnnotation.NOT_AVAILABLE;
        }
        return String.valueOf(field.getValue());
    }

    String getIdentityParams() {
        StringBuilder buf = new StringBuilder();
        if( StringUtils.isNotBlank(getEmail()) ) {
            buf.append("&email=").append(encode(getEmail()));
        }
        if( StringUtils.isNotBlank(getTool()) ) {
            buf.append("&tool=").append(encode(getTool()));
        }
        if( StringUtils.isNotBlank(getApiKey()) ) {
            buf.append("&api_key=").append(encode(getApiKey()));
        }
        return buf.toString();
    }

    static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setRecordUrlPrefix(String recordUrlPrefix) {
        this.recordUrlPrefix = recordUrlPrefix;
    }

    public String getRecordUrlPrefix() {
        return recordUrlPrefix;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getEmail() {
        return email;
    }

    public void setTool(String tool) {
        this.tool = tool;
    }

    public String getTool() {
        return tool;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getApiKey() {
        return apiKey;
    }
}
