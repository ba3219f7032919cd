package edu.mcw.rgd.dataload.patientvariants;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * @since 10/10/26
 * case-insensitive search of stored variants by variant, gene symbol, classification or patient
 */
public class VariantSearch {

    Logger log = LogManager.getLogger("search");

    public static final String BY_VARIANT = "variant";
    public static final String BY_GENE_SYMBOL = "gene_symbol";
    public static final String BY_CLASSIFICATION = "classification";
    public static final String BY_PATIENT = "patient";

    private Dao dao;

    /**
     * @param searchType one of 'variant', 'gene_symbol', 'classification', 'patient'
     * @param searchValue value to look for; for 'variant' either an HGVS name or a 'CHROM:POS:REF:ALT' key
     * @return matching variants, each with the patients linked to it
     * @throws SearchFieldEmptyException if search type or search value is empty
     * @throws NoMatchingRecordsException if nothing matches
     * @throws IllegalArgumentException if search type is unknown
     */
    public List<SearchHit> search(String searchType, String searchValue) throws SearchException {

        if( StringUtils.isBlank(searchType) || StringUtils.isBlank(searchValue) ) {
            throw new SearchFieldEmptyException("Search type and search value must not be empty");
        }
        String type = searchType.trim().toLowerCase();
        String value = searchValue.trim();
        log.info("search by "+type+": "+value);

        List<Variant> variants;
        switch( type ) {
            case BY_VARIANT:
                variants = isHgvs(value) ? dao.getVariantsByHgvs(value) : dao.getVariantsByVcfForm(value);
                break;
            case BY_GENE_SYMBOL:
                variants = dao.getVariantsByGeneSymbol(value);
                break;
            case BY_CLASSIFICATION:
                variants = dao.getVariantsByClassification(value);
                break;
            case BY_PATIENT:
                variants = dao.getVariantsForPatient(value);
                break;
            default:
                throw new IllegalArgumentException("unknown search type: "+searchType);
        }

        if( variants.isEmpty() ) {
            throw new NoMatchingRecordsException("No records found for "+type+" '"+value+"'");
        }

        List<SearchHit> hits = new ArrayList<>(variants.size());
        for( Variant v: variants ) {
            hits.add(new SearchHit(v, dao.getPatientsForVariant(v.getVcfForm())));
        }
        log.info("search by "+type+": "+value+" -- "+hits.size()+" variants found");
        return hits;
    }

    static boolean isHgvs(String value) {
        return StringUtils.startsWithAny(value.toUpperCase(), "NM_", "NC_");
    }

    public Dao getDao() {
        return dao;
    }

    public void setDao(Dao dao) {
        this.dao = dao;
    }
}
