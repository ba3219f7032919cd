package edu.mcw.rgd.dataload.patientvariants;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.SqlParameter;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.sql.Types;
import java.util.List;
import java.util.Set;

/**
 * @since 10/8/26
 * wrapper to centralize all code accessing database;
 * all methods join the transaction bound to the current thread, if there is one
 */
public class Dao {

    static final Set<String> TABLES = Set.of("patients", "genes", "variants", "patient_variant");

    static final String VARIANT_COLUMNS = "vcf_form,hgvs,clinvar_id,gene_symbol,classification,cdna_change,"
        +"clinvar_accession,num_records,review_status,associated_condition,clinvar_url";

    Logger logInsertedVariants = LogManager.getLogger("insertedVariants");
    Logger logFilledVariants = LogManager.getLogger("filledVariants");
    Logger logInsertedGenes = LogManager.getLogger("insertedGenes");
    Logger logInsertedLinks = LogManager.getLogger("insertedLinks");

    private DataSource dataSource;
    private JdbcTemplate jdbcTemplate;
    private int queryTimeoutSeconds;

    public String getConnectionInfo() {
        if( dataSource instanceof DriverManagerDataSource ) {
            return "DB: "+((DriverManagerDataSource) dataSource).getUrl();
        }
        return "DB: "+dataSource;
    }

    /**
     * create tables PATIENTS, GENES, VARIANTS and PATIENT_VARIANT, unless they already exist
     */
    public void createTables() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource("schema.sql"));
        populator.execute(getDataSource());
    }

    /**
     * ensure foreign key enforcement is active on the current connection
     * @throws IllegalStateException if foreign keys are not enforced
     */
    public void verifyForeignKeys() {
        Integer enabled = getJdbcTemplate().queryForObject("PRAGMA foreign_keys", Integer.class);
        if( enabled==null || enabled!=1 ) {
            throw new IllegalStateException("foreign key enforcement is not active for "+getConnectionInfo());
        }
    }

    public int getRowCount(String tableName) {
        if( !TABLES.contains(tableName) ) {
            throw new IllegalArgumentException("unknown table "+tableName);
        }
        Integer count = getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM "+tableName, Integer.class);
        return count==null ? 0 : count;
    }

    // =========== PATIENTS =================

    public boolean patientExists(String name) {
        Integer count = getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM patients WHERE name=?", Integer.class, name);
        return count!=null && count>0;
    }

    /**
     * insert patient, unless it is already there
     * @return count of rows affected: 1 or 0
     */
    public int insertPatient(String name) {
        return getJdbcTemplate().update("INSERT OR IGNORE INTO patients (name) VALUES (?)", name);
    }

    // =========== GENES =================

    /**
     * @param geneSymbol gene symbol
     * @return Gene object or null if there is no gene with the given symbol
     */
    public Gene getGene(String geneSymbol) {
        List<Gene> genes = getJdbcTemplate().query("SELECT gene_symbol,gene_url FROM genes WHERE gene_symbol=?",
            (rs, rowNum) -> new Gene(rs.getString("gene_symbol"), rs.getString("gene_url")),
            geneSymbol);
        return genes.isEmpty() ? null : genes.get(0);
    }

    public int insertGene(Gene gene) {
        int rowsAffected = getJdbcTemplate().update("INSERT OR IGNORE INTO genes (gene_symbol,gene_url) VALUES (?,?)",
            gene.getGeneSymbol(), gene.getGeneUrl());
        if( rowsAffected>0 ) {
            logInsertedGenes.debug(gene.dump("|"));
        }
        return rowsAffected;
    }

    // =========== VARIANTS =================

    /**
     * get variant given its canonical key
     * @param vcfForm canonical genomic key, f.e. '17:45983420:G:T'
     * @return Variant object as stored in database, or null if the variant is not in database
     */
    public Variant getVariant(String vcfForm) {
        List<Variant> results = queryVariants("SELECT * FROM variants WHERE vcf_form=?", vcfForm);
        return results.isEmpty() ? null : results.get(0);
    }

    /**
     * insert variant, unless a variant with the same key is already there
     * @return count of rows affected: 1 or 0
     */
    public int insertVariant(Variant var) {
        int rowsAffected = getJdbcTemplate().update("INSERT OR IGNORE INTO variants ("+VARIANT_COLUMNS+") VALUES (?,?,?,?,?,?,?,?,?,?,?)",
            var.getVcfForm(), var.getHgvs(), var.getClinvarId(), var.getGeneSymbol(), var.getClassification(),
            var.getCdnaChange(), var.getClinvarAccession(), var.getNumRecords(), var.getReviewStatus(),
            var.getAssociatedCondition(), var.getClinvarUrl());
        if( rowsAffected>0 ) {
            logInsertedVariants.debug(var.dump("|"));
        }
        return rowsAffected;
    }

    /**
     * fill the null columns of a stored variant with the values of the given variant;
     * populated columns are never overwritten, except for the placeholder gene symbol
     * @return count of rows affected
     */
    public int fillVariant(Variant var) {
        String sql = "UPDATE variants SET "
            +"hgvs=COALESCE(hgvs,?),"
            +"clinvar_id=COALESCE(clinvar_id,?),"
            +"gene_symbol=CASE WHEN gene_symbol IS NULL OR gene_symbol='"+Gene.UNKNOWN_SYMBOL+"' THEN ? ELSE gene_symbol END,"
            +"classification=COALESCE(classification,?),"
            +"cdna_change=COALESCE(cdna_change,?),"
            +"clinvar_accession=COALESCE(clinvar_accession,?),"
            +"num_records=COALESCE(num_records,?),"
            +"review_status=COALESCE(review_status,?),"
            +"associated_condition=COALESCE(associated_condition,?),"
            +"clinvar_url=COALESCE(clinvar_url,?) "
            +"WHERE vcf_form=?";
        int rowsAffected = getJdbcTemplate().update(sql,
            var.getHgvs(), var.getClinvarId(), var.getGeneSymbol(), var.getClassification(),
            var.getCdnaChange(), var.getClinvarAccession(), var.getNumRecords(), var.getReviewStatus(),
            var.getAssociatedCondition(), var.getClinvarUrl(), var.getVcfForm());
        if( rowsAffected>0 ) {
            logFilledVariants.debug(var.dump("|"));
        }
        return rowsAffected;
    }

    public List<Variant> getVariantsByHgvs(String hgvs) {
        return queryVariants("SELECT * FROM variants WHERE LOWER(hgvs)=LOWER(?) ORDER BY vcf_form", hgvs);
    }

    public List<Variant> getVariantsByVcfForm(String vcfForm) {
        return queryVariants("SELECT * FROM variants WHERE UPPER(vcf_form)=UPPER(?) ORDER BY vcf_form", vcfForm);
    }

    public List<Variant> getVariantsByGeneSymbol(String geneSymbol) {
        return queryVariants("SELECT * FROM variants WHERE UPPER(gene_symbol)=UPPER(?) ORDER BY vcf_form", geneSymbol);
    }

    public List<Variant> getVariantsByClassification(String classification) {
        return queryVariants("SELECT * FROM variants WHERE LOWER(classification)=LOWER(?) ORDER BY vcf_form", classification);
    }

    public List<Variant> getVariantsForPatient(String patientName) {
        return queryVariants("SELECT v.* FROM variants v JOIN patient_variant pv ON pv.variant_vcf_form=v.vcf_form "
            +"WHERE LOWER(pv.patient_name)=LOWER(?) ORDER BY v.vcf_form", patientName);
    }

    List<Variant> queryVariants(String sql, String param) {
        VariantQuery q = new VariantQuery(getDataSource(), sql);
        q.declareParameter(new SqlParameter(Types.VARCHAR));
        q.setQueryTimeout(getQueryTimeoutSeconds());
        q.compile();
        return q.execute(param);
    }

    // =========== PATIENT-VARIANT LINKS =================

    public boolean linkExists(String patientName, String vcfForm) {
        Integer count = getJdbcTemplate().queryForObject(
            "SELECT COUNT(*) FROM patient_variant WHERE patient_name=? AND variant_vcf_form=?",
            Integer.class, patientName, vcfForm);
        return count!=null && count>0;
    }

    /**
     * link patient to variant, unless the link is already there
     * @return count of rows affected: 1 or 0
     */
    public int insertLink(String patientName, String vcfForm) {
        int rowsAffected = getJdbcTemplate().update(
            "INSERT OR IGNORE INTO patient_variant (patient_name,variant_vcf_form) VALUES (?,?)",
            patientName, vcfForm);
        if( rowsAffected>0 ) {
            logInsertedLinks.debug(patientName+"|"+vcfForm);
        }
        return rowsAffected;
    }

    /**
     * @return canonical keys of all variants linked to the patient
     */
    public List<String> getVariantKeysForPatient(String patientName) {
        return getJdbcTemplate().queryForList(
            "SELECT variant_vcf_form FROM patient_variant WHERE patient_name=? ORDER BY variant_vcf_form",
            String.class, patientName);
    }

    public List<String> getPatientsForVariant(String vcfForm) {
        return getJdbcTemplate().queryForList(
            "SELECT patient_name FROM patient_variant WHERE variant_vcf_form=? ORDER BY patient_name",
            String.class, vcfForm);
    }

    synchronized JdbcTemplate getJdbcTemplate() {
        if( jdbcTemplate==null ) {
            jdbcTemplate = new JdbcTemplate(getDataSource());
            jdbcTemplate.setQueryTimeout(getQueryTimeoutSeconds());
        }
        return jdbcTemplate;
    }

    public void setDataSource(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    public int getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }
}
