package edu.mcw.rgd.dataload.patientvariants;

import org.springframework.jdbc.object.MappingSqlQuery;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * @since 10/8/26
 * maps rows of VARIANTS table to Variant objects
 */
public class VariantQuery extends MappingSqlQuery<Variant> {

    public VariantQuery(DataSource ds, String query) {
        super(ds, query);
    }

    @Override
    protected Variant mapRow(ResultSet rs, int rowNum) throws SQLException {

        Variant obj = new Variant();
        obj.setVcfForm(rs.getString("vcf_form"));
        obj.setHgvs(rs.getString("hgvs"));
        obj.setClinvarId(rs.getString("clinvar_id"));
        obj.setGeneSymbol(rs.getString("gene_symbol"));
        obj.setClassification(rs.getString("classification"));
        obj.setCdnaChange(rs.getString("cdna_change"));
        obj.setClinvarAccession(rs.getString("clinvar_accession"));
        obj.setNumRecords(rs.getString("num_records"));
        obj.setReviewStatus(rs.getString("review_status"));
        obj.setAssociatedCondition(rs.getString("associated_condition"));
        obj.setClinvarUrl(rs.getString("clinvar_url"));
        return obj;
    }
}
