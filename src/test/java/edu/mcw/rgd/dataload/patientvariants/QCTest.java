package edu.mcw.rgd.dataload.patientvariants;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class QCTest {

    @TempDir
    Path tempDir;

    private Dao dao;
    private QC qc;

    @BeforeEach
    void setUp() {
        dao = TestDb.dao(tempDir);
        qc = new QC();
        qc.setDao(dao);

        dao.insertPatient("patient1");
        dao.insertGene(new Gene(Gene.UNKNOWN_SYMBOL, null));
        for( String vcfForm: new String[]{"1:100:A:C", "2:200:G:T"} ) {
            Variant var = TestDb.variant(vcfForm);
            var.setGeneSymbol(Gene.UNKNOWN_SYMBOL);
            var.setHgvs("NM_000001.1:c.1A>C");
            dao.insertVariant(var);
            dao.insertLink("patient1", vcfForm);
        }
    }

    private static Batch batch(String patientName, String... vcfForms) {
        Batch batch = new Batch(patientName, new File(patientName+".csv"));
        for( String vcfForm: vcfForms ) {
            Record rec = new Record();
            rec.getVarIncoming().setVcfForm(vcfForm);
            batch.addRecord(rec);
        }
        return batch;
    }

    @Test
    void sameVariantSetIsIdentical() {
        assertThat(qc.isIdenticalToStored(batch("patient1", "2:200:G:T", "1:100:A:C"))).isTrue();
        // duplicates in the file do not change the set
        assertThat(qc.isIdenticalToStored(batch("patient1", "2:200:G:T", "1:100:A:C", "1:100:A:C"))).isTrue();
    }

    @Test
    void differentVariantSetIsNotIdentical() {
        assertThat(qc.isIdenticalToStored(batch("patient1", "1:100:A:C"))).isFalse();
        assertThat(qc.isIdenticalToStored(batch("patient1", "1:100:A:C", "2:200:G:T", "3:300:C:G"))).isFalse();
    }

    @Test
    void unknownPatientIsNotIdentical() {
        assertThat(qc.isIdenticalToStored(batch("patient2", "1:100:A:C", "2:200:G:T"))).isFalse();
        assertThat(qc.isIdenticalToStored(batch("patient2"))).isFalse();
    }

    @Test
    void lookupAttachesStoredVariants() {
        Batch batch = batch("patient2", "1:100:A:C", "3:300:C:G");

        qc.run(batch);

        assertThat(batch.getRecords().get(0).getVarInDb().getHgvs()).isEqualTo("NM_000001.1:c.1A>C");
        assertThat(batch.getRecords().get(1).getVarInDb()).isNull();
        assertThat(batch.getCounters().get("ROWS_IN_DB")).isEqualTo(1);
    }
}
