package edu.mcw.rgd.dataload.patientvariants;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DaoTest {

    @TempDir
    Path tempDir;

    private Dao dao;

    @BeforeEach
    void setUp() {
        dao = TestDb.dao(tempDir);
    }

    @Test
    void createTablesCanBeRepeated() {
        dao.insertPatient("patient1");
        dao.createTables();

        assertThat(dao.getRowCount("patients")).isEqualTo(1);
        assertThat(dao.getRowCount("patient_variant")).isZero();
    }

    @Test
    void foreignKeysAreEnforced() {
        dao.verifyForeignKeys();

        assertThatThrownBy(() -> dao.insertLink("nobody", "1:1:A:C")).isInstanceOf(DataAccessException.class);

        Variant var = TestDb.variant("1:1:A:C");
        var.setGeneSymbol("NO_SUCH_GENE");
        assertThatThrownBy(() -> dao.insertVariant(var)).isInstanceOf(DataAccessException.class);
    }

    @Test
    void connectionWithoutForeignKeysIsRejected() {
        Dao plain = new Dao();
        plain.setDataSource(new DriverManagerDataSource("jdbc:sqlite:"+tempDir.resolve("plain.db")));

        assertThatThrownBy(plain::verifyForeignKeys).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void insertsAreIgnoredWhenRowExists() {
        assertThat(dao.insertPatient("patient1")).isEqualTo(1);
        assertThat(dao.insertPatient("patient1")).isZero();
        assertThat(dao.patientExists("patient1")).isTrue();
        assertThat(dao.patientExists("patient2")).isFalse();

        assertThat(dao.insertGene(new Gene(Gene.UNKNOWN_SYMBOL, null))).isEqualTo(1);
        assertThat(dao.insertGene(new Gene(Gene.UNKNOWN_SYMBOL, null))).isZero();

        Variant var = TestDb.variant("1:1:A:C");
        var.setGeneSymbol(Gene.UNKNOWN_SYMBOL);
        assertThat(dao.insertVariant(var)).isEqualTo(1);
        assertThat(dao.insertVariant(var)).isZero();

        assertThat(dao.insertLink("patient1", "1:1:A:C")).isEqualTo(1);
        assertThat(dao.insertLink("patient1", "1:1:A:C")).isZero();
        assertThat(dao.linkExists("patient1", "1:1:A:C")).isTrue();
        assertThat(dao.getVariantKeysForPatient("patient1")).containsExactly("1:1:A:C");
        assertThat(dao.getPatientsForVariant("1:1:A:C")).containsExactly("patient1");
    }

    @Test
    void absentVariantIsNull() {
        assertThat(dao.getVariant("1:1:A:C")).isNull();
        assertThat(dao.getGene("MAPT")).isNull();
    }

    @Test
    void fillVariantOnlyFillsEmptyColumns() {
        dao.insertGene(new Gene(Gene.UNKNOWN_SYMBOL, null));
        dao.insertGene(new Gene("MAPT", Gene.HGNC_REPORT_URL+"HGNC:6893"));

        Variant stored = TestDb.variant("17:45983420:G:T");
        stored.setGeneSymbol(Gene.UNKNOWN_SYMBOL);
        stored.setClassification("Likely benign");
        dao.insertVariant(stored);

        Variant incoming = TestDb.variant("17:45983420:G:T");
        incoming.setHgvs("NM_001377265.1:c.841G>T");
        incoming.setGeneSymbol("MAPT");
        incoming.setClassification("Uncertain significance");
        incoming.setClinvarId("578075");
        assertThat(dao.fillVariant(incoming)).isEqualTo(1);

        Variant v = dao.getVariant("17:45983420:G:T");
        assertThat(v.getHgvs()).isEqualTo("NM_001377265.1:c.841G>T");
        assertThat(v.getClinvarId()).isEqualTo("578075");
        assertThat(v.getGeneSymbol()).isEqualTo("MAPT");
        assertThat(v.getClassification()).isEqualTo("Likely benign");
        assertThat(dao.getGene("MAPT").getGeneUrl()).endsWith("HGNC:6893");
    }

    @Test
    void fillingAnAbsentVariantChangesNothing() {
        Variant incoming = TestDb.variant("9:900:T:C");
        incoming.setClassification("Benign");

        assertThat(dao.fillVariant(incoming)).isZero();
        assertThat(dao.getVariant("9:900:T:C")).isNull();
    }

    @Test
    void resolvedGeneSymbolIsNeverReplaced() {
        dao.insertGene(new Gene("MAPT", null));
        dao.insertGene(new Gene(Gene.UNKNOWN_SYMBOL, null));
        Variant stored = TestDb.variant("17:45983420:G:T");
        stored.setGeneSymbol("MAPT");
        dao.insertVariant(stored);

        Variant incoming = TestDb.variant("17:45983420:G:T");
        incoming.setGeneSymbol(Gene.UNKNOWN_SYMBOL);
        dao.fillVariant(incoming);

        assertThat(dao.getVariant("17:45983420:G:T").getGeneSymbol()).isEqualTo("MAPT");
    }

    @Test
    void rowCountRejectsUnknownTable() {
        assertThatThrownBy(() -> dao.getRowCount("sqlite_master")).isInstanceOf(IllegalArgumentException.class);
    }
}
