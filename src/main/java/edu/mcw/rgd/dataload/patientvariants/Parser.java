package edu.mcw.rgd.dataload.patientvariants;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * @since 10/9/26
 * reads a patient variant file into a batch of records;
 * the patient name is the file name without its extension
 */
public class Parser {

    Logger logDebug = LogManager.getLogger("dbg");

    /**
     * columns expected in every variant file, in file order;
     * columns missing from a line are read as null
     */
    public static final String[] COLUMNS = {
        "chromosome", "position", "id", "ref", "alt", "hgvs", "gene_symbol", "cdna_change",
        "clinvar_id", "clinvar_accession", "classification", "num_submissions", "review_status",
        "condition", "clinvar_url"
    };

    public enum FileKind {
        /** comma separated, first line is a header and is skipped */
        CSV,
        /** tab separated, lines starting with '#' are comments */
        VCF;

        CSVFormat getFormat() {
            if( this==CSV ) {
                return CSVFormat.DEFAULT.builder()
                    .setHeader(COLUMNS)
                    .setSkipHeaderRecord(true)
                    .setIgnoreEmptyLines(true)
                    .setTrim(true)
                    .build();
            }
            return CSVFormat.TDF.builder()
                .setHeader(COLUMNS)
                .setCommentMarker('#')
                .setTrim(true)
                .build();
        }
    }

    /**
     * @param file variant file
     * @return file kind, as determined by file extension
     * @throws IllegalArgumentException if the extension is neither '.csv' nor '.vcf'
     */
    public static FileKind getFileKind(File file) {
        String ext = StringUtils.substringAfterLast(file.getName(), ".").toLowerCase();
        switch( ext ) {
            case "csv":
                return FileKind.CSV;
            case "vcf":
                return FileKind.VCF;
            default:
                throw new IllegalArgumentException("unsupported file type: "+file.getName());
        }
    }

    public static boolean isVariantFile(File file) {
        String name = file.getName().toLowerCase();
        return file.isFile() && (name.endsWith(".csv") || name.endsWith(".vcf"));
    }

    public static String getPatientName(File file) {
        String name = file.getName();
        return name.contains(".") ? StringUtils.substringBeforeLast(name, ".") : name;
    }

    /**
     * parse a variant file; every line is turned into a record with its canonical key computed
     * @param file variant file, '.csv' or '.vcf'
     * @return batch of records for the patient named after the file
     * @throws IOException if the file cannot be read
     * @throws InputFormatException if a line lacks chromosome, position, ref or alt
     */
    public Batch parse(File file) throws IOException, InputFormatException {

        Batch batch = new Batch(getPatientName(file), file);
        CSVFormat format = getFileKind(file).getFormat();

        try( Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader) ) {

            for( CSVRecord line: parser ) {
                Record rec = parseLine(line);
                batch.addRecord(rec);
                batch.getCounters().increment("ROWS_LOADED");
                logDebug.debug(batch.getPatientName()+" line "+line.getRecordNumber()+": "+rec.getVcfForm());
            }
        }
        return batch;
    }

    Record parseLine(CSVRecord line) throws InputFormatException {

        Record rec = new Record();
        rec.setChromosome(get(line, "chromosome"));
        rec.setPosition(get(line, "position"));
        rec.setRef(get(line, "ref"));
        rec.setAlt(get(line, "alt"));

        try {
            Variant var = rec.getVarIncoming();
            var.setVcfForm(VariantKey.canonicalKey(rec.getChromosome(), rec.getPosition(), rec.getRef(), rec.getAlt()));
            var.setHgvs(get(line, "hgvs"));
            var.setGeneSymbol(get(line, "gene_symbol"));
            var.setCdnaChange(get(line, "cdna_change"));
            var.setClinvarId(get(line, "clinvar_id"));
            var.setClinvarAccession(get(line, "clinvar_accession"));
            var.setClassification(get(line, "classification"));
            var.setNumRecords(get(line, "num_submissions"));
            var.setReviewStatus(get(line, "review_status"));
            var.setAssociatedCondition(get(line, "condition"));
            var.setClinvarUrl(get(line, "clinvar_url"));
        } catch( InputFormatException e ) {
            throw new InputFormatException("line "+line.getRecordNumber()+": "+e.getMessage());
        }
        return rec;
    }

    static String get(CSVRecord line, String column) {
        return line.isSet(column) ? StringUtils.trimToNull(line.get(column)) : null;
    }
}
