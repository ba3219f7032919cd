package edu.mcw.rgd.dataload.patientvariants;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * @since 10/6/26
 * all variant rows read from one file, attributed to one patient;
 * the unit of work for QC, annotator and loader, and the scope of one database transaction
 */
public class Batch {

    private final String patientName;
    private final File sourceFile;
    private final List<Record> records = new ArrayList<>();
    private final Counters counters = new Counters();

    public Batch(String patientName, File sourceFile) {
        this.patientName = patientName;
        this.sourceFile = sourceFile;
    }

    public void addRecord(Record rec) {
        records.add(rec);
    }

    /**
     * @return canonical keys of all variants in the batch
     */
    public Set<String> getVcfForms() {
        Set<String> vcfForms = new TreeSet<>();
        for( Record rec: records ) {
            vcfForms.add(rec.getVcfForm());
        }
        return vcfForms;
    }

    public String getPatientName() {
        return patientName;
    }

    public File getSourceFile() {
        return sourceFile;
    }

    public List<Record> getRecords() {
        return records;
    }

    public Counters getCounters() {
        return counters;
    }
}
