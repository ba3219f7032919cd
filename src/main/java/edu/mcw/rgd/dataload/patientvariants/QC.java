package edu.mcw.rgd.dataload.patientvariants;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Set;
import java.util.TreeSet;

/**
 * @since 10/9/26
 * qc incoming batch against database
 */
public class QC {

    Logger logDebug = LogManager.getLogger("dbg");

    private Dao dao;

    public Dao getDao() {
        return dao;
    }

    public void setDao(Dao dao) {
        this.dao = dao;
    }

    /**
     * @return true if the patient is already in database and linked to exactly the same set of variants as in the batch
     */
    public boolean isIdenticalToStored(Batch batch) {

        if( !dao.patientExists(batch.getPatientName()) ) {
            return false;
        }
        Set<String> vcfFormsInDb = new TreeSet<>(dao.getVariantKeysForPatient(batch.getPatientName()));
        return vcfFormsInDb.equals(batch.getVcfForms());
    }

    /**
     * look up every incoming variant in database
     */
    public void run(Batch batch) {

        for( Record rec: batch.getRecords() ) {
            Variant var = dao.getVariant(rec.getVcfForm());
            rec.setVarInDb(var);

            if( var!=null ) {
                batch.getCounters().increment("ROWS_IN_DB");
                logDebug.debug("in db: "+var.dump("|"));
            }
        }
    }
}
