package edu.mcw.rgd.dataload.patientvariants;

import org.apache.commons.lang3.time.DurationFormatUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;
import org.springframework.beans.factory.xml.XmlBeanDefinitionReader;
import org.springframework.core.io.FileSystemResource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * @since 10/10/26
 * loads patient variant files: one file is one patient, processed as one transaction
 */
public class Manager {

    Logger log = LogManager.getLogger("loader");

    private String version;
    private Dao dao;
    private PlatformTransactionManager transactionManager;
    private Parser parser;
    private QC qc;
    private VariantAnnotator annotator;
    private Loader loader;

    private final Counters totals = new Counters();

    public static void main(String[] args) throws Exception {

        DefaultListableBeanFactory bf = new DefaultListableBeanFactory();
        new XmlBeanDefinitionReader(bf).loadBeanDefinitions(new FileSystemResource("properties/AppConfigure.xml"));
        Manager manager = (Manager) (bf.getBean("manager"));

        // parse cmd line parameters
        boolean createTables = false;
        String ingestPath = null;
        String searchType = null;
        String searchValue = null;

        for( int i=0; i<args.length; i++ ) {
            switch (args[i]) {
                case "--createTables":
                    createTables = true;
                    break;
                case "--ingest":
                    ingestPath = getArgValue(args, ++i, "--ingest");
                    break;
                case "--search":
                    searchType = getArgValue(args, ++i, "--search");
                    searchValue = getArgValue(args, ++i, "--search");
                    break;
            }
        }

        try {
            if( createTables ) {
                manager.getDao().createTables();
                manager.log.info("tables created in "+manager.getDao().getConnectionInfo());
            }

            if( ingestPath!=null ) {
                manager.run(new File(ingestPath));
            }

            if( searchType!=null ) {
                VariantSearch search = (VariantSearch) (bf.getBean("search"));
                for( SearchHit hit: search.search(searchType, searchValue) ) {
                    search.log.info(hit.dump("|"));
                }
            }
        } catch(Exception e) {
            manager.log.error("pipeline failed", e);
            throw e;
        }
    }

    static String getArgValue(String[] args, int index, String flag) {
        if( index>=args.length ) {
            throw new IllegalArgumentException("missing value for "+flag);
        }
        return args[index];
    }

    /**
     * ingest a variant file, or all variant files in a directory
     * @param path file or directory
     */
    public void run(File path) throws Exception {

        long time0 = System.currentTimeMillis();

        log.info(getVersion());
        log.info(getDao().getConnectionInfo());

        totals.add("PATIENTS_COUNT_INITIAL", getDao().getRowCount("patients"));
        totals.add("VARIANTS_COUNT_INITIAL", getDao().getRowCount("variants"));

        for( File file: getVariantFiles(path) ) {
            Batch batch = ingestFile(file);
            totals.addAll(batch.getCounters());
        }

        totals.add("PATIENTS_ZCOUNT_FINAL", getDao().getRowCount("patients"));
        totals.add("VARIANTS_ZCOUNT_FINAL", getDao().getRowCount("variants"));

        log.info(totals.dumpAlphabetically());
        log.info("TOTAL ELAPSED TIME "+DurationFormatUtils.formatDuration(System.currentTimeMillis()-time0, "HH:mm:ss"));
    }

    /**
     * @return the file itself, or the variant files in the directory sorted by name
     */
    List<File> getVariantFiles(File path) throws IOException {

        if( !path.exists() ) {
            throw new IOException("no such file or directory: "+path);
        }
        if( !path.isDirectory() ) {
            return List.of(path);
        }

        File[] files = path.listFiles(Parser::isVariantFile);
        List<File> result = new ArrayList<>(files==null ? List.of() : Arrays.asList(files));
        result.sort(null);
        log.info("found "+result.size()+" variant files in "+path);
        return result;
    }

    /**
     * ingest one variant file within one transaction; nothing is written if the patient
     * is already linked to exactly the same variants
     * @param file variant file
     * @return the processed batch, with its counters
     */
    public Batch ingestFile(File file) throws IOException, InputFormatException {

        Batch batch = parser.parse(file);
        log.info("processing "+batch.getSourceFile()+": patient "+batch.getPatientName()+", "+batch.getRecords().size()+" rows");

        TransactionTemplate tx = new TransactionTemplate(getTransactionManager());
        tx.executeWithoutResult(status -> {

            getDao().verifyForeignKeys();

            if( qc.isIdenticalToStored(batch) ) {
                log.info("patient "+batch.getPatientName()+" already has the same variants -- skipped "+batch.getSourceFile().getName());
                batch.getCounters().increment("BATCHES_SKIPPED_IDENTICAL");
                return;
            }

            qc.run(batch);
            annotator.run(batch);
            loader.run(batch);
        });

        batch.getCounters().increment("FILES_PROCESSED");
        return batch;
    }

    public Counters getTotals() {
        return totals;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public Dao getDao() {
        return dao;
    }

    public void setDao(Dao dao) {
        this.dao = dao;
    }

    public PlatformTransactionManager getTransactionManager() {
        return transactionManager;
    }

    public void setTransactionManager(PlatformTransactionManager transactionManager) {
        this.transactionManager = transactionManager;
    }

    public Parser getParser() {
        return parser;
    }

    public void setParser(Parser parser) {
        this.parser = parser;
    }

    public QC getQc() {
        return qc;
    }

    public void setQc(QC qc) {
        this.qc = qc;
    }

    public VariantAnnotator getAnnotator() {
        return annotator;
    }

    public void setAnnotator(VariantAnnotator annotator) {
        this.annotator = annotator;
    }

    public Loader getLoader() {
        return loader;
    }

    public void setLoader(Loader loader) {
        this.loader = loader;
    }
}
