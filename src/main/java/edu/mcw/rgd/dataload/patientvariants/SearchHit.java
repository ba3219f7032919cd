package edu.mcw.rgd.dataload.patientvariants;

import java.util.List;

/**
 * @since 10/10/26
 * stored variant together with the names of all patients linked to it
 */
public class SearchHit {

    private final Variant variant;
    private final List<String> patientNames;

    public SearchHit(Variant variant, List<String> patientNames) {
        this.variant = variant;
        this.patientNames = patientNames;
    }

    public String dump(String delimiter) {
        return variant.dump(delimiter) + delimiter + String.join(",", patientNames);
    }

    public Variant getVariant() {
        return variant;
    }

    public List<String> getPatientNames() {
        return patientNames;
    }
}
