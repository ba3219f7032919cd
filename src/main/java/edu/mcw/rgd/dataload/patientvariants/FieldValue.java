package edu.mcw.rgd.dataload.patientvariants;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @since 10/7/26
 * outcome of extracting a single sub-field from an annotation document:
 * the value is either present, absent, or present but of unexpected shape
 */
public class FieldValue<T> {

    public enum State { PRESENT, ABSENT, MALFORMED }

    private final String fieldName;
    private final State state;
    private final T value;

    private FieldValue(String fieldName, State state, T value) {
        this.fieldName = fieldName;
        this.state = state;
        this.value = value;
    }

    public static <T> FieldValue<T> present(String fieldName, T value) {
        return new FieldValue<>(fieldName, State.PRESENT, value);
    }

    public static <T> FieldValue<T> absent(String fieldName) {
        return new FieldValue<>(fieldName, State.ABSENT, null);
    }

    public static <T> FieldValue<T> malformed(String fieldName) {
        return new FieldValue<>(fieldName, State.MALFORMED, null);
    }

    /**
     * text of a scalar json node; missing, null and empty nodes are absent, containers are malformed
     */
    public static FieldValue<String> text(String fieldName, JsonNode node) {
        if( node==null || node.isMissingNode() || node.isNull() ) {
            return absent(fieldName);
        }
        if( !node.isValueNode() ) {
            return malformed(fieldName);
        }
        String text = node.asText();
        return text.isEmpty() ? absent(fieldName) : present(fieldName, text);
    }

    /**
     * first element of a json array, as text; a scalar in place of the array is malformed
     */
    public static FieldValue<String> firstText(String fieldName, JsonNode node) {
        if( node==null || node.isMissingNode() || node.isNull() ) {
            return absent(fieldName);
        }
        if( !node.isArray() ) {
            return malformed(fieldName);
        }
        if( node.size()==0 ) {
            return absent(fieldName);
        }
        return text(fieldName, node.get(0));
    }

    /**
     * number of elements of a json array
     */
    public static FieldValue<Integer> count(String fieldName, JsonNode node) {
        if( node==null || node.isMissingNode() || node.isNull() ) {
            return absent(fieldName);
        }
        if( !node.isArray() ) {
            return malformed(fieldName);
        }
        return present(fieldName, node.size());
    }

    public boolean isPresent() {
        return state==State.PRESENT;
    }

    public T orElse(T other) {
        return isPresent() ? value : other;
    }

    public String getFieldName() {
        return fieldName;
    }

    public State getState() {
        return state;
    }

    public T getValue() {
        return value;
    }
}
