package edu.mcw.rgd.dataload.patientvariants;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VariantKeyTest {

    @Nested
    @DisplayName("canonicalKey")
    class CanonicalKey {

        @Test
        void joinsTheFourFields() throws Exception {
            assertThat(VariantKey.canonicalKey("17", "45983420", "G", "T")).isEqualTo("17:45983420:G:T");
        }

        @Test
        void trimsSurroundingWhitespace() throws Exception {
            assertThat(VariantKey.canonicalKey(" X ", "100 ", " A", "C")).isEqualTo("X:100:A:C");
        }

        @Test
        void missingFieldIsReported() {
            assertThatThrownBy(() -> VariantKey.canonicalKey("17", null, "G", "T"))
                .isInstanceOf(InputFormatException.class)
                .hasMessageContaining("position");
            assertThatThrownBy(() -> VariantKey.canonicalKey("17", "45983420", "G", "  "))
                .isInstanceOf(InputFormatException.class)
                .hasMessageContaining("alt");
        }
    }

    @Nested
    @DisplayName("parse")
    class Parse {

        @ParameterizedTest
        @ValueSource(strings = {"1:0:A:C", "22:12345:T:G", "X:1:C:A", "Y:99999999:G:T", "17:45983420:G:T"})
        void acceptsWellFormedKeys(String key) throws Exception {
            assertThat(VariantKey.parse(key).toString()).isEqualTo(key);
        }

        @Test
        void exposesTheFields() throws Exception {
            VariantKey key = VariantKey.parse("17:45983420:G:T");
            assertThat(key.getChromosome()).isEqualTo("17");
            assertThat(key.getPosition()).isEqualTo("45983420");
            assertThat(key.getRef()).isEqualTo("G");
            assertThat(key.getAlt()).isEqualTo("T");
        }

        @ParameterizedTest
        @ValueSource(strings = {"17:45983420:G", "17:45983420:G:T:A", "", "17-45983420-G-T"})
        void rejectsWrongFieldCount(String key) {
            assertThatThrownBy(() -> VariantKey.parse(key))
                .isInstanceOf(InputFormatException.class)
                .hasMessageContaining("Expected 4 colon-separated fields");
        }

        @ParameterizedTest
        @ValueSource(strings = {"0:1:A:C", "23:1:A:C", "chr17:1:A:C", "MT:1:A:C", "x:1:A:C"})
        void rejectsBadChromosome(String key) {
            assertThatThrownBy(() -> VariantKey.parse(key))
                .isInstanceOf(InputFormatException.class)
                .hasMessageContaining("Invalid chromosome");
        }

        @ParameterizedTest
        @ValueSource(strings = {"1:-5:A:C", "1:12a:A:C", "1::A:C", "1:1.5:A:C"})
        void rejectsBadPosition(String key) {
            assertThatThrownBy(() -> VariantKey.parse(key))
                .isInstanceOf(InputFormatException.class)
                .hasMessageContaining("Invalid position");
        }

        @ParameterizedTest
        @ValueSource(strings = {"1:1:N:C", "1:1:AG:C", "1:1:a:C", "1:1::C"})
        void rejectsBadReference(String key) {
            assertThatThrownBy(() -> VariantKey.parse(key))
                .isInstanceOf(InputFormatException.class)
                .hasMessageContaining("Invalid reference base");
        }

        @ParameterizedTest
        @ValueSource(strings = {"1:1:A:-", "1:1:A:CT", "1:1:A:U"})
        void rejectsBadAlternate(String key) {
            assertThatThrownBy(() -> VariantKey.parse(key))
                .isInstanceOf(InputFormatException.class)
                .hasMessageContaining("Invalid alternate base");
        }

        @Test
        void rejectsNull() {
            assertThatThrownBy(() -> VariantKey.parse(null)).isInstanceOf(InputFormatException.class);
        }
    }
}
