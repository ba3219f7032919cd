package edu.mcw.rgd.dataload.patientvariants;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VariantValidatorClientTest {

    private StubServer server;
    private VariantValidatorClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubServer();
        client = new VariantValidatorClient();
        client.setBaseUrl(server.getBaseUrl()+"/VariantValidator/variantvalidator");
        client.setTimeoutSeconds(2);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("resolves a genomic key to transcript HGVS with gene ids")
    void resolvesHgvs() throws Exception {
        server.route("/GRCh38/17:45983420:G:T/mane_select", "vv_17_45983420_G_T.json");

        HgvsResult result = client.resolve("17:45983420:G:T");

        assertThat(result.getNomenclature()).isEqualTo("NM_001377265.1:c.841G>T");
        assertThat(result.getHgncId()).isEqualTo("HGNC:6893");
        assertThat(result.getOmimId()).isEqualTo("157140");
        assertThat(server.getRequests()).singleElement(InstanceOfAssertFactories.STRING)
            .contains("/VariantValidator/variantvalidator/GRCh38/17:45983420:G:T/mane_select");
    }

    @Test
    void missingGeneIdsDegradeToNotAvailable() throws Exception {
        server.route("/13:32316455:T:A/", "vv_no_gene_ids.json");

        HgvsResult result = client.resolve("13:32316455:T:A");

        assertThat(result.getNomenclature()).isEqualTo("NM_000059.4:c.68-7T>A");
        assertThat(result.getHgncId()).isEqualTo("N/A");
        // omim id given as a scalar instead of a list
        assertThat(result.getOmimId()).isEqualTo("N/A");
    }

    @Test
    void replyWithoutTranscriptIsNotFound() throws Exception {
        server.route("/1:100:A:C/", "vv_no_transcript.json");

        assertThatThrownBy(() -> client.resolve("1:100:A:C"))
            .isInstanceOf(TranscriptNotFoundException.class)
            .isInstanceOf(RecordNotFoundException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"17:45983420:G", "chr17:45983420:G:T", "17:-1:G:T", "17:45983420:N:T", "17:45983420:G:TT"})
    void malformedKeyFailsWithoutRequest(String key) {
        assertThatThrownBy(() -> client.resolve(key)).isInstanceOf(InputFormatException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void serverErrorIsConnectionFailure() {
        server.route("/GRCh38/", 500, "{\"message\":\"internal error\"}");

        assertThatThrownBy(() -> client.resolve("17:45983420:G:T"))
            .isInstanceOf(ServiceConnectionException.class)
            .hasMessageContaining("500");
    }

    @Test
    void unparseableBodyIsConnectionFailure() {
        server.route("/GRCh38/", 200, "<html>maintenance</html>");

        assertThatThrownBy(() -> client.resolve("17:45983420:G:T"))
            .isInstanceOf(ServiceConnectionException.class);
    }

    @Test
    void slowServerTimesOut() throws Exception {
        server.route("/GRCh38/", "vv_17_45983420_G_T.json");
        server.setDelayMs(3000);
        client.setTimeoutSeconds(1);

        assertThatThrownBy(() -> client.resolve("17:45983420:G:T"))
            .isInstanceOf(ServiceConnectionException.class);
    }

    @Test
    void stalledBodyTimesOut() throws Exception {
        server.route("/GRCh38/", "vv_17_45983420_G_T.json");
        server.setStallAfterHeadersMs(8000);
        client.setTimeoutSeconds(1);

        long t0 = System.nanoTime();
        assertThatThrownBy(() -> client.resolve("17:45983420:G:T"))
            .isInstanceOf(ServiceConnectionException.class)
            .hasMessageContaining("did not reply within 1 s");
        assertThat((System.nanoTime()-t0)/1_000_000).isLessThan(3000);
    }

    @Test
    void emptyBodyIsConnectionFailure() {
        server.route("/GRCh38/", 200, "");

        assertThatThrownBy(() -> client.resolve("17:45983420:G:T"))
            .isInstanceOf(ServiceConnectionException.class)
            .isNotInstanceOf(RecordNotFoundException.class)
            .hasMessageContaining("empty response");
    }

    @Test
    void unreachableServiceIsConnectionFailure() {
        client.setBaseUrl("http://127.0.0.1:1/VariantValidator/variantvalidator");

        assertThatThrownBy(() -> client.resolve("17:45983420:G:T"))
            .isInstanceOf(ServiceConnectionException.class)
            .isNotInstanceOf(RecordNotFoundException.class);
    }

    @Test
    void callsAreThrottled() throws Exception {
        server.route("/GRCh38/", "vv_17_45983420_G_T.json");
        client.setDelayMs(300);

        long t0 = System.nanoTime();
        client.resolve("17:45983420:G:T");
        client.resolve("17:45983420:G:T");
        long elapsedMs = (System.nanoTime()-t0)/1_000_000;

        assertThat(elapsedMs).isGreaterThanOrEqualTo(300);
        assertThat(client.getThrottle().getCallCount()).isEqualTo(2);
    }
}
