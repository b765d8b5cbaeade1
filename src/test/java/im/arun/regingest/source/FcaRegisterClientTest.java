package im.arun.regingest.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.regingest.http.FakeUpstream;
import im.arun.regingest.http.FetchKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class FcaRegisterClientTest {
    private static final String BASE = "https://register.example.org/services/V0.1";
    private static final FetchKey KEY = FetchKey.get(BASE + "/Firm/1");

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path cacheDir;

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    void successMessageCarriesData() throws Exception {
        Optional<FcaResponse> response = FcaRegisterClient.interpret(KEY, json(
                "{\"Status\":\"FSR-API-02-01-00\",\"Message\":\"Ok. Firm Found\",\"Data\":[{\"Organisation Name\":\"Acme\"}]}"));

        assertThat(response).isPresent();
        assertThat(response.get().hasData()).isTrue();
        assertThat(response.get().firstRecord().get().path("Organisation Name").asText()).isEqualTo("Acme");
    }

    @Test
    void notFoundMessageMeansNoDataEvenThoughItContainsFound() throws Exception {
        Optional<FcaResponse> response = FcaRegisterClient.interpret(KEY, json(
                "{\"Status\":\"FSR-API-02-01-11\",\"Message\":\"Firm Not Found\",\"Data\":[{\"x\":1}]}"));

        assertThat(response).isPresent();
        assertThat(response.get().hasData()).isFalse();
        assertThat(response.get().records()).isEmpty();
    }

    @Test
    void otherRegisterCodesArePassedThrough() throws Exception {
        Optional<FcaResponse> response = FcaRegisterClient.interpret(KEY, json(
                "{\"Status\":\"FSR-API-01-01-12\",\"Message\":\"Limit reached\",\"Data\":null}"));

        assertThat(response).get().extracting(FcaResponse::getStatus).isEqualTo("FSR-API-01-01-12");
    }

    @Test
    void foreignStatusIsDiscarded() throws Exception {
        assertThat(FcaRegisterClient.interpret(KEY, json("{\"Status\":\"ERROR\",\"Message\":\"Ok\"}"))).isEmpty();
        assertThat(FcaRegisterClient.interpret(KEY, json("{}"))).isEmpty();
    }

    @Test
    void requestsCarryAuthHeaders() {
        FakeUpstream upstream = new FakeUpstream().json("/Firm/1",
                "{\"Status\":\"FSR-API-02-01-00\",\"Message\":\"Ok. Firm Found\",\"Data\":[{}]}");
        FcaRegisterClient client = new FcaRegisterClient(upstream.rateLimitedCache(cacheDir), BASE + "/",
                "me@example.org", "secret");

        client.get("/Firm/1");

        assertThat(upstream.requests().get(0).header("x-auth-email")).isEqualTo("me@example.org");
        assertThat(upstream.requests().get(0).header("x-auth-key")).isEqualTo("secret");
        assertThat(upstream.requests().get(0).url().encodedPath()).isEqualTo("/services/V0.1/Firm/1");
    }

    @Test
    void httpErrorsGiveNoData() {
        FakeUpstream upstream = new FakeUpstream().status(FakeUpstream.path("/Firm/2"), 403);
        FcaRegisterClient client = new FcaRegisterClient(upstream.rateLimitedCache(cacheDir), BASE, null, null);

        assertThat(client.get("/Firm/2")).isEmpty();
    }

    @Test
    void searchIsTruncatedToMaxHits() {
        FakeUpstream upstream = new FakeUpstream().json(FakeUpstream.path("/Search"), url -> "{"
                + "\"Status\":\"FSR-API-04-01-00\",\"Message\":\"Ok. Search successful\",\"Data\":["
                + "{\"Name\":\"A\",\"Reference Number\":\"1\"},{\"Name\":\"B\",\"Reference Number\":\"2\"},"
                + "{\"Name\":\"C\",\"Reference Number\":\"3\"}]}");
        FcaRegisterClient client = new FcaRegisterClient(upstream.rateLimitedCache(cacheDir), BASE, null, null);

        List<JsonNode> hits = client.search("limited", "firm", 2);

        assertThat(hits).hasSize(2);
        assertThat(upstream.requests().get(0).url().queryParameter("q")).isEqualTo("limited");
        assertThat(upstream.requests().get(0).url().queryParameter("type")).isEqualTo("firm");
    }

    @Test
    void searchWithoutResultsIsEmpty() {
        FakeUpstream upstream = new FakeUpstream().json(FakeUpstream.path("/Search"), url ->
                "{\"Status\":\"FSR-API-04-01-11\",\"Message\":\"No search result found\",\"Data\":null}");
        FcaRegisterClient client = new FcaRegisterClient(upstream.rateLimitedCache(cacheDir), BASE, null, null);

        assertThat(client.search("zzz", "fund", 20)).isEmpty();
    }
}
