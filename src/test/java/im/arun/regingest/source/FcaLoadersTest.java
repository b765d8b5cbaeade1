package im.arun.regingest.source;

import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.regingest.exception.IngestException;
import im.arun.regingest.http.FakeUpstream;
import im.arun.regingest.index.BulkIndexer;
import im.arun.regingest.index.InMemorySearchStore;
import im.arun.regingest.model.Product;
import im.arun.regingest.pagination.ProgressReporter;
import im.arun.regingest.util.ExecutorProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FcaLoadersTest {
    private static final String BASE = "https://register.example.org/services/V0.1";

    @TempDir
    Path cacheDir;

    private ExecutorService executor;
    private InMemorySearchStore store;
    private BulkIndexer indexer;

    @BeforeEach
    void setUp() {
        executor = ExecutorProvider.newWorkerPool("fca-test-");
        store = new InMemorySearchStore();
        indexer = new BulkIndexer(store, 0, 0);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static String ok(String data) {
        return "{\"Status\":\"FSR-API-02-01-00\",\"Message\":\"Ok. Found\",\"Data\":" + data + "}";
    }

    private static String search(String data) {
        return "{\"Status\":\"FSR-API-04-01-00\",\"Message\":\"Ok. Search successful\",\"Data\":" + data + "}";
    }

    private FcaRegisterClient client(FakeUpstream upstream) {
        return new FcaRegisterClient(upstream.rateLimitedCache(cacheDir), BASE, "me@example.org", "key");
    }

    private static FakeUpstream firmRegister() {
        return new FakeUpstream()
                .json(FakeUpstream.path("/Search"), url -> "limited".equals(url.queryParameter("q"))
                        ? search("[{\"Name\":\"Acme Ltd\",\"Reference Number\":\"100\"},"
                                + "{\"Name\":\"Gone Ltd\",\"Reference Number\":\"200\"}]")
                        : search("[{\"Name\":\"Acme Ltd\",\"Reference Number\":\"100\"}]"))
                .json("/Firm/100", ok("[{\"Organisation Name\":\"Acme Ltd\",\"Status\":\"Authorised\","
                        + "\"Business Type\":\"Regulated\"}]"))
                .json("/Firm/100/Names", ok("[{\"Current Names\":[{\"Name\":\"Acme Pay\"}]}]"))
                .json("/Firm/100/Address", ok("[{\"Address Type\":\"Principal Place of Business\","
                        + "\"Address Line 1\":\"1 High St\",\"Town\":\"London\"}]"))
                .json("/Firm/100/Permissions", ok("{\"Accepting Deposits\":[]}"))
                .json("/Firm/100/Individuals", ok("[{\"Name\":\"Jo Bloggs\",\"IRN\":\"JXB01\"}]"))
                .json("/Firm/100/DisciplinaryHistory", ok("[{\"TypeofAction\":\"Fine\","
                        + "\"TypeofDescription\":\"Fined for systems failings\"}]"))
                .json("/Firm/200", "{\"Status\":\"FSR-API-02-01-11\",\"Message\":\"Firm Not Found\",\"Data\":null}");
    }

    private FcaFirmLoader firmLoader(FakeUpstream upstream, List<String> knownFrns) {
        return new FcaFirmLoader(client(upstream), indexer, executor, ProgressReporter.NONE,
                List.of("limited", "ltd"), knownFrns, 20, 500, 3, 6, Clock.systemUTC());
    }

    @Test
    void firmsAreDiscoveredOnceAndAssembledFromSubResources() {
        FakeUpstream upstream = firmRegister();

        LoadReport report = firmLoader(upstream, List.of()).load(DateRange.none());

        assertThat(report.getIndexed()).isEqualTo(1);
        assertThat(report.getFailedRecords()).isZero();
        ObjectNode firm = store.get("authorised_firms", "firm_100").orElseThrow();
        assertThat(firm.path("firm_name").asText()).isEqualTo("Acme Ltd");
        assertThat(firm.path("trading_names").get(0).asText()).isEqualTo("Acme Pay");
        assertThat(firm.path("city").asText()).isEqualTo("London");
        assertThat(firm.path("permissions").get(0).asText()).isEqualTo("Accepting Deposits");
        assertThat(firm.path("key_individuals").get(0).asText()).isEqualTo("Jo Bloggs");
        assertThat(firm.path("disciplinary_history").get(0).asText()).isEqualTo("Fine: Fined for systems failings");
        assertThat(firm.path("search_term").asText()).isEqualTo("limited");
        assertThat(firm.path("register_url").asText()).endsWith("id=100");
        assertThat(upstream.callCount(FakeUpstream.path("/Firm/100"))).isEqualTo(1);
    }

    @Test
    void knownFrnsAreLoadedEvenWithoutSearchHits() {
        FakeUpstream upstream = firmRegister()
                .json("/Firm/615820", ok("[{\"Organisation Name\":\"Known Firm\"}]"));

        firmLoader(upstream, List.of("615820")).load(DateRange.none());

        assertThat(store.get("authorised_firms", "firm_615820")).isPresent();
        assertThat(store.get("authorised_firms", "firm_615820").get().path("trading_names")).isEmpty();
    }

    @Test
    void firmsAreCappedAtTheConfiguredMaximum() {
        FakeUpstream upstream = firmRegister();
        FcaFirmLoader loader = new FcaFirmLoader(client(upstream), indexer, executor, ProgressReporter.NONE,
                List.of("limited"), List.of(), 20, 1, 3, 6, Clock.systemUTC());

        assertThat(loader.discoverItems()).extracting(RegisterHit::getReference).containsExactly("100");
    }

    @Test
    void individualsOfSeveralFirmsAreMerged() {
        FakeUpstream upstream = new FakeUpstream()
                .json("/Firm/1/Individuals", ok("[{\"Name\":\"Jo Bloggs\",\"IRN\":\"JXB01\"}]"))
                .json("/Firm/2/Individuals", ok("[{\"Name\":\"Jo Bloggs\",\"IRN\":\"JXB01\"},"
                        + "{\"Name\":\"Sam Smith\",\"IRN\":\"SXS02\"}]"))
                .json("/Individuals/JXB01", ok("[{\"Details\":{\"Full Name\":\"Joanne Bloggs\","
                        + "\"Commonly Used Name\":\"Jo\",\"Status\":\"Approved by regulator\"}}]"))
                .json("/Individuals/JXB01/CF", ok("[{\"Current\":{\"SMF1 Chief Executive\":"
                        + "{\"Firm Name\":\"Acme Ltd\",\"Effective Date\":\"2020-01-01\"}}}]"))
                .json("/Individuals/SXS02", ok("[{\"Details\":{\"Full Name\":\"Sam Smith\"}}]"));
        FcaIndividualLoader loader = new FcaIndividualLoader(client(upstream), indexer, executor,
                ProgressReporter.NONE, List.of("1", "2"), 3, 6, Clock.systemUTC());

        LoadReport report = loader.load(DateRange.none());

        assertThat(report.getIndexed()).isEqualTo(2);
        ObjectNode jo = store.get("individuals", "individual_JXB01").orElseThrow();
        assertThat(jo.path("full_name").asText()).isEqualTo("Joanne Bloggs");
        assertThat(jo.path("firm_reference_numbers")).hasSize(2);
        assertThat(jo.path("current_roles").get(0).path("role").asText()).isEqualTo("SMF1 Chief Executive");
        assertThat(upstream.callCount(FakeUpstream.path("/Individuals/JXB01"))).isEqualTo(1);
    }

    @Test
    void productsUseTheSearchHitName() {
        FakeUpstream upstream = new FakeUpstream()
                .json(FakeUpstream.path("/Search"), url -> search(
                        "[{\"Name\":\"Acme Growth Fund\",\"Reference Number\":\"P1\"}]"))
                .json("/CIS/P1", ok("[{\"Operator Name\":\"Acme Funds\",\"Scheme Type\":\"UCITS\"}]"))
                .json("/CIS/P1/Subfund", ok("[{\"Name\":\"Acme Growth Acc\",\"Sub-Fund Type\":\"UCITS\"}]"))
                .json("/CIS/P1/Names", ok("[{\"Product Other Name\":\"Acme Growth\",\"Effective From\":\"2019\"}]"));
        FcaProductLoader loader = new FcaProductLoader(client(upstream), indexer, executor, ProgressReporter.NONE,
                List.of("fund", "growth"), 20, 100, 3, 6, Clock.systemUTC());

        LoadReport report = loader.load(DateRange.none());

        assertThat(report.getIndexed()).isEqualTo(1);
        ObjectNode product = store.get("products", "product_P1").orElseThrow();
        assertThat(product.path("product_name").asText()).isEqualTo("Acme Growth Fund");
        assertThat(product.path("operator_name").asText()).isEqualTo("Acme Funds");
        assertThat(product.path("subfunds")).hasSize(1);
        assertThat(product.path("other_names")).hasSize(1);
        assertThat(upstream.requests().get(0).url().queryParameter("type")).isEqualTo("fund");
    }

    @Test
    void everyItemFailingFailsTheRun() {
        FakeUpstream upstream = new FakeUpstream()
                .json(FakeUpstream.path("/Search"), url -> search("[{\"Name\":\"Acme\",\"Reference Number\":\"P1\"}]"));
        FcaProductLoader loader = new FcaProductLoader(client(upstream), indexer, executor, ProgressReporter.NONE,
                List.of("fund"), 20, 100, 3, 6, Clock.systemUTC()) {
            @Override
            protected Optional<Product> assemble(RegisterHit hit) {
                throw new IllegalStateException("register unavailable");
            }
        };

        assertThatThrownBy(() -> loader.load(DateRange.none())).isInstanceOf(IngestException.class);
    }
}
