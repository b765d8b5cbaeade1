package im.arun.regingest.source;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.regingest.index.BulkIndexer;
import im.arun.regingest.model.Product;
import im.arun.regingest.pagination.ProgressReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Loads collective investment schemes found by register search.
 */
public class FcaProductLoader extends AggregateSourceLoader<RegisterHit, Product> {
    private static final Logger logger = LoggerFactory.getLogger(FcaProductLoader.class);

    private final FcaRegisterClient client;
    private final List<String> searchTerms;
    private final int maxHitsPerTerm;
    private final int maxProducts;

    public FcaProductLoader(FcaRegisterClient client,
                            BulkIndexer indexer,
                            ExecutorService executor,
                            ProgressReporter progress,
                            List<String> searchTerms,
                            int maxHitsPerTerm,
                            int maxProducts,
                            int batchSize,
                            int fanOut,
                            Clock clock) {
        super(indexer, executor, progress, batchSize, fanOut, clock);
        this.client = client;
        this.searchTerms = List.copyOf(searchTerms);
        this.maxHitsPerTerm = maxHitsPerTerm;
        this.maxProducts = maxProducts;
    }

    @Override
    public Source source() {
        return Source.PRODUCTS;
    }

    @Override
    protected List<RegisterHit> discoverItems() {
        Map<String, RegisterHit> byPrn = new LinkedHashMap<>();
        for (String term : searchTerms) {
            for (JsonNode hit : client.search(term, "fund", maxHitsPerTerm)) {
                String prn = hit.path("Reference Number").asText("");
                if (!prn.isEmpty()) {
                    byPrn.putIfAbsent(prn, new RegisterHit(prn, hit.path("Name").asText(null), term));
                }
            }
        }
        List<RegisterHit> hits = new ArrayList<>(byPrn.values());
        logger.info("Discovered {} product(s) from {} search term(s)", hits.size(), searchTerms.size());
        return hits.size() > maxProducts ? hits.subList(0, maxProducts) : hits;
    }

    @Override
    protected Optional<Product> assemble(RegisterHit hit) {
        String prn = hit.getReference();
        List<Supplier<Optional<FcaResponse>>> fetches = List.of(
                () -> client.get("/CIS/" + prn),
                () -> client.get("/CIS/" + prn + "/Subfund"),
                () -> client.get("/CIS/" + prn + "/Names"));
        List<Optional<FcaResponse>> parts = fetchConcurrently(fetches);

        Optional<JsonNode> detail = parts.get(0).flatMap(FcaResponse::firstRecord);
        if (detail.isEmpty()) {
            logger.debug("No register entry for PRN {}", prn);
            return Optional.empty();
        }
        Product product = FcaRecordMapper.product(prn, hit.getName(), detail.get());
        product.setSubfunds(FcaRecordMapper.subfunds(parts.get(1)));
        product.setOtherNames(FcaRecordMapper.otherNames(parts.get(2)));
        product.setSearchTerm(hit.getSearchTerm());
        product.validate();
        return Optional.of(product);
    }
}
