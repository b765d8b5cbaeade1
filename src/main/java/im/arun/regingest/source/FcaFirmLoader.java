package im.arun.regingest.source;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.regingest.index.BulkIndexer;
import im.arun.regingest.model.AuthorisedFirm;
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
import java.util.stream.Collectors;

/**
 * Loads authorised firms found by register search, plus a fixed list of known FRNs.
 */
public class FcaFirmLoader extends AggregateSourceLoader<RegisterHit, AuthorisedFirm> {
    private static final Logger logger = LoggerFactory.getLogger(FcaFirmLoader.class);
    private static final String[] SUB_RESOURCES = {
            "Names", "Address", "Permissions", "Individuals", "Requirements", "DisciplinaryHistory"};

    private final FcaRegisterClient client;
    private final List<String> searchTerms;
    private final List<String> knownFrns;
    private final int maxHitsPerTerm;
    private final int maxFirms;

    public FcaFirmLoader(FcaRegisterClient client,
                         BulkIndexer indexer,
                         ExecutorService executor,
                         ProgressReporter progress,
                         List<String> searchTerms,
                         List<String> knownFrns,
                         int maxHitsPerTerm,
                         int maxFirms,
                         int batchSize,
                         int fanOut,
                         Clock clock) {
        super(indexer, executor, progress, batchSize, fanOut, clock);
        this.client = client;
        this.searchTerms = List.copyOf(searchTerms);
        this.knownFrns = List.copyOf(knownFrns);
        this.maxHitsPerTerm = maxHitsPerTerm;
        this.maxFirms = maxFirms;
    }

    @Override
    public Source source() {
        return Source.FIRMS_REGISTER;
    }

    @Override
    protected List<RegisterHit> discoverItems() {
        Map<String, RegisterHit> byFrn = new LinkedHashMap<>();
        for (String term : searchTerms) {
            for (JsonNode hit : client.search(term, "firm", maxHitsPerTerm)) {
                String frn = hit.path("Reference Number").asText("");
                if (!frn.isEmpty()) {
                    byFrn.putIfAbsent(frn, new RegisterHit(frn, hit.path("Name").asText(null), term));
                }
            }
        }
        for (String frn : knownFrns) {
            byFrn.putIfAbsent(frn, new RegisterHit(frn, null, null));
        }
        List<RegisterHit> hits = new ArrayList<>(byFrn.values());
        logger.info("Discovered {} firm(s) from {} search term(s)", hits.size(), searchTerms.size());
        return hits.size() > maxFirms ? hits.subList(0, maxFirms) : hits;
    }

    @Override
    protected Optional<AuthorisedFirm> assemble(RegisterHit hit) {
        String frn = hit.getReference();
        Optional<JsonNode> base = client.get("/Firm/" + frn).flatMap(FcaResponse::firstRecord);
        if (base.isEmpty()) {
            logger.debug("No register entry for FRN {}", frn);
            return Optional.empty();
        }

        List<Supplier<Optional<FcaResponse>>> fetches = new ArrayList<>();
        for (String resource : SUB_RESOURCES) {
            fetches.add(() -> client.get("/Firm/" + frn + "/" + resource));
        }
        List<Optional<FcaResponse>> parts = fetchConcurrently(fetches);

        AuthorisedFirm firm = FcaRecordMapper.firm(frn, base.get());
        firm.setTradingNames(FcaRecordMapper.tradingNames(parts.get(0)));
        FcaRecordMapper.applyAddress(firm, parts.get(1));
        firm.setPermissions(FcaRecordMapper.permissions(parts.get(2)));
        firm.setKeyIndividuals(FcaRecordMapper.individualNames(parts.get(3)));
        firm.setRegulatoryRequirements(FcaRecordMapper.requirements(parts.get(4)));
        firm.setDisciplinaryHistory(FcaRecordMapper.disciplinaryHistory(parts.get(5)).stream()
                .map(action -> action.getActionType() + ": " + action.getDescription())
                .collect(Collectors.toList()));
        firm.setSearchTerm(hit.getSearchTerm());
        firm.validate();
        return Optional.of(firm);
    }
}
