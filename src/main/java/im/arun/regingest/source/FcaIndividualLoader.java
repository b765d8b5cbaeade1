package im.arun.regingest.source;

import im.arun.regingest.index.BulkIndexer;
import im.arun.regingest.model.Individual;
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
 * Loads the approved persons of the configured firms. An individual linked to several of those
 * firms is loaded once and lists all of them.
 */
public class FcaIndividualLoader extends AggregateSourceLoader<FcaIndividualLoader.Appointment, Individual> {
    private static final Logger logger = LoggerFactory.getLogger(FcaIndividualLoader.class);

    private final FcaRegisterClient client;
    private final List<String> firmFrns;

    public FcaIndividualLoader(FcaRegisterClient client,
                               BulkIndexer indexer,
                               ExecutorService executor,
                               ProgressReporter progress,
                               List<String> firmFrns,
                               int batchSize,
                               int fanOut,
                               Clock clock) {
        super(indexer, executor, progress, batchSize, fanOut, clock);
        this.client = client;
        this.firmFrns = List.copyOf(firmFrns);
    }

    @Override
    public Source source() {
        return Source.INDIVIDUALS;
    }

    @Override
    protected List<Appointment> discoverItems() {
        Map<String, Appointment> byIrn = new LinkedHashMap<>();
        for (String frn : firmFrns) {
            for (String irn : FcaRecordMapper.individualReferences(client.get("/Firm/" + frn + "/Individuals"))) {
                byIrn.computeIfAbsent(irn, Appointment::new).firms.add(frn);
            }
        }
        logger.info("Discovered {} individual(s) across {} firm(s)", byIrn.size(), firmFrns.size());
        return new ArrayList<>(byIrn.values());
    }

    @Override
    protected Optional<Individual> assemble(Appointment appointment) {
        String irn = appointment.irn;
        List<Supplier<Optional<FcaResponse>>> fetches = List.of(
                () -> client.get("/Individuals/" + irn),
                () -> client.get("/Individuals/" + irn + "/CF"),
                () -> client.get("/Individuals/" + irn + "/DisciplinaryHistory"));
        List<Optional<FcaResponse>> parts = fetchConcurrently(fetches);

        Optional<FcaResponse> detail = parts.get(0);
        if (detail.flatMap(FcaResponse::firstRecord).isEmpty()) {
            logger.debug("No register entry for IRN {}", irn);
            return Optional.empty();
        }
        Individual individual = FcaRecordMapper.individual(irn, detail.get().firstRecord().get());
        FcaRecordMapper.applyControlledFunctions(individual, parts.get(1));
        individual.setDisciplinaryHistory(FcaRecordMapper.disciplinaryHistory(parts.get(2)));
        individual.setFirmReferenceNumbers(new ArrayList<>(appointment.firms));
        individual.validate();
        return Optional.of(individual);
    }

    /**
     * An IRN with the configured firms that list it.
     */
    static final class Appointment {
        private final String irn;
        private final List<String> firms = new ArrayList<>();

        Appointment(String irn) {
            this.irn = irn;
        }

        @Override
        public String toString() {
            return irn;
        }
    }
}
