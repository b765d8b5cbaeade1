package im.arun.regingest.cli;

import im.arun.regingest.config.IngestConfig;
import im.arun.regingest.exception.IngestException;
import im.arun.regingest.exception.ValidationException;
import im.arun.regingest.service.IngestionEngine;
import im.arun.regingest.source.DateRange;
import im.arun.regingest.source.LoadReport;
import im.arun.regingest.source.Source;
import im.arun.regingest.util.RunReportLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.LocalDate;
import java.util.concurrent.Callable;

@Command(name = "load-data", description = "Load one source into its collection", mixinStandardHelpOptions = true)
public class LoadDataCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(LoadDataCommand.class);

    @ParentCommand
    private RegistryIngestCLI parent;

    @Parameters(index = "0", description = "Source: hansard, parliamentary-questions, firms-register, individuals, products")
    private String sourceName;

    @Option(names = {"--from-date"}, converter = DateArgumentConverter.class,
            description = "First day to load (required for hansard and parliamentary-questions)")
    private LocalDate fromDate;

    @Option(names = {"--to-date"}, converter = DateArgumentConverter.class,
            description = "Last day to load (default: today)")
    private LocalDate toDate;

    @Option(names = {"--dry-run"}, description = "Fetch and validate without writing to Elasticsearch")
    private boolean dryRun;

    @Override
    public Integer call() {
        Source source;
        try {
            source = Source.fromCliName(sourceName);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 2;
        }

        DateRange range;
        try {
            range = range(source);
        } catch (IngestException e) {
            System.err.println("Error: " + e.getMessage());
            return 2;
        }

        System.out.println("Loading " + source + " " + range + (dryRun ? " (dry run)" : ""));
        try {
            IngestConfig config = parent.loadConfig();
            IngestionEngine engine = parent.engine(config, dryRun);
            LoadReport report = engine.load(source, range);
            new RunReportLogger(source.getCliName()).record(report);
            System.out.println(report);
            return report.getFailedRecords() == 0 && report.getFailedPages() == 0 ? 0 : 1;
        } catch (IngestException e) {
            logger.error("Load of {} failed [{}]: {}", source, e.getCode(), e.getMessage(), e);
            System.err.println("Error loading " + source + ": " + e.getMessage());
            return 1;
        }
    }

    private DateRange range(Source source) {
        if (!source.isDateBound()) {
            return DateRange.none();
        }
        if (fromDate == null) {
            throw new ValidationException("--from-date is required for source '" + source + "'");
        }
        return DateRange.of(fromDate, toDate == null ? LocalDate.now() : toDate);
    }
}
