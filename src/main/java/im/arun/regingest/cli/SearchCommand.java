package im.arun.regingest.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.regingest.exception.IngestException;
import im.arun.regingest.index.SearchHit;
import im.arun.regingest.index.SearchQuery;
import im.arun.regingest.source.Source;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "search", description = "Full-text search over one collection", mixinStandardHelpOptions = true)
public class SearchCommand implements Callable<Integer> {

    @ParentCommand
    private RegistryIngestCLI parent;

    @Parameters(index = "0", description = "Source name or collection name")
    private String collection;

    @Parameters(index = "1", description = "Search text")
    private String text;

    @Option(names = {"--size"}, description = "Maximum number of hits", defaultValue = "10")
    private int size;

    @Override
    public Integer call() throws Exception {
        Source source = resolve(collection);
        if (source == null) {
            System.err.println("Error: unknown collection '" + collection + "'. Supported sources: " + Source.names());
            return 2;
        }

        List<SearchHit> hits;
        try {
            hits = parent.engine(parent.loadConfig(), false)
                    .search(source, SearchQuery.text(text).withSize(size));
        } catch (IngestException e) {
            System.err.println("Error searching " + source.getCollection() + ": " + e.getMessage());
            return 1;
        }

        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        System.out.println(hits.size() + " hit(s) in " + source.getCollection());
        for (SearchHit hit : hits) {
            System.out.printf("%n%s (score %.2f)%n", hit.getDocumentKey(), hit.getScore());
            System.out.println(mapper.writeValueAsString(hit.getSource()));
        }
        return 0;
    }

    static Source resolve(String name) {
        for (Source source : Source.values()) {
            if (source.getCliName().equals(name) || source.getCollection().equals(name)) {
                return source;
            }
        }
        return null;
    }
}
