package im.arun.regingest.cli;

import im.arun.regingest.exception.IngestException;
import im.arun.regingest.source.Source;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(name = "init-store", description = "Create the collections of every source", mixinStandardHelpOptions = true)
public class InitStoreCommand implements Callable<Integer> {

    @ParentCommand
    private RegistryIngestCLI parent;

    @Override
    public Integer call() {
        try {
            parent.engine(parent.loadConfig(), false).initStore();
        } catch (IngestException e) {
            System.err.println("Error creating collections: " + e.getMessage());
            return 1;
        }
        System.out.println("Collections ready: " + Source.names());
        return 0;
    }
}
