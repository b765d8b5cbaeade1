package im.arun.regingest.cli;

import im.arun.regingest.exception.IngestException;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(name = "delete-store", description = "Delete the collections of every source with their documents",
        mixinStandardHelpOptions = true)
public class DeleteStoreCommand implements Callable<Integer> {

    @ParentCommand
    private RegistryIngestCLI parent;

    @Override
    public Integer call() {
        try {
            parent.engine(parent.loadConfig(), false).deleteStore();
        } catch (IngestException e) {
            System.err.println("Error deleting collections: " + e.getMessage());
            return 1;
        }
        System.out.println("Collections deleted");
        return 0;
    }
}
