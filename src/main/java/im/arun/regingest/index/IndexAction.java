package im.arun.regingest.index;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * Upsert of one document under its key.
 */
@Value
public class IndexAction {
    String documentKey;
    ObjectNode document;
    String collection;
}
