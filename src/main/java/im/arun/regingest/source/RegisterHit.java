package im.arun.regingest.source;

import lombok.Value;

/**
 * A register reference number found by discovery, with the name and search term that found it.
 * Both are null for reference numbers configured directly.
 */
@Value
public class RegisterHit {
    String reference;
    String name;
    String searchTerm;
}
