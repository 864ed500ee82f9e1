package sentrix.lifecycle.api.types;

/**
 * Kind of duplicate found for an ingested image. Only byte-exact matches are detected.
 */
public enum DuplicateType {
    NONE, EXACT_CONTENT
}
