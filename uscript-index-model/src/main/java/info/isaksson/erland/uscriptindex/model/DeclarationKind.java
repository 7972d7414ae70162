package info.isaksson.erland.uscriptindex.model;

/**
 * Structural categories a single source line can be classified into.
 */
public enum DeclarationKind {
    CLASS,
    FUNCTION,
    VARIABLE,
    STATE
}
