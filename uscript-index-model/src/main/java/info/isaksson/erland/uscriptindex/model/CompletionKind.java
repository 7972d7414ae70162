package info.isaksson.erland.uscriptindex.model;

public enum CompletionKind {
    KEYWORD,
    TYPE,
    CLASS
}
