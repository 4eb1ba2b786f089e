package edu.washu.tag.extractor.pathosys.model;

/**
 * Kinds of records published for every row of a case table.
 */
public enum RecordKind {
    SLIDE("slide"),
    THUMBNAIL("thumbnail");

    private final String kind;

    RecordKind(String kind) {
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
