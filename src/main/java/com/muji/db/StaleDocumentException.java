package com.muji.db;

/** Документ на диске сохранил кто-то другой после того, как вызывающий его загрузил. */
public class StaleDocumentException extends RuntimeException {
    private final long expectedVersion;
    private final long actualVersion;

    public StaleDocumentException(long expectedVersion, long actualVersion) {
        super("Document version " + expectedVersion + " is stale, file is at version " + actualVersion);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long expectedVersion() { return expectedVersion; }
    public long actualVersion() { return actualVersion; }
}
