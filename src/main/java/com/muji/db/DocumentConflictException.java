package com.muji.db;

/** Повторная попытка сохранения тоже оказалась устаревшей. */
public class DocumentConflictException extends RuntimeException {
    public DocumentConflictException(StaleDocumentException cause) {
        super("Concurrent update, please retry", cause);
    }
}
