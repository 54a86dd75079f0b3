package com.fluxreader.core.queue;

public record PendingCollectionOperation(
        long id,
        CollectionKind kind,
        String operation,
        long timestamp) {

    public static final String MARK_ALL_READ = "mark_all_read";

    public static PendingCollectionOperation markAllRead(CollectionKind kind, long id) {
        return new PendingCollectionOperation(id, kind, MARK_ALL_READ, System.currentTimeMillis() / 1000);
    }
}
