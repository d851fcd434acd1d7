package io.timeline.store.jdbc;

/** Storage type of the {@code data} column; fixed when the store is constructed. */
public enum EventDataType {
    /** Plain text, portable to every dialect. */
    TEXT,
    /** JSON-aware text column. */
    JSON,
    /** Binary JSON (Postgres {@code jsonb}, SQLite 3.45+ {@code jsonb()} blobs). */
    JSONB
}
