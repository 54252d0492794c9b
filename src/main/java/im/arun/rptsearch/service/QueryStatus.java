package im.arun.rptsearch.service;

/**
 * Terminal state of one query. Only {@link #COMPLETED} carries records.
 */
public enum QueryStatus {
    COMPLETED,
    UNKNOWN_REPORT,
    NO_INSTANCE,
    UNKNOWN_FIELD,
    FIELD_NOT_INDEXED
}
