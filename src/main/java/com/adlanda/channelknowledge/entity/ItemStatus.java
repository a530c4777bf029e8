package com.adlanda.channelknowledge.entity;

/**
 * Position of a staged post in the fetch, score, index lifecycle.
 */
public enum ItemStatus {
    /** Fetched, not yet scored. */
    PENDING,
    /** Scored below the ingestion threshold. Text cleared. */
    REJECTED,
    /** Scored at or above the threshold, waiting for indexing. */
    ACCEPTED,
    /** Chunks written to the vector index. Text cleared. */
    INDEXED,
    /** Scoring raised an error; not retried automatically. */
    SCORING_FAILED,
    /** Indexing failed too many times; text kept for an operator to inspect. */
    INDEX_FAILED
}
