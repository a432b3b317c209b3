package com.batchinsight.storage;

import java.io.IOException;

/**
 * Read-only access to the documents a batch references (local filesystem or GCS).
 */
public interface DocumentStore {

    /**
     * Fetches the raw content of a document.
     *
     * @param reference document reference, e.g. "local://inbox/a.txt" or "gs://bucket/a.txt"
     * @return document bytes, never empty
     * @throws IOException if the store is unavailable; the fetch may be retried
     * @throws MalformedDocumentException if the reference is invalid, the document is missing or empty
     */
    byte[] fetch(String reference) throws IOException;
}
