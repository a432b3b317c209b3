package com.batchinsight.storage;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.google.cloud.storage.StorageOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Reads documents from Google Cloud Storage. References have the form gs://{bucket}/{object}.
 * Supports both real GCS and the local emulator (via STORAGE_EMULATOR_HOST).
 */
@Service
@ConditionalOnProperty(name = "app.storage.mode", havingValue = "gcs")
public class GcsDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(GcsDocumentStore.class);
    static final String PREFIX = "gs://";

    private final Storage storage;

    @Autowired
    public GcsDocumentStore() {
        // Application Default Credentials, or the emulator when STORAGE_EMULATOR_HOST is set
        this(StorageOptions.getDefaultInstance().getService());
        String emulatorHost = System.getenv("STORAGE_EMULATOR_HOST");
        if (emulatorHost != null && !emulatorHost.isEmpty()) {
            logger.info("Using GCS emulator at: {}", emulatorHost);
        } else {
            logger.info("Using real GCS (Application Default Credentials or service account)");
        }
    }

    GcsDocumentStore(Storage storage) {
        this.storage = storage;
    }

    @Override
    public byte[] fetch(String reference) throws IOException {
        BlobId blobId = parse(reference);
        logger.debug("Reading document from GCS: {}", reference);

        try {
            Blob blob = storage.get(blobId);
            if (blob == null) {
                throw new MalformedDocumentException("Document not found: " + reference);
            }
            byte[] content = blob.getContent();
            if (content == null || content.length == 0) {
                throw new MalformedDocumentException("Document is empty: " + reference);
            }
            return content;
        } catch (StorageException e) {
            throw new IOException("Failed to read document from GCS: " + reference, e);
        }
    }

    static BlobId parse(String reference) {
        if (reference == null || !reference.startsWith(PREFIX)) {
            throw new MalformedDocumentException("Invalid GCS document reference: " + reference);
        }
        String path = reference.substring(PREFIX.length());
        int slash = path.indexOf('/');
        if (slash <= 0 || slash == path.length() - 1) {
            throw new MalformedDocumentException("Invalid GCS document reference: " + reference);
        }
        return BlobId.of(path.substring(0, slash), path.substring(slash + 1));
    }
}
