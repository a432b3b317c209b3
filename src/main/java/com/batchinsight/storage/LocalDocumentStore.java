package com.batchinsight.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads documents from the local filesystem. References have the form local://{relative path}
 * and resolve under app.storage.local-dir.
 * Only loads when app.storage.mode=local (or when property is missing, as it's the default).
 */
@Service
@ConditionalOnProperty(name = "app.storage.mode", havingValue = "local", matchIfMissing = true)
public class LocalDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalDocumentStore.class);
    static final String PREFIX = "local://";

    private final Path storageRoot;

    public LocalDocumentStore(@Value("${app.storage.local-dir:.local-storage}") String localDir) {
        this.storageRoot = Paths.get(localDir).toAbsolutePath().normalize();

        try {
            Files.createDirectories(storageRoot);
            logger.info("Local document store initialized with directory: {}", storageRoot);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create local storage directory: " + storageRoot, e);
        }
    }

    @Override
    public byte[] fetch(String reference) throws IOException {
        Path filePath = resolve(reference);
        logger.debug("Reading document from local storage: {}", filePath);

        byte[] content;
        try {
            content = Files.readAllBytes(filePath);
        } catch (NoSuchFileException e) {
            throw new MalformedDocumentException("Document not found: " + reference, e);
        }
        if (content.length == 0) {
            throw new MalformedDocumentException("Document is empty: " + reference);
        }
        return content;
    }

    Path resolve(String reference) {
        if (reference == null || !reference.startsWith(PREFIX)) {
            throw new MalformedDocumentException("Invalid local document reference: " + reference);
        }
        String relative = reference.substring(PREFIX.length());
        if (relative.isBlank()) {
            throw new MalformedDocumentException("Invalid local document reference: " + reference);
        }
        Path filePath = storageRoot.resolve(relative).normalize();
        if (!filePath.startsWith(storageRoot)) {
            throw new MalformedDocumentException("Path traversal detected: " + reference);
        }
        return filePath;
    }
}
