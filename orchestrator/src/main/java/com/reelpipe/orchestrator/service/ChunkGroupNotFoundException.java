package com.reelpipe.orchestrator.service;

public class ChunkGroupNotFoundException extends RuntimeException {

    public ChunkGroupNotFoundException(String documentId, String versionId) {
        super("No chunks for document " + documentId + " version " + versionId);
    }
}
