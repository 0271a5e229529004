package com.reelpipe.orchestrator.service;

import com.reelpipe.orchestrator.model.Chunk;
import com.reelpipe.orchestrator.model.ChunkStatus;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of all chunks of one document version, ordered by index.
 */
public record ChunkGroup(String documentId, String versionId, List<ChunkView> chunks) {

    public record ChunkView(int index, String key, ChunkStatus status, int attempts,
                            int charCount, String error, String outputRef) {

        static ChunkView from(Chunk c) {
            return new ChunkView(c.getChunkIndex(), c.getChunkKey(), c.getStatus(), c.getAttempts(),
                    c.getCharCount(), c.getError(), c.getOutputRef());
        }
    }

    public static ChunkGroup of(String documentId, String versionId, List<Chunk> chunks) {
        return new ChunkGroup(documentId, versionId, chunks.stream().map(ChunkView::from).toList());
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    /** Complete iff there is at least one chunk and every chunk is DONE. */
    public boolean isComplete() {
        return !chunks.isEmpty() && chunks.stream().allMatch(c -> c.status() == ChunkStatus.DONE);
    }

    public int doneCount() {
        return (int) chunks.stream().filter(c -> c.status() == ChunkStatus.DONE).count();
    }

    /** Lowest-index chunk in an error state. */
    public Optional<ChunkView> firstError() {
        return chunks.stream().filter(c -> c.status().isError()).findFirst();
    }

    public Optional<ChunkView> chunk(int index) {
        return chunks.stream().filter(c -> c.index() == index).findFirst();
    }

    /** Reference to the assembled document once complete. */
    public String assembledRef() {
        return "chunks:" + documentId + "@" + versionId;
    }
}
