package com.reelpipe.orchestrator.claim;

import com.reelpipe.orchestrator.model.Chunk;
import com.reelpipe.orchestrator.model.Item;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content-derived idempotency keys.
 *
 * The key only changes when the work itself changes (a new revision, a
 * different chunk), so a re-invocation after a lost lease sends the provider
 * the same key as the first attempt.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {}

    public static String forItem(Item item) {
        return sha256(item.getJobId() + "|" + item.getId() + "|" + item.getStageKey() + "|" + item.getRevision());
    }

    public static String forChunk(Chunk chunk) {
        return sha256(chunk.getDocumentId() + "|" + chunk.getVersionId() + "|" + chunk.getChunkIndex());
    }

    static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JVM ships SHA-256.
            throw new IllegalStateException(e);
        }
    }
}
