package com.reelpipe.orchestrator.claim;

import com.reelpipe.orchestrator.config.PipelineProperties;
import com.reelpipe.orchestrator.model.Chunk;
import com.reelpipe.orchestrator.model.Item;
import com.reelpipe.orchestrator.repository.ChunkRepository;
import com.reelpipe.orchestrator.repository.ItemRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Expiring leases on items and chunks.
 *
 * A claim is one conditional UPDATE that only matches a unit which is
 * queued, needs regeneration, or is running under an expired lease. At most
 * one caller owns a unit at any time; a caller that disappears loses the
 * unit once the ttl passes, which gives at-least-once execution.
 *
 * Losing a claim is expected under concurrent ticks and is not an error:
 * the caller skips the unit.
 */
@Component
public class ClaimProtocol {

    private static final Logger log = LoggerFactory.getLogger(ClaimProtocol.class);

    private final ItemRepository  itemRepo;
    private final ChunkRepository chunkRepo;
    private final Clock           clock;
    private final MeterRegistry   meterRegistry;
    private final Duration        ttl;
    private final int             maxAttempts;

    public ClaimProtocol(ItemRepository itemRepo,
                         ChunkRepository chunkRepo,
                         Clock clock,
                         MeterRegistry meterRegistry,
                         PipelineProperties props) {
        this.itemRepo      = itemRepo;
        this.chunkRepo     = chunkRepo;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
        this.ttl           = props.claim().ttl();
        this.maxAttempts   = props.claim().maxAttempts();
    }

    /** Claim an item with the configured ttl. */
    public boolean claimItem(Item item, String owner) {
        return claimItem(item.getId(), IdempotencyKeys.forItem(item), owner, ttl);
    }

    /**
     * @return true if {@code owner} now holds the lease on the item
     */
    public boolean claimItem(UUID itemId, String idempotencyKey, String owner, Duration ttl) {
        Instant now = clock.instant();
        try {
            if (itemRepo.tryClaim(itemId, owner, idempotencyKey, now, now.plus(ttl), maxAttempts) == 1) {
                log.debug("{} claimed item {} until {}", owner, itemId, now.plus(ttl));
                return true;
            }
        } catch (ConcurrencyFailureException e) {
            log.debug("Claim on item {} by {} hit a lock conflict: {}", itemId, owner, e.getMessage());
        }
        conflict("item");
        return false;
    }

    /** Claim a chunk with the configured ttl. */
    public boolean claimChunk(Chunk chunk, String owner) {
        return claimChunk(chunk.getId(), IdempotencyKeys.forChunk(chunk), owner, ttl);
    }

    public boolean claimChunk(UUID chunkId, String idempotencyKey, String owner, Duration ttl) {
        Instant now = clock.instant();
        try {
            if (chunkRepo.tryClaim(chunkId, owner, idempotencyKey, now, now.plus(ttl), maxAttempts) == 1) {
                log.debug("{} claimed chunk {} until {}", owner, chunkId, now.plus(ttl));
                return true;
            }
        } catch (ConcurrencyFailureException e) {
            log.debug("Claim on chunk {} by {} hit a lock conflict: {}", chunkId, owner, e.getMessage());
        }
        conflict("chunk");
        return false;
    }

    public Duration ttl() {
        return ttl;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private void conflict(String unit) {
        meterRegistry.counter("reelpipe.claims.conflicts", "unit", unit).increment();
    }
}
