package dao.relay.oracle.service;

import dao.relay.oracle.config.RelayChainProperties;
import dao.relay.oracle.model.BlockRef;
import dao.relay.oracle.model.BoundaryNotFoundException;
import dao.relay.oracle.model.Era;
import dao.relay.oracle.relay.ChainReader;
import dao.relay.oracle.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Finds the last relay block of an era and waits for it to become final.
 */
@Slf4j
@Service
public class EraBoundaryLocator {

    private final long eraDurationBlocks;
    private final Duration blockTime;
    private final Sleeper sleeper;

    public EraBoundaryLocator(RelayChainProperties props, Sleeper sleeper) {
        this.eraDurationBlocks = props.getEraDurationBlocks();
        this.blockTime = Duration.ofMillis(props.blockTimeMillis());
        this.sleeper = sleeper;
    }

    /**
     * Binary search over the last {@code eraDurationBlocks} blocks for the last block whose active era is
     * {@code eraId}.
     *
     * @throws BoundaryNotFoundException if the era is not within the window or a block hash is missing
     */
    public BlockRef locate(ChainReader reader, long eraId) {
        String headHash = reader.chainHead();
        long head = reader.blockNumber(headHash);

        long headEra = eraOf(reader, headHash);
        if (headEra < eraId) {
            throw new BoundaryNotFoundException(eraId, "head #" + head + " is still in era " + headEra);
        }
        if (headEra == eraId) {
            log.info("Era {} boundary is the current head #{}", eraId, head);
            return new BlockRef(head, headHash);
        }

        long lo = Math.max(0, head - eraDurationBlocks);
        long loEra = eraAt(reader, lo, eraId);
        if (loEra > eraId) {
            throw new BoundaryNotFoundException(eraId,
                    "window starts at #" + lo + " already in era " + loEra);
        }

        // era(lo) <= eraId < era(hi)
        long hi = head;
        while (hi - lo > 1) {
            long mid = lo + (hi - lo) / 2;
            long midEra = eraAt(reader, mid, eraId);
            if (midEra <= eraId) {
                lo = mid;
                loEra = midEra;
            } else {
                hi = mid;
            }
        }

        if (loEra != eraId) {
            throw new BoundaryNotFoundException(eraId,
                    "era skipped: #" + lo + " is in era " + loEra + ", #" + hi + " is past it");
        }
        String hash = hashAt(reader, lo, eraId);
        log.info("Era {} ends at block #{} ({})", eraId, lo, hash);
        return new BlockRef(lo, hash);
    }

    /**
     * Blocks until the finalized head reaches the boundary, then checks the boundary hash is still canonical.
     *
     * @throws BoundaryNotFoundException if the block at the boundary height changed (re-org)
     */
    public BlockRef awaitFinalized(ChainReader reader, long eraId, BlockRef boundary) throws InterruptedException {
        while (true) {
            long finalized = reader.blockNumber(reader.finalizedHead());
            if (finalized >= boundary.number()) {
                break;
            }
            log.debug("Waiting for finality of #{} (finalized #{})", boundary.number(), finalized);
            sleeper.sleep(blockTime);
        }
        String canonical = hashAt(reader, boundary.number(), eraId);
        if (!canonical.equalsIgnoreCase(boundary.hash())) {
            throw new BoundaryNotFoundException(eraId, "block #" + boundary.number() + " re-organized from "
                    + boundary.hash() + " to " + canonical);
        }
        return boundary;
    }

    private long eraAt(ChainReader reader, long number, long eraId) {
        return eraOf(reader, hashAt(reader, number, eraId));
    }

    private String hashAt(ChainReader reader, long number, long eraId) {
        return reader.blockHash(number)
                .orElseThrow(() -> new BoundaryNotFoundException(eraId, "no block hash for #" + number));
    }

    // before the first era starts there is no ActiveEra entry
    private static long eraOf(ChainReader reader, String hash) {
        return reader.activeEra(hash).map(Era::eraId).orElse(-1L);
    }
}
