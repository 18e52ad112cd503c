package dao.relay.oracle.model;

import java.math.BigInteger;
import java.util.List;

/**
 * Decoded {@code Staking.Ledger} entry plus the slashing span count of its stash.
 */
public record StakingLedger(
        String stash,
        BigInteger total,
        BigInteger active,
        List<UnlockingChunk> unlocking,
        List<Long> claimedRewards,
        int slashingSpans
) {}
