package dao.relay.oracle.model;

import java.math.BigInteger;
import java.util.List;

/**
 * Staking position of one stash, read at a single block.
 */
public record StakingSnapshot(
        String stashAccount,
        String controllerAccount,
        StakeStatus stakeStatus,
        BigInteger activeBalance,
        BigInteger totalBalance,
        List<UnlockingChunk> unlocking,
        List<Long> claimedRewards,
        BigInteger stashBalance,
        int slashingSpans,
        String blockHash
) {

    public StakingSnapshot {
        unlocking = List.copyOf(unlocking);
        claimedRewards = List.copyOf(claimedRewards);
    }

    /**
     * Snapshot of a stash without a controller. The controller field repeats the stash.
     */
    public static StakingSnapshot unbonded(String stash, BigInteger freeBalance, String blockHash) {
        return new StakingSnapshot(
                stash,
                stash,
                StakeStatus.NONE,
                BigInteger.ZERO,
                BigInteger.ZERO,
                List.of(),
                List.of(),
                freeBalance,
                0,
                blockHash
        );
    }
}
