package dao.relay.oracle.service;

import dao.relay.oracle.model.StakeStatus;
import dao.relay.oracle.model.StakingLedger;
import dao.relay.oracle.model.StakingSnapshot;
import dao.relay.oracle.relay.ChainReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the staking position of a stash at one block.
 */
@Slf4j
@Service
public class ReportBuilder {

    // validator/nominator sets of the last block read; every stash of an era is read at the same block
    private String cachedBlockHash;
    private Set<String> cachedValidators;
    private Set<String> cachedNominators;

    public synchronized StakingSnapshot build(ChainReader reader, String stash, String blockHash) {
        BigInteger free = reader.freeBalance(stash, blockHash);

        Optional<String> controller = reader.bondedController(stash, blockHash);
        if (controller.isEmpty()) {
            log.info("Stash {} has no controller at {}", stash, blockHash);
            return StakingSnapshot.unbonded(stash, free, blockHash);
        }
        Optional<StakingLedger> ledger = reader.ledger(controller.get(), blockHash);
        if (ledger.isEmpty()) {
            log.info("Controller {} of stash {} has no ledger at {}", controller.get(), stash, blockHash);
            return StakingSnapshot.unbonded(stash, free, blockHash);
        }

        StakingLedger l = ledger.get();
        StakeStatus status = statusOf(reader, stash, blockHash);
        return new StakingSnapshot(
                stash,
                controller.get(),
                status,
                l.active(),
                l.total(),
                l.unlocking(),
                l.claimedRewards(),
                free,
                l.slashingSpans(),
                blockHash
        );
    }

    private StakeStatus statusOf(ChainReader reader, String stash, String blockHash) {
        if (!blockHash.equals(cachedBlockHash)) {
            cachedValidators = reader.validators(blockHash);
            cachedNominators = reader.nominators(blockHash);
            cachedBlockHash = blockHash;
        }
        if (cachedValidators.contains(stash)) {
            return StakeStatus.VALIDATOR;
        }
        if (cachedNominators.contains(stash)) {
            return StakeStatus.NOMINATOR;
        }
        return StakeStatus.IDLE;
    }
}
