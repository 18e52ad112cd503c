package dao.relay.oracle.relay;

import dao.relay.oracle.model.Era;
import dao.relay.oracle.model.StakingLedger;

import java.math.BigInteger;
import java.util.Optional;
import java.util.Set;

/**
 * Point-in-time queries against the relay chain.
 * <p>
 * Every storage read takes an explicit block hash. Absent values come back as an empty {@link Optional};
 * transport failures raise {@link dao.relay.oracle.model.ChainConnectionException}.
 * Accounts are 0x-prefixed lower-case hex public keys.
 */
public interface ChainReader extends AutoCloseable {

    String url();

    /**
     * Active era at the given block, or at the best block when {@code blockHash} is null.
     */
    Optional<Era> activeEra(String blockHash);

    Optional<String> blockHash(long number);

    String chainHead();

    String finalizedHead();

    long blockNumber(String blockHash);

    Optional<String> bondedController(String stash, String blockHash);

    Optional<StakingLedger> ledger(String controller, String blockHash);

    Set<String> validators(String blockHash);

    Set<String> nominators(String blockHash);

    BigInteger freeBalance(String account, String blockHash);

    @Override
    default void close() {
    }
}
