package dao.relay.oracle.parachain;

import dao.relay.oracle.model.TxReceipt;

import java.math.BigInteger;
import java.util.Optional;

/**
 * EVM JSON-RPC access to the parachain.
 * <p>
 * Transport failures raise {@link dao.relay.oracle.model.ChainConnectionException};
 * execution errors reported by the node raise {@link dao.relay.oracle.model.ContractCallException}.
 */
public interface ParachainGateway extends AutoCloseable {

    String url();

    /**
     * {@code eth_call} at the latest block. Returns the raw return data.
     */
    String call(String from, String to, String data);

    BigInteger pendingNonce(String address);

    long chainId();

    BigInteger gasPrice();

    /**
     * Broadcasts a signed transaction and returns its hash.
     */
    String sendRawTransaction(String signedTxHex);

    Optional<TxReceipt> receipt(String txHash);

    long blockNumber();

    String code(String address);

    @Override
    default void close() {
    }
}
