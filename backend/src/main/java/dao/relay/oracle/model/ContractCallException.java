package dao.relay.oracle.model;

/**
 * The parachain node answered a call or a broadcast with an execution error (revert, bad nonce, ...).
 */
public class ContractCallException extends RuntimeException {

    public ContractCallException(String message) {
        super(message);
    }
}
