package dao.relay.oracle.service;

import dao.relay.oracle.config.OracleProperties;
import dao.relay.oracle.config.ParachainProperties;
import dao.relay.oracle.model.ChainConnectionException;
import dao.relay.oracle.model.ChainSide;
import dao.relay.oracle.model.ContractCallException;
import dao.relay.oracle.model.ReportOutcome;
import dao.relay.oracle.model.StakingSnapshot;
import dao.relay.oracle.model.TxReceipt;
import dao.relay.oracle.parachain.OracleContract;
import dao.relay.oracle.parachain.ParachainGateway;
import dao.relay.oracle.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds, dry-runs, signs and broadcasts one {@code reportRelay} transaction and waits for its receipt.
 */
@Slf4j
@Service
public class TxSubmitter {

    private final OracleContract contract;
    private final Credentials credentials;
    private final ParachainProperties paraProps;
    private final OracleProperties oracleProps;
    private final Clock clock;
    private final Sleeper sleeper;
    /**
     * Nonce fetch to broadcast must not interleave between callers.
     */
    private final Object broadcastLock = new Object();

    public TxSubmitter(OracleContract contract,
                       Credentials credentials,
                       ParachainProperties paraProps,
                       OracleProperties oracleProps,
                       Clock clock,
                       Sleeper sleeper) {
        this.contract = contract;
        this.credentials = credentials;
        this.paraProps = paraProps;
        this.oracleProps = oracleProps;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public ReportOutcome submit(ParachainGateway gateway, long eraId, StakingSnapshot snapshot) throws InterruptedException {
        String stash = snapshot.stashAccount();
        String from = credentials.getAddress();
        String to = contract.getContractAddress();
        String txHash;

        synchronized (broadcastLock) {
            BigInteger nonce = gateway.pendingNonce(from);
            String data = contract.encodeReportRelay(eraId, snapshot);

            try {
                gateway.call(from, to, data);
            } catch (ContractCallException e) {
                log.warn("Report for stash {} era {} is likely failing, not sent: {}", stash, eraId, e.getMessage());
                return ReportOutcome.LIKELY_FAILING;
            }

            if (oracleProps.isDebug()) {
                log.info("Debug mode: built report for stash {} era {} (nonce={}, status={}, active={}), not sent",
                        stash, eraId, nonce, snapshot.stakeStatus(), snapshot.activeBalance());
                return ReportOutcome.BUILT_ONLY;
            }

            long chainId = gateway.chainId();
            BigInteger priorityFee = paraProps.getMaxPriorityFeePerGas();
            BigInteger maxFee = gateway.gasPrice().add(priorityFee);
            RawTransaction raw = RawTransaction.createTransaction(
                    chainId, nonce, paraProps.getGasLimit(), to, BigInteger.ZERO, data, priorityFee, maxFee);
            String signed = Numeric.toHexString(TransactionEncoder.signMessage(raw, credentials));

            try {
                txHash = gateway.sendRawTransaction(signed);
            } catch (ContractCallException e) {
                log.warn("Report for stash {} era {} rejected by {}: {}", stash, eraId, gateway.url(), e.getMessage());
                return ReportOutcome.REVERTED;
            }
            log.info("Report for stash {} era {} sent: tx={} nonce={}", stash, eraId, txHash, nonce);
        }

        ParachainProperties.Polling polling = paraProps.getPolling();
        Instant deadline = clock.instant().plusSeconds(polling.getReceiptTimeoutSeconds());
        TxReceipt receipt = waitForReceipt(gateway, txHash, deadline,
                Duration.ofMillis(polling.getReceiptPollInitialMs()),
                Duration.ofMillis(polling.getReceiptPollMaxMs()));

        if (!receipt.success()) {
            log.warn("Report for stash {} era {} reverted in block {}: tx={}", stash, eraId, receipt.blockNumber(), txHash);
            return ReportOutcome.REVERTED;
        }
        log.info("Report for stash {} era {} included in block {}: tx={}", stash, eraId, receipt.blockNumber(), txHash);

        awaitConfirmations(gateway, receipt, deadline, Duration.ofMillis(polling.getReceiptPollInitialMs()));
        return ReportOutcome.SUCCESS;
    }

    private TxReceipt waitForReceipt(ParachainGateway gateway, String txHash, Instant deadline,
                                     Duration pollInitial, Duration pollMax) throws InterruptedException {
        long sleepMs = Math.max(100, pollInitial.toMillis());
        long maxSleepMs = Math.max(sleepMs, pollMax.toMillis());
        while (clock.instant().isBefore(deadline)) {
            Optional<TxReceipt> receipt = gateway.receipt(txHash);
            if (receipt.isPresent()) {
                return receipt.get();
            }
            long jitter = ThreadLocalRandom.current().nextLong(0, 150);
            sleeper.sleep(Duration.ofMillis(sleepMs + jitter));
            sleepMs = Math.min(maxSleepMs, (long) Math.ceil(sleepMs * 1.5));
        }
        throw new ChainConnectionException(ChainSide.PARA, gateway.url(),
                "No receipt for tx " + txHash + " within " + paraProps.getPolling().getReceiptTimeoutSeconds() + "s");
    }

    private void awaitConfirmations(ParachainGateway gateway, TxReceipt receipt, Instant deadline, Duration poll)
            throws InterruptedException {
        long target = receipt.blockNumber() + paraProps.getConfirmationBlocks();
        while (gateway.blockNumber() < target) {
            if (!clock.instant().isBefore(deadline)) {
                log.warn("Tx {} not confirmed by {} blocks before timeout, continuing",
                        receipt.txHash(), paraProps.getConfirmationBlocks());
                return;
            }
            sleeper.sleep(poll);
        }
    }
}
