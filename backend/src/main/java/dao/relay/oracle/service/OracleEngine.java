package dao.relay.oracle.service;

import dao.relay.oracle.model.BlockRef;
import dao.relay.oracle.model.BoundaryNotFoundException;
import dao.relay.oracle.model.ChainConnectionException;
import dao.relay.oracle.model.ChainSide;
import dao.relay.oracle.model.EngineOutcome;
import dao.relay.oracle.model.Era;
import dao.relay.oracle.model.OracleConfigurationException;
import dao.relay.oracle.model.OracleState;
import dao.relay.oracle.model.OracleStatusSnapshot;
import dao.relay.oracle.model.ReportOutcome;
import dao.relay.oracle.model.StakingSnapshot;
import dao.relay.oracle.model.WatchdogVerdict;
import dao.relay.oracle.parachain.ContractAbiVerifier;
import dao.relay.oracle.parachain.OracleContract;
import dao.relay.oracle.parachain.ParachainGateway;
import dao.relay.oracle.relay.ChainReader;
import dao.relay.oracle.service.EndpointPool.Connection;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Oracle state machine. One call to {@link #runCycle()} per poll: connect and verify on the first cycle,
 * then read the active era and report every stash for the era that just completed.
 * <p>
 * Not reentrant: a single scheduler thread drives it. Status fields are volatile for the monitoring endpoint.
 */
@Slf4j
@Service
public class OracleEngine {

    private final EndpointPool<ChainReader> relayPool;
    private final EndpointPool<ParachainGateway> paraPool;
    private final ContractAbiVerifier abiVerifier;
    private final OracleContract contract;
    private final ReportTracker tracker;
    private final EraBoundaryLocator boundaryLocator;
    private final ReportBuilder reportBuilder;
    private final TxSubmitter txSubmitter;
    private final Watchdog watchdog;
    private final Clock clock;

    private volatile Connection<ChainReader> relay;
    private volatile Connection<ParachainGateway> para;
    private boolean started;

    private volatile OracleState state = OracleState.STARTING;
    private volatile long activeEra = -1;
    private volatile long lastProcessedEra = -1;
    private volatile long lastBoundaryBlock = -1;
    private volatile long lastReportEpochSeconds;
    // report era with submissions whose result may not be known locally
    private long unsettledEra = -1;
    private volatile BigInteger totalStashFreeBalance = BigInteger.ZERO;
    private final AtomicLong reportsSucceeded = new AtomicLong();
    private final AtomicLong reportsReverted = new AtomicLong();
    private final AtomicLong reportsLikelyFailing = new AtomicLong();
    private final AtomicLong relayExceptions = new AtomicLong();
    private final AtomicLong paraExceptions = new AtomicLong();

    public OracleEngine(EndpointPool<ChainReader> relayPool,
                        EndpointPool<ParachainGateway> paraPool,
                        ContractAbiVerifier abiVerifier,
                        OracleContract contract,
                        ReportTracker tracker,
                        EraBoundaryLocator boundaryLocator,
                        ReportBuilder reportBuilder,
                        TxSubmitter txSubmitter,
                        Watchdog watchdog,
                        Clock clock) {
        this.relayPool = relayPool;
        this.paraPool = paraPool;
        this.abiVerifier = abiVerifier;
        this.contract = contract;
        this.tracker = tracker;
        this.boundaryLocator = boundaryLocator;
        this.reportBuilder = reportBuilder;
        this.txSubmitter = txSubmitter;
        this.watchdog = watchdog;
        this.clock = clock;
    }

    /**
     * Runs one poll. Only configuration errors and the watchdog end the loop; every other failure is
     * logged and retried on the next poll.
     *
     * @throws InterruptedException if shutdown interrupts a blocking wait
     */
    public EngineOutcome runCycle() throws InterruptedException {
        try {
            if (!started) {
                start();
            }
            return monitor();
        } catch (ChainConnectionException e) {
            log.warn("{} connection failure on {}: {}", e.getSide(), e.getUrl(), e.getMessage());
            (e.getSide() == ChainSide.RELAY ? relayExceptions : paraExceptions).incrementAndGet();
            recover(e);
            return EngineOutcome.proceed();
        } catch (BoundaryNotFoundException e) {
            log.warn("{}; retrying on next poll", e.getMessage());
            state = OracleState.MONITORING;
            return EngineOutcome.proceed();
        } catch (OracleConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage(), e);
            return EngineOutcome.fatal(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error during oracle cycle, retrying on next poll", e);
            state = started ? OracleState.MONITORING : OracleState.STARTING;
            return EngineOutcome.proceed();
        }
    }

    private void start() throws InterruptedException {
        state = OracleState.STARTING;
        if (relay == null) {
            relay = relayPool.select(Set.of());
        }
        if (para == null) {
            para = paraPool.select(Set.of());
        }
        abiVerifier.verify(para.handle());

        List<String> stashes = contract.getStashAccounts(para.handle());
        tracker.initialize(para.handle(), stashes);
        relayPool.resetAll();
        paraPool.resetAll();

        started = true;
        state = OracleState.MONITORING;
        log.info("Oracle {} started: relay={}, para={}, contract={}, stashes={}",
                contract.getOracleAddress(), relay.url(), para.url(), contract.getContractAddress(), stashes.size());
    }

    private EngineOutcome monitor() throws InterruptedException {
        state = OracleState.MONITORING;
        ChainReader reader = relay.handle();
        Optional<Era> era = reader.activeEra(null);
        if (era.isEmpty()) {
            log.warn("No active era on {} yet", reader.url());
            return EngineOutcome.proceed();
        }
        long eraId = era.get().eraId();
        activeEra = eraId;

        ParachainGateway gateway = para.handle();
        WatchdogVerdict verdict = watchdog.observe(eraId, () -> contract.coordinatorEraId(gateway));
        if (verdict == WatchdogVerdict.TERMINATE) {
            return EngineOutcome.watchdogTimeout("Era " + eraId + " has not changed for "
                    + watchdog.getAccumulatedSeconds() + "s");
        }

        if (eraId <= lastProcessedEra) {
            log.debug("Active era {} already processed", eraId);
            return EngineOutcome.proceed();
        }
        log.info("New era {} observed (last processed {})", eraId, lastProcessedEra);
        process(eraId);
        return EngineOutcome.proceed();
    }

    private void process(long observedEra) throws InterruptedException {
        state = OracleState.PROCESSING;
        long reportEra = observedEra - 1;
        ChainReader reader = relay.handle();
        ParachainGateway gateway = para.handle();

        List<String> stashes = contract.getStashAccounts(gateway);
        if (stashes.isEmpty()) {
            log.info("No stash accounts to report for era {}", reportEra);
            completeEra(observedEra);
            return;
        }

        boolean retry = reportEra == unsettledEra;
        List<String> pending = new ArrayList<>();
        for (String stash : stashes) {
            if (retry) {
                // a transaction sent on the previous pass may have been included since
                tracker.refresh(gateway, stash);
            } else {
                tracker.ensureKnown(gateway, stash);
            }
            if (tracker.isAlreadyReported(stash, reportEra)) {
                log.info("Stash {} already reported for era {}", stash, reportEra);
            } else {
                pending.add(stash);
            }
        }
        if (pending.isEmpty()) {
            completeEra(observedEra);
            return;
        }

        BlockRef boundary = boundaryLocator.locate(reader, reportEra);
        boundaryLocator.awaitFinalized(reader, reportEra, boundary);
        lastBoundaryBlock = boundary.number();
        unsettledEra = reportEra;

        boolean complete = true;
        BigInteger totalFree = BigInteger.ZERO;
        for (String stash : pending) {
            StakingSnapshot snapshot = reportBuilder.build(reader, stash, boundary.hash());
            totalFree = totalFree.add(snapshot.stashBalance());

            ReportOutcome outcome = txSubmitter.submit(gateway, reportEra, snapshot);
            switch (outcome) {
                case SUCCESS -> {
                    tracker.markReported(stash, reportEra);
                    reportsSucceeded.incrementAndGet();
                    lastReportEpochSeconds = clock.instant().getEpochSecond();
                }
                case BUILT_ONLY -> log.debug("Report for stash {} era {} built only", stash, reportEra);
                case REVERTED -> {
                    reportsReverted.incrementAndGet();
                    complete = false;
                }
                case LIKELY_FAILING -> {
                    reportsLikelyFailing.incrementAndGet();
                    complete = false;
                }
            }
        }
        totalStashFreeBalance = totalFree;

        if (complete) {
            completeEra(observedEra);
        } else {
            log.warn("Era {} not fully reported, retrying on next poll", reportEra);
            state = OracleState.MONITORING;
        }
    }

    private void completeEra(long observedEra) {
        lastProcessedEra = observedEra;
        unsettledEra = -1;
        relayPool.resetAll();
        paraPool.resetAll();
        state = OracleState.MONITORING;
        log.info("Era {} processed", observedEra - 1);
    }

    private void recover(ChainConnectionException e) throws InterruptedException {
        state = OracleState.RECOVERING;
        if (e.getSide() == ChainSide.RELAY) {
            relay = relay == null ? relayPool.select(Set.of()) : relayPool.reconnect(relay);
        } else {
            para = para == null ? paraPool.select(Set.of()) : paraPool.reconnect(para);
        }
        state = started ? OracleState.MONITORING : OracleState.STARTING;
    }

    public OracleState getState() {
        return state;
    }

    public long getLastProcessedEra() {
        return lastProcessedEra;
    }

    public OracleStatusSnapshot statusSnapshot() {
        Connection<ChainReader> r = relay;
        Connection<ParachainGateway> p = para;
        return new OracleStatusSnapshot(
                state,
                activeEra,
                lastProcessedEra,
                tracker.snapshot(),
                relayPool.failures(),
                paraPool.failures(),
                watchdog.getAccumulatedSeconds(),
                lastBoundaryBlock,
                lastReportEpochSeconds,
                totalStashFreeBalance,
                r == null ? null : r.url(),
                p == null ? null : p.url(),
                reportsSucceeded.get(),
                reportsReverted.get(),
                reportsLikelyFailing.get(),
                relayExceptions.get(),
                paraExceptions.get()
        );
    }

    @PreDestroy
    public void close() {
        relayPool.close(relay);
        paraPool.close(para);
        log.info("Oracle connections closed");
    }
}
