package dao.relay.oracle.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.relay.oracle.config.OracleProperties;
import dao.relay.oracle.config.ParachainProperties;
import dao.relay.oracle.config.RelayChainProperties;
import dao.relay.oracle.model.ChainSide;
import dao.relay.oracle.model.EngineOutcome;
import dao.relay.oracle.model.OracleState;
import dao.relay.oracle.model.OracleStatusSnapshot;
import dao.relay.oracle.parachain.ContractAbiVerifier;
import dao.relay.oracle.parachain.OracleContract;
import dao.relay.oracle.parachain.ParachainGateway;
import dao.relay.oracle.relay.ChainReader;
import dao.relay.oracle.repository.InMemoryReportRecordRepository;
import dao.relay.oracle.support.FakeChainReader;
import dao.relay.oracle.support.FakeParachainGateway;
import dao.relay.oracle.support.ManualClock;
import dao.relay.oracle.support.RecordingSleeper;
import dao.relay.oracle.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.web3j.crypto.Credentials;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.function.LongUnaryOperator;

import static dao.relay.oracle.support.TestFixtures.STASH_A;
import static dao.relay.oracle.support.TestFixtures.STASH_B;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OracleEngineTest {

    private static final String RELAY_1 = "ws://relay-1.example:9944";
    private static final String RELAY_2 = "ws://relay-2.example:9944";
    private static final String PARA_1 = "ws://para-1.example:9944";

    // blocks 0-9 are era 4, 10-19 era 5, ... 40-49 era 8
    private static final LongUnaryOperator TEN_BLOCK_ERAS = b -> 4 + b / 10;

    private final Map<String, FakeChainReader> relayNodes = new HashMap<>();
    private FakeParachainGateway gateway;
    private ManualClock clock;
    private RelayChainProperties relayProps;
    private ParachainProperties paraProps;
    private OracleProperties oracleProps;
    private OracleContract contract;
    private ReportTracker tracker;

    @BeforeEach
    void setUp() {
        relayNodes.put(RELAY_1, new FakeChainReader(RELAY_1, 49, TEN_BLOCK_ERAS));
        relayNodes.put(RELAY_2, new FakeChainReader(RELAY_2, 49, TEN_BLOCK_ERAS));
        gateway = new FakeParachainGateway(PARA_1).withStashes(STASH_A, STASH_B);
        clock = new ManualClock();
        relayProps = TestFixtures.relayProps();
        relayProps.setUrls(List.of(RELAY_1, RELAY_2));
        paraProps = TestFixtures.paraProps();
        paraProps.setUrls(List.of(PARA_1));
        oracleProps = TestFixtures.oracleProps();
        Credentials credentials = TestFixtures.credentials();
        contract = new OracleContract(paraProps, credentials);
        tracker = new ReportTracker(new InMemoryReportRecordRepository(), contract);
    }

    private FakeChainReader relay1() {
        return relayNodes.get(RELAY_1);
    }

    private OracleEngine engine() {
        RecordingSleeper sleeper = new RecordingSleeper(clock);
        Duration pause = Duration.ofSeconds(oracleProps.getTimeoutSeconds());
        EndpointPool<ChainReader> relayPool = new EndpointPool<>(ChainSide.RELAY, relayProps.getUrls(),
                relayNodes::get, oracleProps.getMaxFailureRequests(), pause, sleeper);
        EndpointPool<ParachainGateway> paraPool = new EndpointPool<>(ChainSide.PARA, paraProps.getUrls(),
                url -> gateway, oracleProps.getMaxFailureRequests(), pause, sleeper);
        Credentials credentials = TestFixtures.credentials();
        return new OracleEngine(
                relayPool,
                paraPool,
                new ContractAbiVerifier(new DefaultResourceLoader(), new ObjectMapper(), paraProps),
                contract,
                tracker,
                new EraBoundaryLocator(relayProps, sleeper),
                new ReportBuilder(),
                new TxSubmitter(contract, credentials, paraProps, oracleProps, clock, sleeper),
                new Watchdog(clock, relayProps, oracleProps),
                clock
        );
    }

    private List<Long> reportedEras(String stash) {
        return gateway.getReports().stream()
                .filter(r -> r.stash().equals(stash))
                .map(FakeParachainGateway.Report::eraId)
                .toList();
    }

    @Test
    @DisplayName("Only strictly increasing eras are processed, each reporting the era before it")
    void eraSequence_reportsPreviousEraOnIncreaseOnly() throws InterruptedException {
        relay1().headEras(5, 5, 5, 7, 6, 8);
        OracleEngine engine = engine();

        for (int i = 0; i < 6; i++) {
            assertEquals(EngineOutcome.Kind.CONTINUE, engine.runCycle().kind());
        }

        assertEquals(List.of(4L, 6L, 7L), reportedEras(STASH_A));
        assertEquals(List.of(4L, 6L, 7L), reportedEras(STASH_B));
        assertEquals(8, engine.getLastProcessedEra());
        assertEquals(OracleState.MONITORING, engine.getState());
        assertEquals(OptionalLong.of(7), tracker.lastReportedEra(STASH_A));
    }

    @Test
    void statusSnapshot_reflectsLastPass() throws InterruptedException {
        relay1().headEras(7);
        OracleEngine engine = engine();
        engine.runCycle();

        OracleStatusSnapshot status = engine.statusSnapshot();
        assertEquals(OracleState.MONITORING, status.state());
        assertEquals(7, status.activeEra());
        assertEquals(7, status.lastProcessedEra());
        // last block of era 6
        assertEquals(29, status.lastBoundaryBlock());
        assertEquals(2, status.reportsSucceeded());
        assertEquals(RELAY_1, status.relayUrl());
        assertEquals(PARA_1, status.paraUrl());
        assertEquals(6L, status.lastReportedEras().get(STASH_A));
    }

    @Test
    @DisplayName("A reverted report keeps the era open and is retried without resubmitting the others")
    void revert_leavesTrackerUnchangedAndRetries() throws InterruptedException {
        relay1().headEras(5, 5, 5);
        gateway.revertOnChainFor(STASH_B);
        OracleEngine engine = engine();

        engine.runCycle();
        assertEquals(List.of(4L), reportedEras(STASH_A));
        assertTrue(reportedEras(STASH_B).isEmpty());
        assertEquals(OptionalLong.of(-1), tracker.lastReportedEra(STASH_B));
        assertEquals(-1, engine.getLastProcessedEra());
        assertEquals(1, engine.statusSnapshot().reportsReverted());

        engine.runCycle();
        assertEquals(List.of(4L), reportedEras(STASH_A));
        assertEquals(-1, engine.getLastProcessedEra());

        gateway.clearReverts();
        engine.runCycle();
        assertEquals(List.of(4L), reportedEras(STASH_A));
        assertEquals(List.of(4L), reportedEras(STASH_B));
        assertEquals(5, engine.getLastProcessedEra());
    }

    @Test
    @DisplayName("A report whose receipt timed out but was included is not sent again")
    void receiptTimeout_rechecksContractBeforeResubmitting() throws InterruptedException {
        relay1().headEras(5, 5);
        gateway.setReceiptDelayPolls(1000);
        OracleEngine engine = engine();

        assertEquals(EngineOutcome.Kind.CONTINUE, engine.runCycle().kind());
        assertEquals(1, gateway.getBroadcasts());
        assertEquals(OptionalLong.of(-1), tracker.lastReportedEra(STASH_A));
        assertEquals(-1, engine.getLastProcessedEra());

        gateway.setReceiptDelayPolls(0);
        engine.runCycle();

        assertEquals(List.of(4L), reportedEras(STASH_A));
        assertEquals(List.of(4L), reportedEras(STASH_B));
        assertEquals(2, gateway.getBroadcasts());
        assertEquals(OptionalLong.of(4), tracker.lastReportedEra(STASH_A));
        assertEquals(5, engine.getLastProcessedEra());
    }

    @Test
    void dryRunFailure_isNotBroadcast() throws InterruptedException {
        relay1().headEras(5);
        gateway.revertDryRunFor(STASH_A);
        OracleEngine engine = engine();

        engine.runCycle();

        assertTrue(reportedEras(STASH_A).isEmpty());
        assertEquals(List.of(4L), reportedEras(STASH_B));
        assertEquals(1, engine.statusSnapshot().reportsLikelyFailing());
        assertEquals(-1, engine.getLastProcessedEra());
    }

    @Test
    @DisplayName("Restarting after reports landed does not resubmit them")
    void restart_doesNotResubmit() throws InterruptedException {
        relay1().headEras(5);
        engine().runCycle();
        assertEquals(2, gateway.getReports().size());

        // fresh process: empty local tracker, same contract
        tracker = new ReportTracker(new InMemoryReportRecordRepository(), contract);
        relay1().headEras(5);
        OracleEngine restarted = engine();
        restarted.runCycle();

        assertEquals(2, gateway.getReports().size());
        assertEquals(5, restarted.getLastProcessedEra());
    }

    @Test
    void relayFailures_rotateEndpointAfterThreshold() throws InterruptedException {
        OracleEngine engine = engine();
        relay1().headEras(5);
        engine.runCycle();
        assertEquals(RELAY_1, engine.statusSnapshot().relayUrl());

        relay1().failNext(1);
        engine.runCycle();
        // one failure is within the threshold of 1: same endpoint
        assertEquals(RELAY_1, engine.statusSnapshot().relayUrl());
        assertEquals(1, engine.statusSnapshot().relayFailures().get(RELAY_1));

        relay1().failNext(1);
        engine.runCycle();
        assertEquals(RELAY_2, engine.statusSnapshot().relayUrl());
        assertTrue(relay1().isClosed());
        assertEquals(OracleState.MONITORING, engine.getState());
        assertEquals(2, engine.statusSnapshot().relayExceptions());
        assertEquals(0, engine.statusSnapshot().paraExceptions());

        // tracker survives the switch
        assertEquals(OptionalLong.of(4), tracker.lastReportedEra(STASH_A));
    }

    @Test
    void parachainFailure_reconnectsParachain() throws InterruptedException {
        OracleEngine engine = engine();
        relay1().headEras(5, 6);
        engine.runCycle();

        gateway.failNext(1);
        assertEquals(EngineOutcome.Kind.CONTINUE, engine.runCycle().kind());
        assertEquals(1, engine.statusSnapshot().paraFailures().get(PARA_1));
        assertEquals(1, engine.statusSnapshot().paraExceptions());
        assertEquals(0, engine.statusSnapshot().relayExceptions());
        assertTrue(gateway.isClosed());
    }

    @Test
    void debugMode_processesWithoutBroadcasting() throws InterruptedException {
        oracleProps.setDebug(true);
        relay1().headEras(5);
        OracleEngine engine = engine();

        engine.runCycle();

        assertEquals(0, gateway.getBroadcasts());
        assertEquals(2, gateway.getDryRuns().size());
        assertEquals(5, engine.getLastProcessedEra());
        assertEquals(OptionalLong.of(-1), tracker.lastReportedEra(STASH_A));
    }

    @Test
    void emptyStashList_marksEraHandled() throws InterruptedException {
        gateway.withStashes();
        relay1().headEras(5);
        OracleEngine engine = engine();

        engine.runCycle();

        assertEquals(5, engine.getLastProcessedEra());
        assertEquals(0, gateway.getBroadcasts());
    }

    @Test
    void boundaryNotFound_defersToNextPoll() throws InterruptedException {
        // era 5 never had a block
        relayNodes.put(RELAY_1, new FakeChainReader(RELAY_1, 49, b -> b < 30 ? 4 : 6).headEras(6));
        OracleEngine engine = engine();

        assertEquals(EngineOutcome.Kind.CONTINUE, engine.runCycle().kind());

        assertEquals(-1, engine.getLastProcessedEra());
        assertEquals(0, gateway.getBroadcasts());
        assertEquals(OracleState.MONITORING, engine.getState());
    }

    @Test
    void missingContractCode_isFatal() throws InterruptedException {
        gateway.setCode("0x");
        relay1().headEras(5);

        EngineOutcome outcome = engine().runCycle();

        assertEquals(EngineOutcome.Kind.FATAL_CONFIGURATION, outcome.kind());
        assertTrue(outcome.isTerminal());
    }

    @Test
    void stalledEra_triggersWatchdogTimeout() throws InterruptedException {
        relay1().headEras(5, 5, 5);
        OracleEngine engine = engine();

        assertFalse(engine.runCycle().isTerminal());
        clock.advance(Duration.ofSeconds(600));
        assertFalse(engine.runCycle().isTerminal());
        clock.advance(Duration.ofSeconds(301));
        EngineOutcome outcome = engine.runCycle();

        assertEquals(EngineOutcome.Kind.WATCHDOG_TIMEOUT, outcome.kind());
    }
}
