package dao.relay.oracle.service;

import dao.relay.oracle.model.StakeStatus;
import dao.relay.oracle.model.StakingLedger;
import dao.relay.oracle.model.StakingSnapshot;
import dao.relay.oracle.model.UnlockingChunk;
import dao.relay.oracle.support.FakeChainReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static dao.relay.oracle.support.TestFixtures.CONTROLLER;
import static dao.relay.oracle.support.TestFixtures.STASH_A;
import static dao.relay.oracle.support.TestFixtures.STASH_B;
import static dao.relay.oracle.support.TestFixtures.STASH_C;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportBuilderTest {

    private FakeChainReader reader;
    private ReportBuilder builder;
    private String blockHash;

    @BeforeEach
    void setUp() {
        reader = new FakeChainReader("ws://relay", 50, b -> 3);
        builder = new ReportBuilder();
        blockHash = reader.hashOf(40);
    }

    private static StakingLedger ledger(String stash) {
        return new StakingLedger(stash, BigInteger.valueOf(1000), BigInteger.valueOf(800),
                List.of(new UnlockingChunk(BigInteger.valueOf(150), 5), new UnlockingChunk(BigInteger.valueOf(50), 6)),
                List.of(3L, 4L),
                2);
    }

    @Test
    void unbondedStash_reportsNone() {
        reader.setFreeBalance(STASH_A, BigInteger.valueOf(77));

        StakingSnapshot s = builder.build(reader, STASH_A, blockHash);

        assertEquals(StakeStatus.NONE, s.stakeStatus());
        assertEquals(STASH_A, s.controllerAccount());
        assertEquals(BigInteger.ZERO, s.activeBalance());
        assertEquals(BigInteger.ZERO, s.totalBalance());
        assertTrue(s.unlocking().isEmpty());
        assertEquals(0, s.slashingSpans());
        assertTrue(s.claimedRewards().isEmpty());
        assertEquals(BigInteger.valueOf(77), s.stashBalance());
        assertEquals(blockHash, s.blockHash());
    }

    @Test
    void controllerWithoutLedger_reportsNone() {
        reader.bond(STASH_A, CONTROLLER, null);

        StakingSnapshot s = builder.build(reader, STASH_A, blockHash);

        assertEquals(StakeStatus.NONE, s.stakeStatus());
        assertEquals(STASH_A, s.controllerAccount());
    }

    @Test
    void bondedStash_readsLedger() {
        reader.bond(STASH_A, CONTROLLER, ledger(STASH_A));
        reader.setFreeBalance(STASH_A, BigInteger.valueOf(1200));

        StakingSnapshot s = builder.build(reader, STASH_A, blockHash);

        assertEquals(StakeStatus.IDLE, s.stakeStatus());
        assertEquals(CONTROLLER, s.controllerAccount());
        assertEquals(BigInteger.valueOf(800), s.activeBalance());
        assertEquals(BigInteger.valueOf(1000), s.totalBalance());
        assertEquals(List.of(new UnlockingChunk(BigInteger.valueOf(150), 5), new UnlockingChunk(BigInteger.valueOf(50), 6)),
                s.unlocking());
        assertEquals(2, s.slashingSpans());
        assertEquals(BigInteger.valueOf(1200), s.stashBalance());
        assertEquals(List.of(3L, 4L), s.claimedRewards());
    }

    @Test
    void validatorMembership_winsOverNominator() {
        reader.bond(STASH_A, CONTROLLER, ledger(STASH_A));
        reader.bond(STASH_B, STASH_B, ledger(STASH_B));
        reader.addValidator(STASH_A);
        reader.addNominator(STASH_A);
        reader.addNominator(STASH_B);

        assertEquals(StakeStatus.VALIDATOR, builder.build(reader, STASH_A, blockHash).stakeStatus());
        assertEquals(StakeStatus.NOMINATOR, builder.build(reader, STASH_B, blockHash).stakeStatus());
    }

    @Test
    void stakerSets_areReadOncePerBlock() {
        reader.bond(STASH_A, CONTROLLER, ledger(STASH_A));
        reader.bond(STASH_B, STASH_B, ledger(STASH_B));
        reader.bond(STASH_C, STASH_C, ledger(STASH_C));

        builder.build(reader, STASH_A, blockHash);
        builder.build(reader, STASH_B, blockHash);
        builder.build(reader, STASH_C, blockHash);
        assertEquals(1, reader.getValidatorQueries());

        builder.build(reader, STASH_A, reader.hashOf(41));
        assertEquals(2, reader.getValidatorQueries());
    }
}
