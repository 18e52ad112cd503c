package dao.relay.oracle.service;

import dao.relay.oracle.config.RelayChainProperties;
import dao.relay.oracle.model.BlockRef;
import dao.relay.oracle.model.BoundaryNotFoundException;
import dao.relay.oracle.support.FakeChainReader;
import dao.relay.oracle.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EraBoundaryLocatorTest {

    // uneven era lengths: era 10 = [0,37), 11 = [37,38), 12 = [38,120), 13 = [120,200), 14 = [200, ...)
    private static final long[] ERA_STARTS = {0, 37, 38, 120, 200};

    private RecordingSleeper sleeper;
    private EraBoundaryLocator locator;

    @BeforeEach
    void setUp() {
        RelayChainProperties props = new RelayChainProperties();
        props.setEraDurationBlocks(250);
        props.setEraDurationSeconds(1500);
        sleeper = new RecordingSleeper();
        locator = new EraBoundaryLocator(props, sleeper);
    }

    private static long eraOf(long block) {
        long era = 10;
        for (int i = 1; i < ERA_STARTS.length; i++) {
            if (block >= ERA_STARTS[i]) {
                era = 10 + i;
            }
        }
        return era;
    }

    private static long lastBlockOf(long era) {
        return ERA_STARTS[(int) (era - 10) + 1] - 1;
    }

    @Test
    @DisplayName("Boundary is exact for every completed era in the window")
    void locate_everyTarget() {
        FakeChainReader reader = new FakeChainReader("ws://relay", 230, EraBoundaryLocatorTest::eraOf);

        for (long era = 10; era <= 13; era++) {
            BlockRef ref = locator.locate(reader, era);
            assertEquals(lastBlockOf(era), ref.number(), "era " + era);
            assertEquals(reader.hashOf(ref.number()), ref.hash());
            assertEquals(era, eraOf(ref.number()));
            assertTrue(eraOf(ref.number() + 1) > era);
        }
    }

    @Test
    void locate_everyHeadPosition() {
        // sweep the head across the chain; era 12 must resolve to #119 whenever the head is past it
        for (long head = 120; head < 300; head += 7) {
            FakeChainReader reader = new FakeChainReader("ws://relay", head, EraBoundaryLocatorTest::eraOf);
            assertEquals(119, locator.locate(reader, 12).number(), "head " + head);
        }
    }

    @Test
    void locate_headStillInEra_returnsHead() {
        FakeChainReader reader = new FakeChainReader("ws://relay", 150, EraBoundaryLocatorTest::eraOf);
        assertEquals(150, locator.locate(reader, 13).number());
    }

    @Test
    void locate_futureEra_notFound() {
        FakeChainReader reader = new FakeChainReader("ws://relay", 150, EraBoundaryLocatorTest::eraOf);
        assertThrows(BoundaryNotFoundException.class, () -> locator.locate(reader, 14));
    }

    @Test
    void locate_eraBeforeWindow_notFound() {
        // window is [head - 250, head] = [150, 400]: era 11 ends long before it
        FakeChainReader reader = new FakeChainReader("ws://relay", 400, EraBoundaryLocatorTest::eraOf);
        BoundaryNotFoundException e = assertThrows(BoundaryNotFoundException.class, () -> locator.locate(reader, 11));
        assertEquals(11, e.getEraId());
    }

    @Test
    void locate_skippedEra_notFound() {
        // era 5 for blocks < 50, era 7 afterwards
        FakeChainReader reader = new FakeChainReader("ws://relay", 80, b -> b < 50 ? 5 : 7);
        assertThrows(BoundaryNotFoundException.class, () -> locator.locate(reader, 6));
        assertEquals(49, locator.locate(reader, 5).number());
    }

    @Test
    void locate_missingBlockHash_neverFabricates() {
        FakeChainReader reader = new FakeChainReader("ws://relay", 230, EraBoundaryLocatorTest::eraOf);
        // first probe of the search: lo = 0, hi = 230, mid = 115
        reader.removeBlock(115);
        assertThrows(BoundaryNotFoundException.class, () -> locator.locate(reader, 12));
    }

    @Test
    void locate_windowClampedAtGenesis() {
        FakeChainReader reader = new FakeChainReader("ws://relay", 40, EraBoundaryLocatorTest::eraOf);
        assertEquals(36, locator.locate(reader, 10).number());
        assertEquals(37, locator.locate(reader, 11).number());
    }

    @Test
    void awaitFinalized_pollsOneBlockTimeUntilFinal() throws InterruptedException {
        FakeChainReader reader = new FakeChainReader("ws://relay", 230, EraBoundaryLocatorTest::eraOf);
        reader.setFinalized(110, 3);
        BlockRef boundary = locator.locate(reader, 12);

        BlockRef finalBoundary = locator.awaitFinalized(reader, 12, boundary);

        assertEquals(boundary, finalBoundary);
        // finalized: 110, 113, 116, 119
        assertEquals(3, sleeper.getSleeps().size());
        assertEquals(Duration.ofSeconds(6), sleeper.getSleeps().get(0));
    }

    @Test
    void awaitFinalized_detectsReorg() {
        FakeChainReader reader = new FakeChainReader("ws://relay", 230, EraBoundaryLocatorTest::eraOf);
        reader.setFinalized(118, 1);
        BlockRef boundary = locator.locate(reader, 12);
        reader.reorg(119);

        assertThrows(BoundaryNotFoundException.class, () -> locator.awaitFinalized(reader, 12, boundary));
    }
}
