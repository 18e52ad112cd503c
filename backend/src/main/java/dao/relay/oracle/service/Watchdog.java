package dao.relay.oracle.service;

import dao.relay.oracle.config.OracleProperties;
import dao.relay.oracle.config.RelayChainProperties;
import dao.relay.oracle.model.WatchdogVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;

/**
 * Detects a relay era that stopped advancing.
 * <p>
 * Time between observations accumulates until the era id increases. Past one era plus the tolerance the
 * update is delayed; the coordinator contract, when configured, decides whether the oracle is stuck or the
 * whole network is.
 */
@Slf4j
@Service
public class Watchdog {

    private final Clock clock;
    private final Duration limit;

    private long lastEraId = -1;
    private Instant lastObservation;
    private Duration accumulated = Duration.ZERO;

    public Watchdog(Clock clock, RelayChainProperties relayProps, OracleProperties oracleProps) {
        this.clock = clock;
        this.limit = Duration.ofSeconds(relayProps.getEraDurationSeconds() + oracleProps.getEraDelayToleranceSeconds());
    }

    public synchronized WatchdogVerdict observe(long eraId, CoordinatorView coordinator) {
        Instant now = clock.instant();
        if (lastObservation != null) {
            accumulated = accumulated.plus(Duration.between(lastObservation, now));
        }
        lastObservation = now;

        if (eraId > lastEraId) {
            lastEraId = eraId;
            accumulated = Duration.ZERO;
            return WatchdogVerdict.OK;
        }
        if (accumulated.compareTo(limit) <= 0) {
            return WatchdogVerdict.OK;
        }

        log.warn("Era {} has not changed for {}s (limit {}s)", eraId, accumulated.toSeconds(), limit.toSeconds());
        OptionalLong coordinatorEra;
        try {
            coordinatorEra = coordinator.currentEraId();
        } catch (RuntimeException e) {
            log.error("Coordinator era check failed, treating the delay as confirmed: {}", e.getMessage());
            return WatchdogVerdict.TERMINATE;
        }
        if (coordinatorEra.isEmpty()) {
            return WatchdogVerdict.TERMINATE;
        }
        if (coordinatorEra.getAsLong() == eraId) {
            log.warn("Coordinator is also at era {}: network-wide stall, restarting the watchdog timer", eraId);
            accumulated = Duration.ZERO;
            return WatchdogVerdict.OK;
        }
        log.error("Coordinator is at era {} while the relay chain reports era {}", coordinatorEra.getAsLong(), eraId);
        return WatchdogVerdict.TERMINATE;
    }

    public synchronized long getAccumulatedSeconds() {
        return accumulated.toSeconds();
    }
}
