package dao.relay.oracle.model;

/**
 * Active era as stored in {@code Staking.ActiveEra}.
 *
 * @param eraId          era index
 * @param startTimestamp era start in unix millis, {@code null} while the era has not started yet
 */
public record Era(long eraId, Long startTimestamp) {}
