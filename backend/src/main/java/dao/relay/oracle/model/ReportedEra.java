package dao.relay.oracle.model;

/**
 * Result of the contract's {@code isReportedLastEra(oracle, stash)}.
 */
public record ReportedEra(long eraId, boolean reported) {

    /**
     * Last era the oracle has fully reported: the recorded era if flagged, otherwise the one before.
     */
    public long effectiveLastReported() {
        return reported ? eraId : eraId - 1;
    }
}
