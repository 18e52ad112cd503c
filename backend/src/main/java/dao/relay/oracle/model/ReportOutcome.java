package dao.relay.oracle.model;

public enum ReportOutcome {
    /** Receipt with success status. */
    SUCCESS,
    /** Landed with a failure status, or rejected by the node on broadcast. */
    REVERTED,
    /** Dry run raised; nothing was signed or broadcast. */
    LIKELY_FAILING,
    /** Debug mode: built and dry-run only. */
    BUILT_ONLY
}
