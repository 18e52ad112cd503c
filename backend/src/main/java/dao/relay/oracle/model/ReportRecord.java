package dao.relay.oracle.model;

/**
 * Last era accepted by the contract for a stash. {@code -1} means nothing was reported yet.
 */
public record ReportRecord(String stashAccount, long lastReportedEra) {}
