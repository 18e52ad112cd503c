package dao.relay.oracle.model;

import java.math.BigInteger;
import java.util.Map;

public record OracleStatusSnapshot(
        OracleState state,
        long activeEra,
        long lastProcessedEra,
        Map<String, Long> lastReportedEras,
        Map<String, Integer> relayFailures,
        Map<String, Integer> paraFailures,
        long watchdogAccumulatedSeconds,
        long lastBoundaryBlock,
        long lastReportEpochSeconds,
        BigInteger totalStashFreeBalance,
        String relayUrl,
        String paraUrl,
        long reportsSucceeded,
        long reportsReverted,
        long reportsLikelyFailing,
        long relayExceptions,
        long paraExceptions
) {}
