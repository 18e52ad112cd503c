package dao.relay.oracle.model;

/**
 * Result of one engine cycle. Only the scheduler acts on terminal outcomes.
 */
public record EngineOutcome(Kind kind, String reason) {

    public enum Kind {
        CONTINUE,
        WATCHDOG_TIMEOUT,
        FATAL_CONFIGURATION
    }

    private static final EngineOutcome PROCEED = new EngineOutcome(Kind.CONTINUE, null);

    public static EngineOutcome proceed() {
        return PROCEED;
    }

    public static EngineOutcome watchdogTimeout(String reason) {
        return new EngineOutcome(Kind.WATCHDOG_TIMEOUT, reason);
    }

    public static EngineOutcome fatal(String reason) {
        return new EngineOutcome(Kind.FATAL_CONFIGURATION, reason);
    }

    public boolean isTerminal() {
        return kind != Kind.CONTINUE;
    }
}
