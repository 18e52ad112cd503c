package dao.relay.oracle.model;

/**
 * Stake status as encoded in the report (uint8).
 */
public enum StakeStatus {
    IDLE(0),
    NOMINATOR(1),
    VALIDATOR(2),
    NONE(3);

    private final int code;

    StakeStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
