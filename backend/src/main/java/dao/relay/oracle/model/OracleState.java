package dao.relay.oracle.model;

import java.util.Locale;

public enum OracleState {
    STARTING,
    MONITORING,
    PROCESSING,
    RECOVERING;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
