package dao.relay.oracle.model;

public enum WatchdogVerdict {
    OK,
    TERMINATE
}
