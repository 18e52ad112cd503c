package dao.relay.oracle.model;

public enum ChainSide {
    RELAY,
    PARA
}
