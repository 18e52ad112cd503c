package dao.relay.oracle.model;

public record BlockRef(long number, String hash) {}
