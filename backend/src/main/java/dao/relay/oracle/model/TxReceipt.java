package dao.relay.oracle.model;

public record TxReceipt(String txHash, long blockNumber, boolean success) {}
