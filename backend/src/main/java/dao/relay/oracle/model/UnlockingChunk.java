package dao.relay.oracle.model;

import java.math.BigInteger;

public record UnlockingChunk(BigInteger amount, long era) {}
