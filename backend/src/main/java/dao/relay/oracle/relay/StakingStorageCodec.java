package dao.relay.oracle.relay;

import dao.relay.oracle.model.Era;
import dao.relay.oracle.model.StakingLedger;
import dao.relay.oracle.model.UnlockingChunk;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decoders for the staking storage values, following the current Substrate runtime layouts.
 */
public final class StakingStorageCodec {
    private StakingStorageCodec() {}

    /**
     * ActiveEraInfo { index: u32, start: Option<u64> }
     */
    public static Era decodeActiveEra(String hex) {
        ScaleReader r = ScaleReader.ofHex(hex);
        long index = r.readU32();
        Long start = r.readBool() ? r.readU64().longValueExact() : null;
        return new Era(index, start);
    }

    /**
     * StakingLedger { stash, total: Compact<u128>, active: Compact<u128>,
     * unlocking: Vec<{ value: Compact<u128>, era: Compact<u32> }>, claimed_rewards: Vec<u32> }.
     * Runtimes that dropped the claimed rewards vector decode to an empty list.
     */
    public static StakingLedger decodeLedger(String hex, int slashingSpans) {
        ScaleReader r = ScaleReader.ofHex(hex);
        String stash = r.readAccountId();
        BigInteger total = r.readCompact();
        BigInteger active = r.readCompact();
        int chunks = r.readCompactInt();
        List<UnlockingChunk> unlocking = new ArrayList<>(chunks);
        for (int i = 0; i < chunks; i++) {
            BigInteger value = r.readCompact();
            long era = r.readCompact().longValueExact();
            unlocking.add(new UnlockingChunk(value, era));
        }
        List<Long> claimedRewards = new ArrayList<>();
        if (r.remaining() > 0) {
            int eras = r.readCompactInt();
            for (int i = 0; i < eras; i++) {
                claimedRewards.add(r.readU32());
            }
        }
        return new StakingLedger(stash, total, active, List.copyOf(unlocking), List.copyOf(claimedRewards), slashingSpans);
    }

    /**
     * SlashingSpans { span_index: u32, last_start: u32, last_nonzero_slash: u32, prior: Vec<u32> }.
     * The reported count is the number of prior spans.
     */
    public static int decodeSlashingSpanCount(String hex) {
        if (hex == null) {
            return 0;
        }
        ScaleReader r = ScaleReader.ofHex(hex);
        r.skip(12);
        return r.readCompactInt();
    }

    /**
     * AccountInfo { nonce, consumers, providers, sufficients: u32, data: { free: u128, ... } }.
     */
    public static BigInteger decodeFreeBalance(String hex) {
        if (hex == null) {
            return BigInteger.ZERO;
        }
        ScaleReader r = ScaleReader.ofHex(hex);
        r.skip(16);
        return r.readU128();
    }

    /**
     * Vec<AccountId32>
     */
    public static Set<String> decodeAccountList(String hex) {
        if (hex == null) {
            return Set.of();
        }
        ScaleReader r = ScaleReader.ofHex(hex);
        int n = r.readCompactInt();
        Set<String> accounts = new LinkedHashSet<>(n * 2);
        for (int i = 0; i < n; i++) {
            accounts.add(r.readAccountId());
        }
        return accounts;
    }
}
