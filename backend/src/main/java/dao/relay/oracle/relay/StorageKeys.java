package dao.relay.oracle.relay;

import dao.relay.oracle.util.CryptoUtil;
import org.web3j.utils.Numeric;

/**
 * Storage key derivation for the staking items the oracle reads.
 */
public final class StorageKeys {
    private StorageKeys() {}

    public enum Hasher {
        TWOX64_CONCAT,
        BLAKE2_128_CONCAT
    }

    public static final String ACTIVE_ERA = plain("Staking", "ActiveEra");
    public static final String SESSION_VALIDATORS = plain("Session", "Validators");
    public static final String NOMINATORS_PREFIX = plain("Staking", "Nominators");

    public static String plain(String pallet, String item) {
        return CryptoUtil.toHex0x(CryptoUtil.concat(CryptoUtil.twox128(pallet), CryptoUtil.twox128(item)));
    }

    public static String map(String pallet, String item, Hasher hasher, byte[] key) {
        byte[] prefix = CryptoUtil.concat(CryptoUtil.twox128(pallet), CryptoUtil.twox128(item));
        return CryptoUtil.toHex0x(CryptoUtil.concat(prefix, hashKey(hasher, key)));
    }

    public static String bonded(String stash) {
        return map("Staking", "Bonded", Hasher.TWOX64_CONCAT, accountBytes(stash));
    }

    public static String ledger(String controller) {
        return map("Staking", "Ledger", Hasher.BLAKE2_128_CONCAT, accountBytes(controller));
    }

    public static String slashingSpans(String stash) {
        return map("Staking", "SlashingSpans", Hasher.TWOX64_CONCAT, accountBytes(stash));
    }

    public static String systemAccount(String account) {
        return map("System", "Account", Hasher.BLAKE2_128_CONCAT, accountBytes(account));
    }

    /**
     * Account id stored at the end of a twox64concat map key.
     */
    public static String accountFromMapKey(String storageKey) {
        String clean = Numeric.cleanHexPrefix(storageKey);
        if (clean.length() < 64) {
            throw new IllegalArgumentException("Storage key too short for an account id: " + storageKey);
        }
        return "0x" + clean.substring(clean.length() - 64).toLowerCase();
    }

    static byte[] accountBytes(String account) {
        byte[] bytes = Numeric.hexStringToByteArray(account);
        if (bytes.length != 32) {
            throw new IllegalArgumentException("Account id must be 32 bytes, got " + bytes.length + ": " + account);
        }
        return bytes;
    }

    private static byte[] hashKey(Hasher hasher, byte[] key) {
        return switch (hasher) {
            case TWOX64_CONCAT -> CryptoUtil.concat(CryptoUtil.twox64(key), key);
            case BLAKE2_128_CONCAT -> CryptoUtil.concat(CryptoUtil.blake2b128(key), key);
        };
    }
}
