package dao.relay.oracle.relay;

import com.fasterxml.jackson.databind.JsonNode;
import dao.relay.oracle.model.ChainConnectionException;
import dao.relay.oracle.model.ChainSide;
import dao.relay.oracle.model.Era;
import dao.relay.oracle.model.StakingLedger;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link ChainReader} backed by the Substrate JSON-RPC {@code state_*} and {@code chain_*} methods.
 */
@Slf4j
public class SubstrateChainReader implements ChainReader {

    static final int KEYS_PAGE_SIZE = 1000;

    private final SubstrateRpcClient rpc;

    public SubstrateChainReader(SubstrateRpcClient rpc) {
        this.rpc = rpc;
    }

    @Override
    public String url() {
        return rpc.url();
    }

    /**
     * Cheap round trip used to validate a fresh connection.
     */
    public void probe() {
        JsonNode health = rpc.call("system_health");
        if (health == null || !health.isObject()) {
            throw new ChainConnectionException(ChainSide.RELAY, url(), "system_health returned " + health);
        }
        log.debug("Relay node {} health: peers={}, syncing={}", url(),
                health.path("peers").asLong(), health.path("isSyncing").asBoolean());
    }

    @Override
    public Optional<Era> activeEra(String blockHash) {
        return storage(StorageKeys.ACTIVE_ERA, blockHash)
                .map(hex -> decode("ActiveEra", () -> StakingStorageCodec.decodeActiveEra(hex)));
    }

    @Override
    public Optional<String> blockHash(long number) {
        return Optional.ofNullable(rpc.callForText("chain_getBlockHash", number));
    }

    @Override
    public String chainHead() {
        return required(rpc.callForText("chain_getBlockHash"), "chain_getBlockHash");
    }

    @Override
    public String finalizedHead() {
        return required(rpc.callForText("chain_getFinalizedHead"), "chain_getFinalizedHead");
    }

    @Override
    public long blockNumber(String blockHash) {
        JsonNode header = rpc.call("chain_getHeader", blockHash);
        if (header == null || header.isNull() || !header.hasNonNull("number")) {
            throw new ChainConnectionException(ChainSide.RELAY, url(), "No header for block " + blockHash);
        }
        String number = header.get("number").asText();
        return decode("header number", () -> new BigInteger(number.replaceFirst("^0x", ""), 16).longValueExact());
    }

    @Override
    public Optional<String> bondedController(String stash, String blockHash) {
        return storage(StorageKeys.bonded(stash), blockHash)
                .map(hex -> decode("Bonded", () -> ScaleReader.ofHex(hex).readAccountId()));
    }

    @Override
    public Optional<StakingLedger> ledger(String controller, String blockHash) {
        Optional<String> raw = storage(StorageKeys.ledger(controller), blockHash);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        StakingLedger partial = decode("Ledger", () -> StakingStorageCodec.decodeLedger(raw.get(), 0));
        String spansHex = storage(StorageKeys.slashingSpans(partial.stash()), blockHash).orElse(null);
        int spans = decode("SlashingSpans", () -> StakingStorageCodec.decodeSlashingSpanCount(spansHex));
        return Optional.of(new StakingLedger(partial.stash(), partial.total(), partial.active(), partial.unlocking(),
                partial.claimedRewards(), spans));
    }

    @Override
    public Set<String> validators(String blockHash) {
        String hex = storage(StorageKeys.SESSION_VALIDATORS, blockHash).orElse(null);
        return decode("Session.Validators", () -> StakingStorageCodec.decodeAccountList(hex));
    }

    @Override
    public Set<String> nominators(String blockHash) {
        Set<String> result = new LinkedHashSet<>();
        String startKey = null;
        while (true) {
            JsonNode page = rpc.call("state_getKeysPaged", StorageKeys.NOMINATORS_PREFIX, KEYS_PAGE_SIZE, startKey, blockHash);
            if (page == null || !page.isArray()) {
                throw new ChainConnectionException(ChainSide.RELAY, url(), "state_getKeysPaged returned " + page);
            }
            for (JsonNode key : page) {
                startKey = key.asText();
                String k = startKey;
                result.add(decode("Nominators key", () -> StorageKeys.accountFromMapKey(k)));
            }
            if (page.size() < KEYS_PAGE_SIZE) {
                return result;
            }
        }
    }

    @Override
    public BigInteger freeBalance(String account, String blockHash) {
        String hex = storage(StorageKeys.systemAccount(account), blockHash).orElse(null);
        return decode("System.Account", () -> StakingStorageCodec.decodeFreeBalance(hex));
    }

    private Optional<String> storage(String key, String blockHash) {
        String value = blockHash == null
                ? rpc.callForText("state_getStorage", key)
                : rpc.callForText("state_getStorage", key, blockHash);
        return Optional.ofNullable(value);
    }

    private String required(String value, String method) {
        if (value == null) {
            throw new ChainConnectionException(ChainSide.RELAY, url(), method + " returned null");
        }
        return value;
    }

    private <T> T decode(String what, Supplier<T> decoder) {
        try {
            return decoder.get();
        } catch (IllegalStateException | IllegalArgumentException | ArithmeticException e) {
            throw new ChainConnectionException(ChainSide.RELAY, url(), "Malformed " + what + ": " + e.getMessage(), e);
        }
    }
}
