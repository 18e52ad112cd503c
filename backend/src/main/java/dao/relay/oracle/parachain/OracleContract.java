package dao.relay.oracle.parachain;

import dao.relay.oracle.config.ParachainProperties;
import dao.relay.oracle.model.ChainConnectionException;
import dao.relay.oracle.model.ChainSide;
import dao.relay.oracle.model.ReportedEra;
import dao.relay.oracle.model.StakingSnapshot;
import dao.relay.oracle.model.UnlockingChunk;
import lombok.Getter;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicStruct;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.StaticStruct;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint128;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

/**
 * ABI encoding and decoding of the oracle and coordinator contract calls.
 */
@Component
public class OracleContract {

    public static final String REPORT_RELAY_SIGNATURE =
            "reportRelay(uint64,(bytes32,bytes32,uint8,uint128,uint128,(uint128,uint64)[],uint32[],uint128,uint32))";

    private final String contractAddress;
    private final String coordinatorAddress;
    @Getter
    private final String oracleAddress;

    public OracleContract(ParachainProperties props, Credentials credentials) {
        this.contractAddress = props.getContractAddress();
        this.coordinatorAddress = props.hasCoordinator() ? props.getCoordinatorAddress() : null;
        this.oracleAddress = credentials.getAddress();
    }

    public String getContractAddress() {
        return contractAddress;
    }

    /**
     * Stash accounts the oracle must report, in contract order.
     */
    @SuppressWarnings({"rawtypes", "unchecked"})
    public List<String> getStashAccounts(ParachainGateway gateway) {
        Function fn = new Function(
                "getStashAccounts",
                Collections.emptyList(),
                List.of(new TypeReference<DynamicArray<Bytes32>>() {})
        );
        List<Type> decoded = callAndDecode(gateway, contractAddress, fn);
        List<Bytes32> values = ((DynamicArray<Bytes32>) decoded.get(0)).getValue();
        List<String> stashes = new ArrayList<>(values.size());
        for (Bytes32 v : values) {
            stashes.add(Numeric.toHexString(v.getValue()));
        }
        return stashes;
    }

    @SuppressWarnings("rawtypes")
    public ReportedEra isReportedLastEra(ParachainGateway gateway, String stash) {
        Function fn = new Function(
                "isReportedLastEra",
                List.of(new Address(oracleAddress), new Bytes32(Numeric.hexStringToByteArray(stash))),
                List.of(new TypeReference<Uint64>() {}, new TypeReference<Bool>() {})
        );
        List<Type> decoded = callAndDecode(gateway, contractAddress, fn);
        long eraId = ((Uint64) decoded.get(0)).getValue().longValueExact();
        boolean reported = ((Bool) decoded.get(1)).getValue();
        return new ReportedEra(eraId, reported);
    }

    /**
     * Current era according to the oracle coordinator, or empty when no coordinator is configured.
     */
    @SuppressWarnings("rawtypes")
    public OptionalLong coordinatorEraId(ParachainGateway gateway) {
        if (coordinatorAddress == null) {
            return OptionalLong.empty();
        }
        Function fn = new Function(
                "getCurrentEraId",
                Collections.emptyList(),
                List.of(new TypeReference<Uint64>() {})
        );
        List<Type> decoded = callAndDecode(gateway, coordinatorAddress, fn);
        return OptionalLong.of(((Uint64) decoded.get(0)).getValue().longValueExact());
    }

    /**
     * Call data for {@code reportRelay(eraId, report)}.
     */
    public String encodeReportRelay(long eraId, StakingSnapshot snapshot) {
        List<StaticStruct> unlocking = new ArrayList<>(snapshot.unlocking().size());
        for (UnlockingChunk chunk : snapshot.unlocking()) {
            unlocking.add(new StaticStruct(
                    new Uint128(chunk.amount()),
                    new Uint64(BigInteger.valueOf(chunk.era()))
            ));
        }
        List<Uint32> claimed = new ArrayList<>(snapshot.claimedRewards().size());
        for (Long era : snapshot.claimedRewards()) {
            claimed.add(new Uint32(BigInteger.valueOf(era)));
        }

        DynamicStruct report = new DynamicStruct(
                new Bytes32(Numeric.hexStringToByteArray(snapshot.stashAccount())),
                new Bytes32(Numeric.hexStringToByteArray(snapshot.controllerAccount())),
                new Uint8(BigInteger.valueOf(snapshot.stakeStatus().code())),
                new Uint128(snapshot.activeBalance()),
                new Uint128(snapshot.totalBalance()),
                new DynamicArray<>(StaticStruct.class, unlocking),
                new DynamicArray<>(Uint32.class, claimed),
                new Uint128(snapshot.stashBalance()),
                new Uint32(BigInteger.valueOf(snapshot.slashingSpans()))
        );

        return methodId(REPORT_RELAY_SIGNATURE)
                + FunctionEncoder.encodeConstructor(List.of(new Uint64(BigInteger.valueOf(eraId)), report));
    }

    /**
     * 4-byte selector of a canonical function signature, {@code 0x}-prefixed.
     */
    public static String methodId(String signature) {
        return Hash.sha3String(signature).substring(0, 10);
    }

    @SuppressWarnings("rawtypes")
    private List<Type> callAndDecode(ParachainGateway gateway, String to, Function fn) {
        String result = gateway.call(oracleAddress, to, FunctionEncoder.encode(fn));
        List<Type> decoded = FunctionReturnDecoder.decode(result, fn.getOutputParameters());
        if (decoded.size() != fn.getOutputParameters().size()) {
            throw new ChainConnectionException(ChainSide.PARA, gateway.url(),
                    fn.getName() + " returned unexpected data: " + result);
        }
        return decoded;
    }
}
