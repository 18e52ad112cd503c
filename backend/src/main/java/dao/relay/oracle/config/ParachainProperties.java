package dao.relay.oracle.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "para")
@Validated
@Data
public class ParachainProperties {

    /**
     * Parachain (EVM) RPC endpoints, tried in list order.
     */
    @NotEmpty
    private List<String> urls = new ArrayList<>();

    /**
     * Oracle contract address (0x-prefixed, 20 bytes).
     */
    @NotBlank
    private String contractAddress;

    /**
     * Optional oracle coordinator contract used by the watchdog to cross-check the current era.
     */
    private String coordinatorAddress;

    /**
     * Location of the oracle contract ABI (classpath: or file: resource).
     */
    @NotBlank
    private String abiPath = "classpath:abi/oracle.json";

    /**
     * Oracle account private key (hex, 32 bytes).
     */
    @NotBlank
    private String privateKey;

    @Positive
    private BigInteger gasLimit = BigInteger.valueOf(10_000_000L);

    @PositiveOrZero
    private BigInteger maxPriorityFeePerGas = BigInteger.valueOf(1_000_000_000L);

    /**
     * Blocks to wait on top of a successful report before moving to the next stash.
     */
    @PositiveOrZero
    private int confirmationBlocks = 2;

    private Polling polling = new Polling();

    public boolean hasCoordinator() {
        return coordinatorAddress != null && !coordinatorAddress.isBlank();
    }

    @Data
    public static class Polling {
        /**
         * Timeout for getting the receipt after broadcasting a report.
         */
        private long receiptTimeoutSeconds = 120;
        /**
         * Initial poll interval for the receipt.
         */
        private long receiptPollInitialMs = 500;
        /**
         * Maximum poll interval for the receipt (backoff cap).
         */
        private long receiptPollMaxMs = 6000;
    }
}
