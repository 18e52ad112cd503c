package dao.relay.oracle.config;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "relay")
@Validated
@Data
public class RelayChainProperties {

    /**
     * Relay chain RPC endpoints, tried in list order.
     * Example: wss://kusama-rpc.polkadot.io, ws://localhost:9944
     */
    @NotEmpty
    private List<String> urls = new ArrayList<>();

    /**
     * Era length in relay blocks (Kusama: 3600).
     */
    @Positive
    private long eraDurationBlocks = 3600;

    /**
     * Era length in seconds (Kusama: 21600).
     */
    @Positive
    private long eraDurationSeconds = 21600;

    /**
     * Average relay block time, derived from the era length.
     */
    public long blockTimeMillis() {
        return Math.max(1000L, eraDurationSeconds * 1000L / eraDurationBlocks);
    }
}
