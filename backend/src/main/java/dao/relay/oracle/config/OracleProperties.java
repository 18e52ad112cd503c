package dao.relay.oracle.config;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "oracle")
@Validated
@Data
public class OracleProperties {

    /**
     * Consecutive failures after which an endpoint is skipped on the next reconnect.
     */
    @PositiveOrZero
    private int maxFailureRequests = 10;

    /**
     * Pause between two full passes over an endpoint list, also used as the RPC request timeout.
     */
    @PositiveOrZero
    private long timeoutSeconds = 60;

    /**
     * Extra time on top of one era before the watchdog considers the era update delayed.
     */
    @PositiveOrZero
    private long eraDelayToleranceSeconds = 1800;

    /**
     * Pause between a watchdog verdict and the process exit.
     */
    @PositiveOrZero
    private long watchdogGraceSeconds = 30;

    /**
     * Build and dry-run reports without broadcasting them.
     */
    private boolean debug = false;
}
