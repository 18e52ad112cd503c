package dao.relay.oracle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    /**
     * Enable/disable the oracle poll loop
     * Default: true
     */
    private boolean enabled = true;

    /**
     * How often to read the active era (in seconds)
     * Default: 300s (5 minutes)
     */
    private long pollIntervalSeconds = 300;
}
