package dao.relay.oracle.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.relay.oracle.model.ChainSide;
import dao.relay.oracle.model.OracleConfigurationException;
import dao.relay.oracle.parachain.ParachainGateway;
import dao.relay.oracle.parachain.Web3jParachainConnector;
import dao.relay.oracle.relay.ChainReader;
import dao.relay.oracle.relay.SubstrateChainReaderConnector;
import dao.relay.oracle.service.EndpointPool;
import dao.relay.oracle.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;
import org.web3j.utils.Numeric;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Slf4j
@Configuration
public class OracleConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public Credentials oracleCredentials(ParachainProperties props) {
        String key = Numeric.cleanHexPrefix(props.getPrivateKey().trim());
        if (!key.matches("[0-9a-fA-F]{64}")) {
            throw new OracleConfigurationException("para.private-key must be 32 bytes of hex");
        }
        Credentials credentials = Credentials.create(key);
        log.info("Oracle account: {}", credentials.getAddress());
        return credentials;
    }

    @Bean
    public EndpointPool<ChainReader> relayEndpointPool(RelayChainProperties relayProps,
                                                        OracleProperties oracleProps,
                                                        ObjectMapper mapper,
                                                        Sleeper sleeper) {
        Duration timeout = requestTimeout(oracleProps);
        return pool(ChainSide.RELAY, relayProps.getUrls(),
                new EndpointPool<>(ChainSide.RELAY, relayProps.getUrls(),
                        new SubstrateChainReaderConnector(mapper, timeout),
                        oracleProps.getMaxFailureRequests(), timeout, sleeper));
    }

    @Bean
    public EndpointPool<ParachainGateway> paraEndpointPool(ParachainProperties paraProps,
                                                           OracleProperties oracleProps,
                                                           Sleeper sleeper) {
        return pool(ChainSide.PARA, paraProps.getUrls(),
                new EndpointPool<>(ChainSide.PARA, paraProps.getUrls(),
                        new Web3jParachainConnector(),
                        oracleProps.getMaxFailureRequests(), requestTimeout(oracleProps), sleeper));
    }

    private static <T extends AutoCloseable> EndpointPool<T> pool(ChainSide side, List<String> configured, EndpointPool<T> pool) {
        if (pool.getUrls().isEmpty()) {
            throw new OracleConfigurationException("No valid " + side + " endpoint URL in " + configured);
        }
        log.info("{} endpoints: {}", side, pool.getUrls());
        return pool;
    }

    private static Duration requestTimeout(OracleProperties props) {
        return Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
    }
}
