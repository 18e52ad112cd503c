package dao.relay.oracle.relay;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.relay.oracle.service.EndpointConnector;

import java.time.Duration;

public class SubstrateChainReaderConnector implements EndpointConnector<ChainReader> {

    private final ObjectMapper mapper;
    private final Duration timeout;

    public SubstrateChainReaderConnector(ObjectMapper mapper, Duration timeout) {
        this.mapper = mapper;
        this.timeout = timeout;
    }

    @Override
    public ChainReader connect(String url) {
        SubstrateChainReader reader = new SubstrateChainReader(new SubstrateRpcClient(url, mapper, timeout));
        reader.probe();
        return reader;
    }
}
