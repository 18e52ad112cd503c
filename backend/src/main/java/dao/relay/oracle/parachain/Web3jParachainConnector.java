package dao.relay.oracle.parachain;

import dao.relay.oracle.model.ChainConnectionException;
import dao.relay.oracle.model.ChainSide;
import dao.relay.oracle.service.EndpointConnector;
import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.http.HttpService;
import org.web3j.protocol.websocket.WebSocketService;

import java.net.ConnectException;
import java.util.Locale;

/**
 * Opens web3j connections: WebSocket for ws/wss URLs, HTTP otherwise.
 */
@Slf4j
public class Web3jParachainConnector implements EndpointConnector<ParachainGateway> {

    @Override
    public ParachainGateway connect(String url) {
        Web3jService service;
        if (url.toLowerCase(Locale.ROOT).startsWith("ws")) {
            WebSocketService ws = new WebSocketService(url, false);
            try {
                ws.connect();
            } catch (ConnectException e) {
                throw new ChainConnectionException(ChainSide.PARA, url, "WebSocket connect failed: " + e.getMessage(), e);
            }
            service = ws;
        } else {
            service = new HttpService(url);
        }

        Web3jParachainGateway gateway = new Web3jParachainGateway(url, Web3j.build(service));
        try {
            long chainId = gateway.chainId();
            log.info("Connected to parachain {} (chainId={})", url, chainId);
            return gateway;
        } catch (RuntimeException e) {
            gateway.close();
            throw e;
        }
    }
}
