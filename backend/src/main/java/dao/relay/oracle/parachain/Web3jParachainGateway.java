package dao.relay.oracle.parachain;

import dao.relay.oracle.model.ChainConnectionException;
import dao.relay.oracle.model.ChainSide;
import dao.relay.oracle.model.ContractCallException;
import dao.relay.oracle.model.TxReceipt;
import lombok.extern.slf4j.Slf4j;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.ClientConnectionException;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Optional;

@Slf4j
public class Web3jParachainGateway implements ParachainGateway {

    private final String url;
    private final Web3j web3j;

    public Web3jParachainGateway(String url, Web3j web3j) {
        this.url = url;
        this.web3j = web3j;
    }

    @Override
    public String url() {
        return url;
    }

    @Override
    public String call(String from, String to, String data) {
        EthCall resp = send(web3j.ethCall(
                Transaction.createEthCallTransaction(from, to, data),
                DefaultBlockParameterName.LATEST), "eth_call");
        if (resp.hasError() || resp.isReverted()) {
            String reason = resp.getRevertReason() != null
                    ? resp.getRevertReason()
                    : resp.hasError() ? resp.getError().getMessage() : "reverted";
            throw new ContractCallException("eth_call to " + to + " reverted: " + reason);
        }
        return resp.getValue();
    }

    @Override
    public BigInteger pendingNonce(String address) {
        return checked(send(web3j.ethGetTransactionCount(address, DefaultBlockParameterName.PENDING),
                "eth_getTransactionCount"), "eth_getTransactionCount").getTransactionCount();
    }

    @Override
    public long chainId() {
        return checked(send(web3j.ethChainId(), "eth_chainId"), "eth_chainId").getChainId().longValueExact();
    }

    @Override
    public BigInteger gasPrice() {
        return checked(send(web3j.ethGasPrice(), "eth_gasPrice"), "eth_gasPrice").getGasPrice();
    }

    @Override
    public String sendRawTransaction(String signedTxHex) {
        EthSendTransaction resp = send(web3j.ethSendRawTransaction(signedTxHex), "eth_sendRawTransaction");
        if (resp.hasError()) {
            throw new ContractCallException("eth_sendRawTransaction rejected: " + resp.getError().getMessage());
        }
        return resp.getTransactionHash();
    }

    @Override
    public Optional<TxReceipt> receipt(String txHash) {
        Optional<TransactionReceipt> receipt = checked(send(web3j.ethGetTransactionReceipt(txHash),
                "eth_getTransactionReceipt"), "eth_getTransactionReceipt").getTransactionReceipt();
        return receipt.map(r -> new TxReceipt(txHash, r.getBlockNumber().longValueExact(), r.isStatusOK()));
    }

    @Override
    public long blockNumber() {
        return checked(send(web3j.ethBlockNumber(), "eth_blockNumber"), "eth_blockNumber")
                .getBlockNumber().longValueExact();
    }

    @Override
    public String code(String address) {
        return checked(send(web3j.ethGetCode(address, DefaultBlockParameterName.LATEST), "eth_getCode"),
                "eth_getCode").getCode();
    }

    @Override
    public void close() {
        try {
            web3j.shutdown();
        } catch (RuntimeException e) {
            log.warn("Closing parachain connection {} failed: {}", url, e.getMessage());
        }
    }

    private <R extends Response<?>> R send(Request<?, R> request, String method) {
        try {
            return request.send();
        } catch (IOException | ClientConnectionException | WebsocketNotConnectedException e) {
            throw new ChainConnectionException(ChainSide.PARA, url, method + " failed: " + e.getMessage(), e);
        }
    }

    private <R extends Response<?>> R checked(R response, String method) {
        if (response.hasError()) {
            throw new ChainConnectionException(ChainSide.PARA, url,
                    method + " error " + response.getError().getCode() + ": " + response.getError().getMessage());
        }
        return response;
    }
}
