package dao.relay.oracle.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dao.relay.oracle.model.ChainConnectionException;
import dao.relay.oracle.model.ChainSide;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimal Substrate JSON-RPC client over HTTP.
 * <p>
 * WebSocket URLs are mapped onto the HTTP transport of the same host and port.
 */
public class SubstrateRpcClient {

    private static final String JSONRPC_VERSION = "2.0";

    private final String url;
    private final URI httpUri;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Duration timeout;
    private final AtomicLong ids = new AtomicLong(1);

    public SubstrateRpcClient(String url, ObjectMapper mapper, Duration timeout) {
        this.url = url;
        this.httpUri = toHttpUri(url);
        this.mapper = mapper;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    public String url() {
        return url;
    }

    /**
     * Sends one request and returns its {@code result} node (possibly a JSON null).
     */
    public JsonNode call(String method, Object... params) {
        ArrayNode paramsNode = mapper.createArrayNode();
        for (Object p : params) {
            if (p == null) {
                paramsNode.addNull();
            } else if (p instanceof Number n) {
                paramsNode.add(n.longValue());
            } else {
                paramsNode.add(p.toString());
            }
        }
        ObjectNode body = mapper.createObjectNode()
                .put("jsonrpc", JSONRPC_VERSION)
                .put("id", ids.getAndIncrement())
                .put("method", method);
        body.set("params", paramsNode);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(httpUri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ChainConnectionException(ChainSide.RELAY, url, method + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChainConnectionException(ChainSide.RELAY, url, method + " interrupted", e);
        }
        if (response.statusCode() != 200) {
            throw new ChainConnectionException(ChainSide.RELAY, url,
                    method + " returned HTTP " + response.statusCode());
        }

        JsonNode root;
        try {
            root = mapper.readTree(response.body());
        } catch (IOException e) {
            throw new ChainConnectionException(ChainSide.RELAY, url, method + " returned malformed JSON", e);
        }
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            throw new ChainConnectionException(ChainSide.RELAY, url,
                    method + " error " + error.path("code").asText() + ": " + error.path("message").asText());
        }
        if (!root.has("result")) {
            throw new ChainConnectionException(ChainSide.RELAY, url, method + " response has no result");
        }
        return root.get("result");
    }

    /**
     * Same call, returning the textual result or null.
     */
    public String callForText(String method, Object... params) {
        JsonNode result = call(method, params);
        return result == null || result.isNull() ? null : result.asText();
    }

    static URI toHttpUri(String url) {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid relay chain URL: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        String mapped = switch (scheme) {
            case "ws", "http" -> "http";
            case "wss", "https" -> "https";
            default -> throw new IllegalArgumentException("Unsupported relay chain URL scheme: " + url);
        };
        try {
            return new URI(mapped, uri.getUserInfo(), uri.getHost(), uri.getPort(), uri.getPath(), uri.getQuery(), null);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid relay chain URL: " + url, e);
        }
    }
}
