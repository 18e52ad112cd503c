package dao.relay.oracle.model;

/**
 * Transport-level failure talking to one endpoint: refused or closed connection, timeout,
 * malformed response. Always recoverable by switching endpoints.
 */
public class ChainConnectionException extends RuntimeException {

    private final ChainSide side;
    private final String url;

    public ChainConnectionException(ChainSide side, String url, String message) {
        super(message);
        this.side = side;
        this.url = url;
    }

    public ChainConnectionException(ChainSide side, String url, String message, Throwable cause) {
        super(message, cause);
        this.side = side;
        this.url = url;
    }

    public ChainSide getSide() {
        return side;
    }

    public String getUrl() {
        return url;
    }
}
