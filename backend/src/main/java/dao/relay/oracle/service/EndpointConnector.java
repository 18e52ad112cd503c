package dao.relay.oracle.service;

/**
 * Opens a handle to one endpoint and proves it answers.
 *
 * @param <T> handle type
 */
@FunctionalInterface
public interface EndpointConnector<T extends AutoCloseable> {

    /**
     * @throws dao.relay.oracle.model.ChainConnectionException when the endpoint cannot be reached
     */
    T connect(String url);
}
