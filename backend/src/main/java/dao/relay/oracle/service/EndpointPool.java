package dao.relay.oracle.service;

import dao.relay.oracle.model.ChainConnectionException;
import dao.relay.oracle.model.ChainSide;
import dao.relay.oracle.util.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Endpoint list of one chain side with per-URL failure counters.
 * <p>
 * {@link #select(Set)} blocks until some endpoint accepts a connection. Undesirable URLs are skipped on the
 * first pass and tried last, so a pool whose every URL is undesirable still connects.
 *
 * @param <T> connection handle type
 */
@Slf4j
public class EndpointPool<T extends AutoCloseable> {

    private static final Set<String> SUPPORTED_SCHEMES = Set.of("ws", "wss", "http", "https");

    private final ChainSide side;
    private final List<String> urls;
    private final EndpointConnector<T> connector;
    private final int failureThreshold;
    private final Duration retryPause;
    private final Sleeper sleeper;
    private final Map<String, Integer> failures = new ConcurrentHashMap<>();

    public EndpointPool(ChainSide side,
                        List<String> configuredUrls,
                        EndpointConnector<T> connector,
                        int failureThreshold,
                        Duration retryPause,
                        Sleeper sleeper) {
        this.side = side;
        this.connector = connector;
        this.failureThreshold = failureThreshold;
        this.retryPause = retryPause;
        this.sleeper = sleeper;

        List<String> accepted = new ArrayList<>();
        for (String url : configuredUrls) {
            if (isSupported(url)) {
                accepted.add(url);
            } else {
                log.warn("Skipping unsupported {} endpoint URL: {}", side, url);
            }
        }
        this.urls = List.copyOf(accepted);
    }

    public record Connection<T>(String url, T handle) {}

    public ChainSide getSide() {
        return side;
    }

    public List<String> getUrls() {
        return urls;
    }

    /**
     * Connects to the first reachable endpoint, skipping {@code undesirable} ones unless nothing else works.
     * Retries the whole list forever, pausing between passes.
     *
     * @throws InterruptedException if the thread is interrupted while pausing
     */
    public Connection<T> select(Set<String> undesirable) throws InterruptedException {
        if (urls.isEmpty()) {
            throw new IllegalStateException("No usable " + side + " endpoint configured");
        }
        boolean triedAll = false;
        while (true) {
            for (String url : urls) {
                if (!triedAll && undesirable.contains(url)) {
                    continue;
                }
                Connection<T> c = tryConnect(url);
                if (c != null) {
                    return c;
                }
            }
            if (!triedAll) {
                for (String url : urls) {
                    if (!undesirable.contains(url)) {
                        continue;
                    }
                    Connection<T> c = tryConnect(url);
                    if (c != null) {
                        return c;
                    }
                }
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Endpoint selection interrupted");
            }
            log.error("Failed to connect to any {} endpoint {}, retrying in {}s", side, urls, retryPause.toSeconds());
            sleeper.sleep(retryPause);
            triedAll = true;
        }
    }

    /**
     * Counts a failure against the current endpoint, closes it and selects a replacement.
     * Endpoints over the failure threshold are avoided in this selection and in every later one
     * until {@link #resetAll()}, which the engine calls after startup and after each fully handled era.
     */
    public Connection<T> reconnect(Connection<T> current) throws InterruptedException {
        int count = recordFailure(current.url());
        log.warn("{} endpoint {} failed ({} consecutive failures)", side, current.url(), count);
        closeQuietly(current);
        Set<String> undesirable = avoided();
        if (!undesirable.isEmpty()) {
            log.warn("Avoiding {} endpoints over the failure threshold: {}", side, undesirable);
        }
        Connection<T> next = select(undesirable);
        log.info("Switched {} endpoint {} -> {}", side, current.url(), next.url());
        return next;
    }

    public int recordFailure(String url) {
        return failures.merge(url, 1, Integer::sum);
    }

    public boolean shouldAvoid(String url) {
        return failures.getOrDefault(url, 0) > failureThreshold;
    }

    public void resetAll() {
        failures.clear();
    }

    /**
     * Failure counts per configured URL, in list order.
     */
    public Map<String, Integer> failures() {
        Map<String, Integer> view = new LinkedHashMap<>();
        for (String url : urls) {
            view.put(url, failures.getOrDefault(url, 0));
        }
        return Collections.unmodifiableMap(view);
    }

    public void close(Connection<T> connection) {
        closeQuietly(connection);
    }

    public static boolean isSupported(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url.trim());
            return uri.getScheme() != null
                    && SUPPORTED_SCHEMES.contains(uri.getScheme().toLowerCase(Locale.ROOT))
                    && uri.getHost() != null
                    && uri.getFragment() == null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private Set<String> avoided() {
        Set<String> result = new LinkedHashSet<>();
        for (String url : urls) {
            if (shouldAvoid(url)) {
                result.add(url);
            }
        }
        return result;
    }

    private Connection<T> tryConnect(String url) {
        try {
            T handle = connector.connect(url);
            log.info("Connected to {} endpoint {}", side, url);
            return new Connection<>(url, handle);
        } catch (ChainConnectionException e) {
            log.warn("Failed to connect to {} endpoint {}: {}", side, url, e.getMessage());
            return null;
        }
    }

    private void closeQuietly(Connection<T> connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.handle().close();
        } catch (Exception e) {
            log.warn("Failed to close {} endpoint {}: {}", side, connection.url(), e.getMessage());
        }
    }
}
