package fun.fengwk.twingly.core.search.transport;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP GET used by the search client.
 *
 * @author fengwk
 */
public interface SearchTransport {

    /**
     * Send a GET request.
     *
     * <p>The returned future completes with any status code the server answered with. It fails
     * with {@link java.net.http.HttpTimeoutException} when {@code timeout} elapses and with
     * {@link java.util.concurrent.CancellationException} when cancelled.
     */
    CompletableFuture<TransportResponse> get(URI uri, Map<String, String> headers, Duration timeout);

}
