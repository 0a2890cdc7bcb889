package fun.fengwk.twingly.core.search.transport;

import fun.fengwk.twingly.core.search.TwinglySearchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link SearchTransport} on top of {@link HttpClient}.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class JdkHttpSearchTransport implements SearchTransport {

    private final HttpClient httpClient;

    @Autowired
    public JdkHttpSearchTransport(TwinglySearchProperties properties) {
        this(HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(Math.max(1, properties.getTimeoutMs())))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
    }

    JdkHttpSearchTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<TransportResponse> get(URI uri, Map<String, String> headers, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(timeout)
            .header("Accept", "application/xml")
            .GET();
        if (headers != null) {
            headers.forEach(builder::header);
        }
        log.debug("twingly request, uri={}", uri.getPath());
        return httpClient.sendAsync(builder.build(), BodyHandlers.ofByteArray())
            .thenApply(response -> TransportResponse.builder()
                .statusCode(response.statusCode())
                .headers(response.headers().map())
                .body(response.body())
                .build());
    }

}
