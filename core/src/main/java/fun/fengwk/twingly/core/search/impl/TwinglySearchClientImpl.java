package fun.fengwk.twingly.core.search.impl;

import fun.fengwk.twingly.core.search.TwinglySearchClient;
import fun.fengwk.twingly.core.search.TwinglySearchProperties;
import fun.fengwk.twingly.core.search.error.InvalidArgumentException;
import fun.fengwk.twingly.core.search.error.ResponseErrorMapper;
import fun.fengwk.twingly.core.search.error.TwinglyRequestException;
import fun.fengwk.twingly.core.search.error.TwinglySearchException;
import fun.fengwk.twingly.core.search.model.Post;
import fun.fengwk.twingly.core.search.model.Query;
import fun.fengwk.twingly.core.search.model.QueryResult;
import fun.fengwk.twingly.core.search.request.RequestUriBuilder;
import fun.fengwk.twingly.core.search.response.TwinglyResponseParser;
import fun.fengwk.twingly.core.search.transport.JdkHttpSearchTransport;
import fun.fengwk.twingly.core.search.transport.SearchTransport;
import fun.fengwk.twingly.core.search.transport.TransportResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * @author fengwk
 */
@Slf4j
@Component
public class TwinglySearchClientImpl implements TwinglySearchClient {

    static final String PLATFORM = "Java";

    static final String DEFAULT_VERSION = "1.0.0";

    private final TwinglySearchProperties properties;
    private final SearchTransport transport;
    private final RequestUriBuilder requestUriBuilder;
    private final TwinglyResponseParser responseParser;
    private final ResponseErrorMapper errorMapper;

    private volatile String userAgent;

    public TwinglySearchClientImpl(TwinglySearchProperties properties) {
        this(properties, new JdkHttpSearchTransport(properties));
    }

    public TwinglySearchClientImpl(TwinglySearchProperties properties, SearchTransport transport) {
        this(properties, transport, new TwinglyResponseParser());
    }

    private TwinglySearchClientImpl(TwinglySearchProperties properties, SearchTransport transport,
                                    TwinglyResponseParser responseParser) {
        this(properties, transport, new RequestUriBuilder(properties), responseParser,
            new ResponseErrorMapper(responseParser));
    }

    @Autowired
    public TwinglySearchClientImpl(TwinglySearchProperties properties,
                                   SearchTransport transport,
                                   RequestUriBuilder requestUriBuilder,
                                   TwinglyResponseParser responseParser,
                                   ResponseErrorMapper errorMapper) {
        this.properties = properties;
        this.transport = transport;
        this.requestUriBuilder = requestUriBuilder;
        this.responseParser = responseParser;
        this.errorMapper = errorMapper;
        this.userAgent = formatUserAgent(StringUtils.hasText(properties.getUserAgent())
            ? properties.getUserAgent()
            : TwinglySearchProperties.DEFAULT_USER_AGENT);
    }

    @Override
    public CompletableFuture<QueryResult> queryAsync(Query query) {
        if (query == null) {
            return CompletableFuture.failedFuture(new InvalidArgumentException("query must not be null"));
        }
        try {
            query.validate();
        } catch (TwinglySearchException ex) {
            return CompletableFuture.failedFuture(ex);
        }

        URI uri;
        try {
            uri = requestUriBuilder.buildUri(query);
        } catch (IllegalArgumentException ex) {
            return CompletableFuture.failedFuture(
                new TwinglyRequestException("invalid request uri: " + ex.getMessage(), ex));
        }
        Duration timeout = Duration.ofMillis(Math.max(1, properties.getTimeoutMs()));
        long startedAt = System.currentTimeMillis();

        CompletableFuture<QueryResult> result = new CompletableFuture<>();
        CompletableFuture<TransportResponse> exchange;
        try {
            exchange = transport.get(uri, Map.of("User-Agent", userAgent), timeout);
        } catch (RuntimeException ex) {
            result.completeExceptionally(errorMapper.map(null, ex));
            return result;
        }
        if (exchange == null) {
            result.completeExceptionally(new TwinglyRequestException("transport returned no response future"));
            return result;
        }
        exchange.whenComplete((response, error) -> {
            try {
                result.complete(handleResponse(response, error, startedAt));
            } catch (TwinglySearchException ex) {
                result.completeExceptionally(ex);
            } catch (Throwable ex) {
                result.completeExceptionally(new TwinglyRequestException(ex));
            }
        });
        return result;
    }

    @Override
    public QueryResult query(Query query) {
        try {
            return queryAsync(query).get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TwinglyRequestException("interrupted while waiting for Twingly Search API", ex);
        } catch (ExecutionException ex) {
            // Unwrap to the exact error the future failed with.
            Throwable cause = ex.getCause();
            if (cause instanceof TwinglySearchException) {
                throw (TwinglySearchException) cause;
            }
            throw new TwinglyRequestException(cause == null ? ex : cause);
        }
    }

    @Override
    public String getUserAgent() {
        return userAgent;
    }

    @Override
    public void setUserAgent(String product) {
        if (StringUtils.hasText(product)) {
            this.userAgent = formatUserAgent(product.trim());
        }
    }

    private QueryResult handleResponse(TransportResponse response, Throwable error, long startedAt) {
        String body = response == null ? "" : response.bodyAsString();
        if (error != null) {
            throw errorMapper.map(body, error);
        }
        log.debug("twingly response received, status={}, elapsedMs={}",
            response.getStatusCode(), System.currentTimeMillis() - startedAt);
        if (!response.isSuccessful()) {
            throw errorMapper.map(body,
                new TwinglyRequestException("unexpected HTTP status " + response.getStatusCode()));
        }

        long parseStartedAt = System.currentTimeMillis();
        QueryResult queryResult;
        try {
            queryResult = responseParser.parseQueryResult(body);
        } catch (RuntimeException ex) {
            throw errorMapper.map(body, ex);
        }
        queryResult.setPosts(filterBlogPosts(queryResult.getPosts()));
        log.debug("twingly response deserialized, posts={}, elapsedMs={}",
            queryResult.getPosts().size(), System.currentTimeMillis() - parseStartedAt);
        return queryResult;
    }

    private static List<Post> filterBlogPosts(List<Post> posts) {
        if (posts == null) {
            return new ArrayList<>();
        }
        return posts.stream()
            .filter(Post::isBlog)
            .collect(Collectors.toList());
    }

    private static String formatUserAgent(String product) {
        String version = TwinglySearchClientImpl.class.getPackage().getImplementationVersion();
        return product + "/" + PLATFORM + " v." + (version == null ? DEFAULT_VERSION : version);
    }

}
