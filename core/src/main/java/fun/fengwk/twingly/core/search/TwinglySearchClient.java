package fun.fengwk.twingly.core.search;

import fun.fengwk.twingly.core.search.error.TwinglySearchException;
import fun.fengwk.twingly.core.search.model.Query;
import fun.fengwk.twingly.core.search.model.QueryResult;

import java.util.concurrent.CompletableFuture;

/**
 * Queries the Twingly blog search API.
 *
 * <p>Every failure is a {@link TwinglySearchException}; {@link TwinglySearchException#getKind()}
 * tells which one.
 *
 * @author fengwk
 */
public interface TwinglySearchClient {

    /**
     * Execute the query asynchronously.
     *
     * <p>The returned future fails with the {@link TwinglySearchException} itself, including for
     * a null or invalid query, in which case no request is sent. Only posts with content type
     * blog are kept.
     */
    CompletableFuture<QueryResult> queryAsync(Query query);

    /**
     * Execute the query and block until it completes.
     *
     * @throws TwinglySearchException the same error {@link #queryAsync(Query)} fails with
     */
    QueryResult query(Query query);

    /**
     * Current value of the User-Agent header.
     */
    String getUserAgent();

    /**
     * Replace the product name in the User-Agent header. Blank values are ignored.
     */
    void setUserAgent(String product);

}
