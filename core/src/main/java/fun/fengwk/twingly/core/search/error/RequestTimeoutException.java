package fun.fengwk.twingly.core.search.error;

/**
 * Thrown when the request timed out or was cancelled.
 *
 * @author fengwk
 */
public class RequestTimeoutException extends TwinglySearchException {

    public static final String DEFAULT_MESSAGE = "The request has timed out";

    public RequestTimeoutException(Throwable cause) {
        super(DEFAULT_MESSAGE, cause);
    }

    @Override
    public SearchErrorKind getKind() {
        return SearchErrorKind.REQUEST_TIMEOUT;
    }

}
