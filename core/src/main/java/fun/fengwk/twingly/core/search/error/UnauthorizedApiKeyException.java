package fun.fengwk.twingly.core.search.error;

/**
 * Thrown when the API key can't be used to service the query.
 *
 * @author fengwk
 */
public class UnauthorizedApiKeyException extends TwinglySearchException {

    public static final String DEFAULT_MESSAGE = "The API key is not authorized for this query";

    public UnauthorizedApiKeyException(Throwable cause) {
        super(DEFAULT_MESSAGE, cause);
    }

    @Override
    public SearchErrorKind getKind() {
        return SearchErrorKind.UNAUTHORIZED_API_KEY;
    }

}
