package fun.fengwk.twingly.core.search.error;

/**
 * Thrown when a request failed and the server sent no body.
 *
 * @author fengwk
 */
public class EmptyResponseException extends TwinglySearchException {

    public static final String DEFAULT_MESSAGE = "empty response from server";

    public EmptyResponseException(Throwable cause) {
        super(DEFAULT_MESSAGE, cause);
    }

    @Override
    public SearchErrorKind getKind() {
        return SearchErrorKind.EMPTY_RESPONSE;
    }

}
