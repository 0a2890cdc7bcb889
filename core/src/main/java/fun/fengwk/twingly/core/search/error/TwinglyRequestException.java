package fun.fengwk.twingly.core.search.error;

/**
 * Thrown when any other error occurs during a request.
 *
 * @author fengwk
 */
public class TwinglyRequestException extends TwinglySearchException {

    public static final String DEFAULT_MESSAGE = "Twingly Search API request failed";

    public TwinglyRequestException(Throwable cause) {
        super(DEFAULT_MESSAGE, cause);
    }

    public TwinglyRequestException(String message) {
        super(message);
    }

    public TwinglyRequestException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public SearchErrorKind getKind() {
        return SearchErrorKind.GENERIC_REQUEST_FAILURE;
    }

}
