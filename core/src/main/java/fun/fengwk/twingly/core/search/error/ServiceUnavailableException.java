package fun.fengwk.twingly.core.search.error;

/**
 * Thrown when the search API reports that service is unavailable.
 *
 * @author fengwk
 */
public class ServiceUnavailableException extends TwinglySearchException {

    public static final String DEFAULT_MESSAGE = "Twingly Search API is temporarily unavailable";

    public ServiceUnavailableException(Throwable cause) {
        super(DEFAULT_MESSAGE, cause);
    }

    public ServiceUnavailableException(String message) {
        super(message);
    }

    @Override
    public SearchErrorKind getKind() {
        return SearchErrorKind.SERVICE_UNAVAILABLE;
    }

}
