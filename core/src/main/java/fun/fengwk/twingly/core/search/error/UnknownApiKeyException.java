package fun.fengwk.twingly.core.search.error;

/**
 * Thrown when the API key was not recognized by the remote server.
 *
 * @author fengwk
 */
public class UnknownApiKeyException extends TwinglySearchException {

    public static final String DEFAULT_MESSAGE = "The API key does not exist";

    public UnknownApiKeyException(Throwable cause) {
        super(DEFAULT_MESSAGE, cause);
    }

    public UnknownApiKeyException(String message) {
        super(message);
    }

    @Override
    public SearchErrorKind getKind() {
        return SearchErrorKind.UNKNOWN_API_KEY;
    }

}
