package fun.fengwk.twingly.core.search.error;

/**
 * Thrown when the search API returned an error code this client does not know.
 *
 * @author fengwk
 */
public class UnknownApiErrorException extends TwinglySearchException {

    public UnknownApiErrorException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public SearchErrorKind getKind() {
        return SearchErrorKind.UNKNOWN_API_ERROR;
    }

}
