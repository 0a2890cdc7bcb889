package fun.fengwk.twingly.core.search.error;

/**
 * Thrown when a required argument is null.
 *
 * @author fengwk
 */
public class InvalidArgumentException extends TwinglySearchException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    @Override
    public SearchErrorKind getKind() {
        return SearchErrorKind.INVALID_ARGUMENT;
    }

}
