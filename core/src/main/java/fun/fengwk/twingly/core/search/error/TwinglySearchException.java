package fun.fengwk.twingly.core.search.error;

/**
 * Base of every failure surfaced by the search client.
 *
 * @author fengwk
 */
public abstract class TwinglySearchException extends RuntimeException {

    protected TwinglySearchException(String message) {
        super(message);
    }

    protected TwinglySearchException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract SearchErrorKind getKind();

}
