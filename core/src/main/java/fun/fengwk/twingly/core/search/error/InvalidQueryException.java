package fun.fengwk.twingly.core.search.error;

/**
 * Thrown when a query has no usable search pattern.
 *
 * @author fengwk
 */
public class InvalidQueryException extends TwinglySearchException {

    public InvalidQueryException(String message) {
        super(message);
    }

    @Override
    public SearchErrorKind getKind() {
        return SearchErrorKind.INVALID_QUERY;
    }

}
