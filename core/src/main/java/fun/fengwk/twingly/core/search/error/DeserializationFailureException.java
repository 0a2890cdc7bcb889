package fun.fengwk.twingly.core.search.error;

/**
 * Thrown when the response body matches none of the known XML shapes.
 *
 * @author fengwk
 */
public class DeserializationFailureException extends TwinglySearchException {

    public static final String DEFAULT_MESSAGE = "Couldn't deserialize API response. See the cause for details";

    public DeserializationFailureException(Throwable cause) {
        super(DEFAULT_MESSAGE, cause);
    }

    @Override
    public SearchErrorKind getKind() {
        return SearchErrorKind.DESERIALIZATION_FAILURE;
    }

}
