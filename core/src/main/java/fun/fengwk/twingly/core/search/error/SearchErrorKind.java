package fun.fengwk.twingly.core.search.error;

/**
 * Discriminator of {@link TwinglySearchException}.
 *
 * @author fengwk
 */
public enum SearchErrorKind {

    INVALID_QUERY,
    INVALID_ARGUMENT,
    REQUEST_TIMEOUT,
    EMPTY_RESPONSE,
    DESERIALIZATION_FAILURE,
    SERVICE_UNAVAILABLE,
    UNKNOWN_API_KEY,
    UNAUTHORIZED_API_KEY,
    UNKNOWN_API_ERROR,
    GENERIC_REQUEST_FAILURE,

}
