package fun.fengwk.twingly.core.search.response;

/**
 * Thrown when a response body can't be read as the requested XML shape.
 *
 * @author fengwk
 */
public class ResponseParseException extends RuntimeException {

    public ResponseParseException(String message) {
        super(message);
    }

    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }

}
