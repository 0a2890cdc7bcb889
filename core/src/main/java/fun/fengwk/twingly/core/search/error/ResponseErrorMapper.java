package fun.fengwk.twingly.core.search.error;

import fun.fengwk.twingly.core.search.response.OperationResult;
import fun.fengwk.twingly.core.search.response.ResponseParseException;
import fun.fengwk.twingly.core.search.response.TwinglyResponseParser;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies a failed exchange with the search API into one {@link TwinglySearchException}.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class ResponseErrorMapper {

    static final String SERVICE_UNAVAILABLE = "service unavailable";
    static final String API_KEY_DOES_NOT_EXIST = "api key does not exist";
    static final String UNAUTHORIZED_API_KEY = "unauthorized api key";

    private final TwinglyResponseParser responseParser;

    /**
     * Map a failed exchange.
     *
     * @param responseBody body text captured before the failure, may be null
     * @param failure the failure that ended the exchange
     * @return the error to surface to the caller
     */
    public TwinglySearchException map(String responseBody, Throwable failure) {
        if (isTimeout(failure)) {
            return new RequestTimeoutException(failure);
        }
        if (!StringUtils.hasText(responseBody)) {
            return new EmptyResponseException(failure);
        }

        OperationResult errorResponse;
        try {
            errorResponse = responseParser.parseOperationResult(responseBody);
        } catch (ResponseParseException ex) {
            DeserializationFailureException error = new DeserializationFailureException(ex);
            if (failure != null && failure != ex) {
                error.addSuppressed(failure);
            }
            return error;
        }
        if (errorResponse == null) {
            return new TwinglyRequestException(failure);
        }

        String code = errorResponse.getText() == null
            ? ""
            : errorResponse.getText().trim().toLowerCase(Locale.ROOT);
        switch (code) {
            case SERVICE_UNAVAILABLE:
                return new ServiceUnavailableException(failure);
            case API_KEY_DOES_NOT_EXIST:
                return new UnknownApiKeyException(failure);
            case UNAUTHORIZED_API_KEY:
                return new UnauthorizedApiKeyException(failure);
            default:
                // Body bound to the error schema, it is small.
                return new UnknownApiErrorException(
                    "Twingly Search API returned an unknown error: " + responseBody, failure);
        }
    }

    private static boolean isTimeout(Throwable failure) {
        Throwable cause = unwrap(failure);
        return cause instanceof HttpTimeoutException
            || cause instanceof CancellationException
            || cause instanceof TimeoutException;
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

}
