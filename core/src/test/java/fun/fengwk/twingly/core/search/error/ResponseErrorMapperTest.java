package fun.fengwk.twingly.core.search.error;

import fun.fengwk.twingly.core.search.response.ResponseParseException;
import fun.fengwk.twingly.core.search.response.TwinglyResponseParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ResponseErrorMapper tests.
 *
 * @author fengwk
 */
class ResponseErrorMapperTest {

    private final ResponseErrorMapper mapper = new ResponseErrorMapper(new TwinglyResponseParser());

    private final Exception failure = new IOException("boom");

    @Test
    void shouldMapServiceUnavailable() {
        TwinglySearchException error = mapper.map(
            "<operationResult resultType=\"error\">service unavailable</operationResult>", failure);

        assertThat(error).isInstanceOf(ServiceUnavailableException.class).hasCause(failure);
        assertThat(error.getKind()).isEqualTo(SearchErrorKind.SERVICE_UNAVAILABLE);
    }

    @Test
    void shouldMapUnknownApiKey() {
        TwinglySearchException error = mapper.map(
            "<operationResult resultType=\"error\">api key does not exist</operationResult>", failure);

        assertThat(error).isInstanceOf(UnknownApiKeyException.class).hasCause(failure);
        assertThat(error.getKind()).isEqualTo(SearchErrorKind.UNKNOWN_API_KEY);
    }

    @Test
    void shouldMapUnauthorizedApiKey() {
        TwinglySearchException error = mapper.map(
            "<operationResult resultType=\"error\">unauthorized api key</operationResult>", failure);

        assertThat(error).isInstanceOf(UnauthorizedApiKeyException.class).hasCause(failure);
        assertThat(error.getKind()).isEqualTo(SearchErrorKind.UNAUTHORIZED_API_KEY);
    }

    @ParameterizedTest
    @CsvSource({
        "Service Unavailable, SERVICE_UNAVAILABLE",
        "API KEY DOES NOT EXIST, UNKNOWN_API_KEY",
        "Unauthorized Api Key, UNAUTHORIZED_API_KEY",
    })
    void shouldCompareCodesIgnoringCase(String code, SearchErrorKind kind) {
        TwinglySearchException error = mapper.map(
            "<operationResult resultType=\"failure\">" + code + "</operationResult>", failure);

        assertThat(error.getKind()).isEqualTo(kind);
    }

    @Test
    void shouldMapBlogStreamEnvelope() {
        String body = "<?xml version=\"1.0\" encoding=\"utf-8\"?>"
            + "<blogstream xmlns=\"http://www.twingly.com\">"
            + "<operationResult resultType=\"failure\">Api key does not exist</operationResult>"
            + "</blogstream>";

        assertThat(mapper.map(body, failure)).isInstanceOf(UnknownApiKeyException.class);
    }

    @Test
    void shouldEmbedBodyForUnknownCode() {
        String body = "<operationResult resultType=\"error\">something else entirely</operationResult>";

        TwinglySearchException error = mapper.map(body, failure);

        assertThat(error).isInstanceOf(UnknownApiErrorException.class).hasCause(failure);
        assertThat(error.getMessage()).contains(body);
        assertThat(error.getKind()).isEqualTo(SearchErrorKind.UNKNOWN_API_ERROR);
    }

    @Test
    void shouldTreatMissingCodeAsUnknown() {
        TwinglySearchException error = mapper.map("<operationResult resultType=\"error\"/>", failure);

        assertThat(error).isInstanceOf(UnknownApiErrorException.class);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\n\t"})
    void shouldMapEmptyBody(String body) {
        TwinglySearchException error = mapper.map(body, failure);

        assertThat(error).isInstanceOf(EmptyResponseException.class).hasCause(failure);
        assertThat(error.getMessage()).isEqualTo("empty response from server");
        assertThat(error.getKind()).isEqualTo(SearchErrorKind.EMPTY_RESPONSE);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "this is not xml",
        "<html><body>Bad gateway</body></html>",
        "<twinglydata numberOfMatchesReturned=\"0\"/>",
    })
    void shouldWrapParseFailure(String body) {
        TwinglySearchException error = mapper.map(body, failure);

        assertThat(error).isInstanceOf(DeserializationFailureException.class)
            .hasCauseInstanceOf(ResponseParseException.class)
            .hasMessageContaining("Couldn't deserialize");
        assertThat(error.getSuppressed()).containsExactly(failure);
        assertThat(error.getKind()).isEqualTo(SearchErrorKind.DESERIALIZATION_FAILURE);
    }

    @Test
    void shouldPreferTimeoutOverBody() {
        String body = "<operationResult resultType=\"error\">service unavailable</operationResult>";

        assertThat(mapper.map(body, new HttpTimeoutException("request timed out")))
            .isInstanceOf(RequestTimeoutException.class);
        assertThat(mapper.map(body, new CompletionException(new HttpTimeoutException("request timed out"))))
            .isInstanceOf(RequestTimeoutException.class);
        assertThat(mapper.map("", new CancellationException()))
            .isInstanceOf(RequestTimeoutException.class);
        assertThat(mapper.map(null, new ExecutionException(new TimeoutException())))
            .isInstanceOf(RequestTimeoutException.class)
            .extracting(TwinglySearchException::getKind)
            .isEqualTo(SearchErrorKind.REQUEST_TIMEOUT);
    }

    @Test
    void shouldWrapFailureWhenEnvelopeIsEmpty() {
        TwinglySearchException error = mapper.map("<blogstream><status>ok</status></blogstream>", failure);

        assertThat(error).isInstanceOf(TwinglyRequestException.class).hasCause(failure);
        assertThat(error.getKind()).isEqualTo(SearchErrorKind.GENERIC_REQUEST_FAILURE);
    }

}
