package fun.fengwk.twingly.core.search.request;

import fun.fengwk.twingly.core.search.TwinglySearchProperties;
import fun.fengwk.twingly.core.search.model.Query;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Builds search API request uris from validated queries.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class RequestUriBuilder {

    public static final String API_KEY = "key";
    public static final String SEARCH_PATTERN = "searchpattern";
    public static final String XML_OUTPUT_VERSION = "xmloutputversion";
    public static final String DOCUMENT_LANGUAGE = "language";
    public static final String START_TIME = "ts";
    public static final String END_TIME = "tsTo";

    /**
     * Date format the search API parses ts/tsTo with, always in UTC.
     */
    public static final String API_DATE_FORMAT = "yyyy-MM-dd HH:mm:ss";

    private static final DateTimeFormatter API_DATE_FORMATTER =
        DateTimeFormatter.ofPattern(API_DATE_FORMAT).withZone(ZoneOffset.UTC);

    private final TwinglySearchProperties properties;

    /**
     * Full request uri: base url, search path and {@link #buildQueryString(Query)}.
     */
    public URI buildUri(Query query) {
        String baseUrl = StringUtils.hasText(properties.getBaseUrl())
            ? properties.getBaseUrl().trim()
            : "";
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        String path = StringUtils.hasText(properties.getSearchPath())
            ? properties.getSearchPath().trim()
            : "";
        if (!path.isEmpty() && !path.startsWith("/")) {
            path = "/" + path;
        }
        return URI.create(baseUrl + path + buildQueryString(query));
    }

    /**
     * Query string starting with '?'. Optional parameters are left out when absent.
     */
    public String buildQueryString(Query query) {
        StringBuilder builder = new StringBuilder("?");
        builder.append(API_KEY).append('=').append(encode(nullToEmpty(properties.getApiKey())))
            .append('&').append(SEARCH_PATTERN).append('=').append(encode(query.getSearchPattern()))
            .append('&').append(XML_OUTPUT_VERSION).append("=2");
        if (StringUtils.hasText(query.getLanguage())) {
            appendParam(builder, DOCUMENT_LANGUAGE, query.getLanguage().trim());
        }
        if (query.getStartTime() != null) {
            appendParam(builder, START_TIME, formatDate(query.getStartTime()));
        }
        if (query.getEndTime() != null) {
            appendParam(builder, END_TIME, formatDate(query.getEndTime()));
        }
        return builder.toString();
    }

    static String formatDate(Instant instant) {
        return API_DATE_FORMATTER.format(instant);
    }

    private static void appendParam(StringBuilder builder, String name, String value) {
        builder.append('&').append(name).append('=').append(encode(value));
    }

    private static String encode(String value) {
        return UriUtils.encode(value, StandardCharsets.UTF_8);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

}
