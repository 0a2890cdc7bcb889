package fun.fengwk.twingly.core.cli;

import fun.fengwk.twingly.core.search.TwinglySearchClient;
import fun.fengwk.twingly.core.search.error.TwinglySearchException;
import fun.fengwk.twingly.core.search.model.Post;
import fun.fengwk.twingly.core.search.model.Query;
import fun.fengwk.twingly.core.search.model.QueryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Runs one blog search from command line options.
 *
 * <pre>
 * --search=&lt;pattern&gt; [--language=&lt;code&gt;] [--since=&lt;instant&gt;] [--until=&lt;instant&gt;]
 * </pre>
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchCommand implements ApplicationRunner {

    static final String OPTION_SEARCH = "search";
    static final String OPTION_LANGUAGE = "language";
    static final String OPTION_SINCE = "since";
    static final String OPTION_UNTIL = "until";

    private final TwinglySearchClient twinglySearchClient;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPTION_SEARCH)) {
            return;
        }
        Query query;
        try {
            query = Query.builder()
                .searchPattern(firstValue(args, OPTION_SEARCH))
                .language(firstValue(args, OPTION_LANGUAGE))
                .startTime(parseInstant(firstValue(args, OPTION_SINCE)))
                .endTime(parseInstant(firstValue(args, OPTION_UNTIL)))
                .build();
        } catch (DateTimeParseException ex) {
            log.warn("invalid time option, value={}, expected ISO-8601 instant", ex.getParsedString());
            return;
        }

        try {
            QueryResult result = twinglySearchClient.query(query);
            log.info("twingly search finished, pattern={}, returned={}, total={}, authors={}, secondsElapsed={}",
                query.getSearchPattern(),
                result.getNumberOfMatchesReturned(),
                result.getNumberOfMatchesTotal(),
                result.getNumberOfAuthors(),
                result.getSecondsElapsed());
            for (Post post : result.getPosts()) {
                log.info("{} | {} | {} | {}", post.getPublished(), post.getBlogName(), post.getTitle(), post.getUrl());
            }
        } catch (TwinglySearchException ex) {
            log.warn("twingly search failed, kind={}, message={}", ex.getKind(), ex.getMessage());
        }
    }

    private static String firstValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    private static Instant parseInstant(String value) {
        return StringUtils.hasText(value) ? Instant.parse(value.trim()) : null;
    }

}
