package fun.fengwk.twingly.core.search.model;

import fun.fengwk.twingly.core.search.error.InvalidQueryException;
import lombok.Builder;
import lombok.Value;
import org.springframework.util.StringUtils;

import java.time.Instant;

/**
 * Blog search query.
 *
 * @author fengwk
 */
@Value
@Builder
public class Query {

    /**
     * Search expression, may contain operators understood by the search API.
     */
    String searchPattern;

    /**
     * Document language code, e.g. sv (empty means any language).
     */
    String language;

    /**
     * Lower bound of the publication time.
     */
    Instant startTime;

    /**
     * Upper bound of the publication time.
     */
    Instant endTime;

    /**
     * Check the query can be sent to the API.
     *
     * @throws InvalidQueryException when search pattern is blank
     */
    public void validate() {
        if (!StringUtils.hasText(searchPattern)) {
            throw new InvalidQueryException("search pattern is blank");
        }
    }

}
