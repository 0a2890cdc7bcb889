package fun.fengwk.twingly.core.search;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Twingly Search API configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "twingly.search")
public class TwinglySearchProperties {

    public static final String DEFAULT_USER_AGENT = "Twingly Search API Client";

    /**
     * API key sent with every query.
     */
    private String apiKey = "";

    /**
     * Search API base url.
     */
    private String baseUrl = "https://api.twingly.com/";

    /**
     * Search endpoint path relative to the base url.
     */
    private String searchPath = "analytics/Analytics.ashx";

    /**
     * Request timeout in milliseconds.
     */
    private int timeoutMs = 10000;

    /**
     * Product name put in front of the User-Agent header.
     */
    private String userAgent = DEFAULT_USER_AGENT;

}
