package fun.fengwk.twingly.core.search.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a successful query.
 *
 * @author fengwk
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = QueryResult.ROOT_ELEMENT)
public class QueryResult {

    public static final String ROOT_ELEMENT = "twinglydata";

    /**
     * Number of distinct authors among the matches.
     */
    @JacksonXmlProperty(isAttribute = true, localName = "numberOfAuthors")
    private int numberOfAuthors;

    /**
     * Number of posts returned in this response.
     */
    @JacksonXmlProperty(isAttribute = true, localName = "numberOfMatchesReturned")
    private int numberOfMatchesReturned;

    /**
     * Number of posts matching the query in total.
     */
    @JacksonXmlProperty(isAttribute = true, localName = "numberOfMatchesTotal")
    private long numberOfMatchesTotal;

    /**
     * Server side query duration in seconds.
     */
    @JacksonXmlProperty(isAttribute = true, localName = "secondsElapsed")
    private double secondsElapsed;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "post")
    private List<Post> posts = new ArrayList<>();

}
