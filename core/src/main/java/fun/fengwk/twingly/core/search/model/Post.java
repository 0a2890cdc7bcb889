package fun.fengwk.twingly.core.search.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import fun.fengwk.twingly.core.search.response.ApiDateTimeDeserializer;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Single document matched by a query.
 *
 * @author fengwk
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Post {

    /**
     * Document kind, see {@link ContentType}.
     */
    @JacksonXmlProperty(isAttribute = true, localName = "contentType")
    private String contentType;

    @JacksonXmlProperty(localName = "url")
    private String url;

    @JacksonXmlProperty(localName = "title")
    private String title;

    @JacksonXmlProperty(localName = "author")
    private String author;

    /**
     * Post body or summary text.
     */
    @JacksonXmlProperty(localName = "summary")
    private String summary;

    @JacksonXmlProperty(localName = "languageCode")
    private String languageCode;

    @JsonDeserialize(using = ApiDateTimeDeserializer.class)
    @JacksonXmlProperty(localName = "published")
    private Instant published;

    @JsonDeserialize(using = ApiDateTimeDeserializer.class)
    @JacksonXmlProperty(localName = "indexed")
    private Instant indexed;

    @JacksonXmlProperty(localName = "blogUrl")
    private String blogUrl;

    @JacksonXmlProperty(localName = "blogName")
    private String blogName;

    /**
     * Twingly authority of the blog.
     */
    @JacksonXmlProperty(localName = "authority")
    private int authority;

    @JacksonXmlProperty(localName = "blogRank")
    private int blogRank;

    @JacksonXmlElementWrapper(localName = "tags")
    @JacksonXmlProperty(localName = "tag")
    private List<String> tags = new ArrayList<>();

    @JacksonXmlElementWrapper(localName = "links")
    @JacksonXmlProperty(localName = "link")
    private List<String> links = new ArrayList<>();

    @JsonIgnore
    public boolean isBlog() {
        return ContentType.BLOG.equals(contentType);
    }

}
