package fun.fengwk.twingly.core.search.model;

/**
 * Known values of {@link Post#getContentType()}.
 *
 * @author fengwk
 */
public final class ContentType {

    public static final String BLOG = "blog";

    public static final String NEWS = "news";

    private ContentType() {
    }

}
