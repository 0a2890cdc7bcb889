package fun.fengwk.twingly.core.search.response;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;
import lombok.Data;

/**
 * Error payload returned by the search API instead of a query result.
 *
 * @author fengwk
 */
@Data
@JacksonXmlRootElement(localName = OperationResult.ROOT_ELEMENT)
public class OperationResult {

    public static final String ROOT_ELEMENT = "operationResult";

    @JacksonXmlProperty(isAttribute = true, localName = "resultType")
    private String resultType;

    /**
     * Result code, e.g. "api key does not exist".
     */
    @JacksonXmlText
    private String text;

}
