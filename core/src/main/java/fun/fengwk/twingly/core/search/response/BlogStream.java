package fun.fengwk.twingly.core.search.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.Data;

/**
 * Envelope the search API puts around an {@link OperationResult}.
 *
 * @author fengwk
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = BlogStream.ROOT_ELEMENT)
class BlogStream {

    static final String ROOT_ELEMENT = "blogstream";

    @JacksonXmlProperty(localName = OperationResult.ROOT_ELEMENT)
    private OperationResult operationResult;

}
