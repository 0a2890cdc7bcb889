package fun.fengwk.twingly.core.search.response;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import fun.fengwk.twingly.core.search.model.QueryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.StringReader;

/**
 * Binds search API response bodies to the response model.
 *
 * <p>The root element decides which shape a body is, so a query result never binds as an
 * {@link OperationResult} and vice versa.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class TwinglyResponseParser {

    private final XmlMapper xmlMapper;

    public TwinglyResponseParser() {
        this.xmlMapper = new XmlMapper();
    }

    /**
     * Parse a successful response.
     *
     * @throws ResponseParseException when the body is not a {@code twinglydata} document
     */
    public QueryResult parseQueryResult(String body) {
        return read(body, QueryResult.ROOT_ELEMENT, QueryResult.class);
    }

    /**
     * Parse an error response, bare or wrapped in {@code blogstream}.
     *
     * @return the payload, or null when the envelope carries none
     * @throws ResponseParseException when the body is neither of the two error documents
     */
    public OperationResult parseOperationResult(String body) {
        String root = rootElementOf(body);
        if (BlogStream.ROOT_ELEMENT.equals(root)) {
            BlogStream stream = read(body, BlogStream.ROOT_ELEMENT, BlogStream.class);
            return stream == null ? null : stream.getOperationResult();
        }
        return read(body, OperationResult.ROOT_ELEMENT, OperationResult.class);
    }

    private <T> T read(String body, String expectedRoot, Class<T> type) {
        XMLStreamReader reader = openAtRoot(body);
        try {
            String root = reader.getLocalName();
            if (!expectedRoot.equals(root)) {
                throw new ResponseParseException(
                    "unexpected root element <" + root + ">, expected <" + expectedRoot + ">");
            }
            return xmlMapper.readValue(reader, type);
        } catch (IOException ex) {
            throw new ResponseParseException("failed to bind <" + expectedRoot + "> document: " + ex.getMessage(), ex);
        } finally {
            closeQuietly(reader);
        }
    }

    private String rootElementOf(String body) {
        XMLStreamReader reader = openAtRoot(body);
        try {
            return reader.getLocalName();
        } finally {
            closeQuietly(reader);
        }
    }

    private XMLStreamReader openAtRoot(String body) {
        if (body == null) {
            throw new ResponseParseException("response body is null");
        }
        String xml = stripBom(body).trim();
        try {
            XMLStreamReader reader = xmlMapper.getFactory().getXMLInputFactory()
                .createXMLStreamReader(new StringReader(xml));
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamConstants.START_ELEMENT) {
                    return reader;
                }
            }
            reader.close();
            throw new ResponseParseException("response body has no root element");
        } catch (XMLStreamException ex) {
            throw new ResponseParseException("response body is not well-formed XML: " + ex.getMessage(), ex);
        }
    }

    private static String stripBom(String body) {
        return body.startsWith("\uFEFF") ? body.substring(1) : body;
    }

    private static void closeQuietly(XMLStreamReader reader) {
        try {
            reader.close();
        } catch (XMLStreamException ex) {
            log.debug("failed to close xml reader, error={}", ex.getMessage());
        }
    }

}
