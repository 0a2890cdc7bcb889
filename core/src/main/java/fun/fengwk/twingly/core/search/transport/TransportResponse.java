package fun.fengwk.twingly.core.search.transport;

import lombok.Builder;
import lombok.Data;
import org.springframework.util.InvalidMimeTypeException;
import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Raw response from the search API.
 *
 * @author fengwk
 */
@Data
@Builder
public class TransportResponse {

    static final String CONTENT_TYPE = "Content-Type";

    private int statusCode;
    private Map<String, List<String>> headers;
    private byte[] body;

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Body decoded with the charset of the Content-Type header, UTF-8 when it names none.
     */
    public String bodyAsString() {
        return body == null ? "" : new String(body, charset());
    }

    Charset charset() {
        String contentType = firstHeader(CONTENT_TYPE);
        if (!StringUtils.hasText(contentType)) {
            return StandardCharsets.UTF_8;
        }
        try {
            MimeType mimeType = MimeTypeUtils.parseMimeType(contentType);
            return mimeType.getCharset() == null ? StandardCharsets.UTF_8 : mimeType.getCharset();
        } catch (InvalidMimeTypeException ex) {
            return StandardCharsets.UTF_8;
        }
    }

    private String firstHeader(String name) {
        if (headers == null) {
            return null;
        }
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (name.equalsIgnoreCase(entry.getKey()) && entry.getValue() != null && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }

}
