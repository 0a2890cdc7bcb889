package fun.fengwk.twingly.core.search.response;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Reads post timestamps such as {@code 2013-01-29 15:21:56Z}, falling back to ISO-8601 instants.
 *
 * @author fengwk
 */
public class ApiDateTimeDeserializer extends StdDeserializer<Instant> {

    static final DateTimeFormatter API_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssX");

    public ApiDateTimeDeserializer() {
        super(Instant.class);
    }

    @Override
    public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String text = p.getValueAsString();
        if (!StringUtils.hasText(text)) {
            return null;
        }
        String value = text.trim();
        try {
            return OffsetDateTime.parse(value, API_DATE_TIME).toInstant();
        } catch (DateTimeParseException ex) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException isoEx) {
                return (Instant) ctxt.handleWeirdStringValue(Instant.class, value,
                    "expected format yyyy-MM-dd HH:mm:ssX");
            }
        }
    }

}
