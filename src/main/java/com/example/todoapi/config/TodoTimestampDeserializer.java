package com.example.todoapi.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import org.springframework.boot.jackson.JsonComponent;

import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;

/**
 * Reads ISO-8601 timestamps into {@link OffsetDateTime}, keeping the offset the client sent.
 * A timestamp without an offset is taken to be in the configured local time zone, and a bare
 * date is midnight in that zone.
 */
@JsonComponent
public class TodoTimestampDeserializer extends JsonDeserializer<OffsetDateTime> {

    private static final DateTimeFormatter DATE_OR_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT)
            .withChronology(IsoChronology.INSTANCE);

    private final ZoneId localTimeZone;

    public TodoTimestampDeserializer(TodoApiProperties properties) {
        this.localTimeZone = properties.localTimeZone();
    }

    @Override
    public OffsetDateTime deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (!parser.hasToken(JsonToken.VALUE_STRING)) {
            return (OffsetDateTime) context.handleUnexpectedToken(OffsetDateTime.class, parser);
        }
        String text = parser.getText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            TemporalAccessor parsed = DATE_OR_DATE_TIME
                    .parseBest(text, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime;
            }
            if (parsed instanceof LocalDateTime localDateTime) {
                return localDateTime.atZone(localTimeZone).toOffsetDateTime();
            }
            return ((LocalDate) parsed).atStartOfDay(localTimeZone).toOffsetDateTime();
        } catch (DateTimeParseException e) {
            return (OffsetDateTime) context.handleWeirdStringValue(OffsetDateTime.class, text,
                    "not an ISO-8601 timestamp: %s", e.getMessage());
        }
    }

    @Override
    public Class<?> handledType() {
        return OffsetDateTime.class;
    }
}
