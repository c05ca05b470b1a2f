package com.example.todoapi.config;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TodoTimestampDeserializer")
class TodoTimestampDeserializerTest {

    private static ObjectMapper mapperFor(String zone) {
        TodoApiProperties properties = new TodoApiProperties(
                new TodoApiProperties.Cors("http://localhost:3000"), ZoneId.of(zone));
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new SimpleModule().addDeserializer(OffsetDateTime.class,
                        new TodoTimestampDeserializer(properties)));
    }

    @Test
    @DisplayName("should keep the offset sent by the client")
    void keepsExplicitOffset() throws Exception {
        OffsetDateTime parsed = mapperFor("UTC").readValue("\"2026-10-18T09:00:00+09:00\"", OffsetDateTime.class);

        assertThat(parsed.getOffset()).isEqualTo(ZoneOffset.ofHours(9));
        assertThat(parsed.toInstant()).hasToString("2026-10-18T00:00:00Z");
    }

    @Test
    @DisplayName("should read UTC designator timestamps")
    void readsUtcDesignator() throws Exception {
        OffsetDateTime parsed = mapperFor("Asia/Tokyo").readValue("\"2026-10-18T00:00:00.250Z\"", OffsetDateTime.class);

        assertThat(parsed.getOffset()).isEqualTo(ZoneOffset.UTC);
        assertThat(parsed.getNano()).isEqualTo(250_000_000);
    }

    @Test
    @DisplayName("should read a timestamp without offset in the configured local zone")
    void appliesLocalZoneWhenOffsetMissing() throws Exception {
        OffsetDateTime parsed = mapperFor("Asia/Tokyo").readValue("\"2026-10-18T09:00:00\"", OffsetDateTime.class);

        assertThat(parsed.getOffset()).isEqualTo(ZoneOffset.ofHours(9));
        assertThat(parsed.toInstant()).hasToString("2026-10-18T00:00:00Z");
    }

    @Test
    @DisplayName("should read a date without time as midnight in the configured local zone")
    void readsDateOnlyAsLocalMidnight() throws Exception {
        OffsetDateTime parsed = mapperFor("Asia/Tokyo").readValue("\"2030-01-01\"", OffsetDateTime.class);

        assertThat(parsed.getOffset()).isEqualTo(ZoneOffset.ofHours(9));
        assertThat(parsed.toInstant()).hasToString("2029-12-31T15:00:00Z");
    }

    @Test
    @DisplayName("should map an empty string to null")
    void emptyStringIsNull() throws Exception {
        assertThat(mapperFor("UTC").readValue("\"\"", OffsetDateTime.class)).isNull();
    }

    @Test
    @DisplayName("should reject text that is not a timestamp")
    void rejectsGarbage() {
        assertThatThrownBy(() -> mapperFor("UTC").readValue("\"tomorrow\"", OffsetDateTime.class))
                .isInstanceOf(JsonMappingException.class);
    }

    @Test
    @DisplayName("should reject numeric timestamps")
    void rejectsNumbers() {
        assertThatThrownBy(() -> mapperFor("UTC").readValue("1700000000", OffsetDateTime.class))
                .isInstanceOf(JsonMappingException.class);
    }
}
