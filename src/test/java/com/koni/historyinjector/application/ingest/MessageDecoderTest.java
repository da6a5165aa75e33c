package com.koni.historyinjector.application.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.historyinjector.domain.exception.DecodeException;
import com.koni.historyinjector.domain.model.HistoryRecord;
import com.koni.historyinjector.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for MessageDecoder.
 * Tests both payload shapes, entity id derivation and every malformed-payload rule.
 */
@UnitTest
class MessageDecoderTest {

    private static final String TOPIC = "homeassistant/history/sensor.bedroom_temperature";

    private MessageDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new MessageDecoder(new ObjectMapper(), "homeassistant/history/", "sensor.");
    }

    @Test
    void shouldDecodeSingleRecord() {
        // Given
        String payload = "{\"state\":\"23.5\",\"timestamp\":\"2023-04-15T02:30:00Z\","
                + "\"attributes\":{\"unit_of_measurement\":\"°C\",\"friendly_name\":\"Bedroom Temp\"}}";

        // When
        List<HistoryRecord> records = decoder.decode(TOPIC, bytes(payload));

        // Then
        assertThat(records).hasSize(1);
        HistoryRecord record = records.get(0);
        assertThat(record.getEntityId()).isEqualTo("sensor.bedroom_temperature");
        assertThat(record.getIndex()).isZero();
        assertThat(record.getState()).isEqualTo("23.5");
        assertThat(record.getTimestamp()).isEqualTo("2023-04-15T02:30:00Z");
        assertThat(record.getAttributes())
                .containsEntry("unit_of_measurement", "°C")
                .containsEntry("friendly_name", "Bedroom Temp");
    }

    @Test
    void shouldDecodeBatchInArrayOrder() {
        // Given
        String payload = "{\"records\":["
                + "{\"state\":\"23.5\",\"timestamp\":\"2023-04-15T02:30:00\"},"
                + "{\"state\":\"23.1\",\"timestamp\":\"2023-04-15T03:30:00\"},"
                + "{\"state\":\"22.9\",\"timestamp\":\"2023-04-15T04:30:00\"}]}";

        // When
        List<HistoryRecord> records = decoder.decode(TOPIC, bytes(payload));

        // Then
        assertThat(records).extracting(HistoryRecord::getState).containsExactly("23.5", "23.1", "22.9");
        assertThat(records).extracting(HistoryRecord::getIndex).containsExactly(0, 1, 2);
        assertThat(records).extracting(HistoryRecord::getEntityId).containsOnly("sensor.bedroom_temperature");
    }

    @Test
    void shouldTreatMissingAttributesAsEmpty() {
        List<HistoryRecord> records = decoder.decode(TOPIC,
                bytes("{\"state\":\"on\",\"timestamp\":\"2023-04-15\"}"));

        assertThat(records.get(0).getAttributes()).isEmpty();
    }

    @Test
    void shouldStoreNumericAndBooleanStatesAsText() {
        List<HistoryRecord> records = decoder.decode(TOPIC, bytes("{\"records\":["
                + "{\"state\":23.5,\"timestamp\":\"2023-04-15T02:30:00Z\"},"
                + "{\"state\":true,\"timestamp\":\"2023-04-15T03:30:00Z\"}]}"));

        assertThat(records).extracting(HistoryRecord::getState).containsExactly("23.5", "true");
    }

    @Test
    void shouldFallBackToPayloadEntityIdWhenTopicHasNoSuffix() {
        List<HistoryRecord> records = decoder.decode("homeassistant/history/",
                bytes("{\"entity_id\":\"sensor.kitchen_humidity\",\"state\":\"40\",\"timestamp\":\"2023-04-15\"}"));

        assertThat(records.get(0).getEntityId()).isEqualTo("sensor.kitchen_humidity");
    }

    @Test
    void shouldFallBackToDeviceIdWithDefaultPrefix() {
        List<HistoryRecord> records = decoder.decode("homeassistant.history",
                bytes("{\"device_id\":\"garage_door\",\"state\":\"open\",\"timestamp\":\"2023-04-15\"}"));

        assertThat(records.get(0).getEntityId()).isEqualTo("sensor.garage_door");
    }

    @Test
    void shouldPreferTopicOverPayloadEntityId() {
        List<HistoryRecord> records = decoder.decode(TOPIC,
                bytes("{\"entity_id\":\"sensor.other\",\"state\":\"1\",\"timestamp\":\"2023-04-15\"}"));

        assertThat(records.get(0).getEntityId()).isEqualTo("sensor.bedroom_temperature");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "not json",
            "[1,2,3]",
            "{\"timestamp\":\"2023-04-15T02:30:00Z\"}",
            "{\"state\":\"23.5\"}",
            "{\"state\":null,\"timestamp\":\"2023-04-15T02:30:00Z\"}",
            "{\"state\":\"\",\"timestamp\":\"2023-04-15T02:30:00Z\"}",
            "{\"state\":{\"nested\":1},\"timestamp\":\"2023-04-15T02:30:00Z\"}",
            "{\"state\":\"1\",\"timestamp\":12345}",
            "{\"state\":\"1\",\"timestamp\":\"2023-04-15\",\"attributes\":[1]}",
            "{\"records\":[]}",
            "{\"records\":{}}",
            "{\"records\":[{\"state\":\"1\",\"timestamp\":\"2023-04-15\"},{\"state\":\"2\"}]}"
    })
    void shouldRejectMalformedPayload(String payload) {
        assertThatThrownBy(() -> decoder.decode(TOPIC, bytes(payload)))
                .isInstanceOf(DecodeException.class);
    }

    @Test
    void shouldRejectInvalidUtf8() {
        byte[] payload = {'{', '"', 's', '"', ':', (byte) 0xC3, (byte) 0x28, '}'};

        assertThatThrownBy(() -> decoder.decode(TOPIC, payload))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("UTF-8");
    }

    @Test
    void shouldRejectEmptyPayload() {
        assertThatThrownBy(() -> decoder.decode(TOPIC, new byte[0]))
                .isInstanceOf(DecodeException.class);
    }

    @Test
    void shouldRejectStateLongerThanColumn() {
        String state = "x".repeat(MessageDecoder.MAX_STATE_LENGTH + 1);

        assertThatThrownBy(() -> decoder.decode(TOPIC,
                bytes("{\"state\":\"" + state + "\",\"timestamp\":\"2023-04-15\"}")))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("exceeds");
    }

    @Test
    void shouldRejectInvalidEntityId() {
        assertThatThrownBy(() -> decoder.decode("homeassistant/history/Sensor.Bad-Name",
                bytes("{\"state\":\"1\",\"timestamp\":\"2023-04-15\"}")))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("Invalid entity id");
    }

    @Test
    void shouldRejectMessageWithoutAnyEntityId() {
        assertThatThrownBy(() -> decoder.decode("some/other/topic",
                bytes("{\"state\":\"1\",\"timestamp\":\"2023-04-15\"}")))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("Could not determine entity id");
    }

    @Test
    void shouldKeepNestedAttributeStructure() {
        List<HistoryRecord> records = decoder.decode(TOPIC, bytes(
                "{\"state\":\"1\",\"timestamp\":\"2023-04-15\",\"attributes\":{\"limits\":{\"max\":30,\"min\":10}}}"));

        assertThat(records.get(0).getAttributes().get("limits")).isEqualTo(Map.of("max", 30, "min", 10));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
