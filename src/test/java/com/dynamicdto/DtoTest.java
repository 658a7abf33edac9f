package com.dynamicdto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.dynamicdto.exception.DtoEncodingException;
import com.dynamicdto.exception.DtoInvalidAttributeException;
import com.dynamicdto.exception.DtoInvalidKeyException;
import com.dynamicdto.fixtures.PlainDto;
import com.dynamicdto.fixtures.UserDto;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the Dto attribute lifecycle and change tracking.
 */
class DtoTest {

    @Test
    void testSetThenGetReturnsValue() {
        PlainDto dto = new PlainDto();

        dto.set("name", "Alex");

        assertThat(dto.get("name")).isEqualTo("Alex");
        assertThat(dto.has("name")).isTrue();
        assertThat(dto.has("age")).isFalse();
    }

    @Test
    void testNoArgConstructorLeavesDtoUninitialized() {
        PlainDto dto = new PlainDto();

        assertThat(dto.isInitialized()).isFalse();

        dto.fill();

        assertThat(dto.isInitialized()).isTrue();
    }

    @Test
    void testMapConstructorInitializesEvenWhenEmpty() {
        assertThat(new PlainDto(Map.of()).isInitialized()).isTrue();
        assertThat(new PlainDto(Map.of("a", 1)).isInitialized()).isTrue();
    }

    @Test
    void testInitializationSnapshotsOriginal() {
        PlainDto dto = new PlainDto();
        dto.set("a", 1);
        dto.set("a", 2);

        dto.fill();

        assertThat(dto.getOriginal()).containsExactly(entry("a", 2));
    }

    @Test
    void testSecondFillDoesNotResnapshot() {
        PlainDto dto = new PlainDto(Map.of("a", 1));
        dto.set("a", 2);

        dto.fill();
        dto.fill(Map.of());

        assertThat(dto.getOriginal("a")).isEqualTo(1);
        assertThat(dto.getDirty()).containsExactly(entry("a", 2));
        assertThat(dto.isInitialized()).isTrue();
    }

    @Test
    void testFirstAssignmentSetsOriginalOnly() {
        PlainDto dto = new PlainDto(Map.of());

        dto.set("a", 1);

        assertThat(dto.getOriginal("a")).isEqualTo(1);
        assertThat(dto.getDirty("a")).isNull();
        assertThat(dto.isDirty()).isFalse();
    }

    @Test
    void testOverwriteMarksDirtyAndKeepsOriginal() {
        PlainDto dto = new PlainDto(Map.of("a", 1));

        dto.set("a", 2);

        assertThat(dto.get("a")).isEqualTo(2);
        assertThat(dto.getOriginal("a")).isEqualTo(1);
        assertThat(dto.getDirty("a")).isEqualTo(2);
    }

    @Test
    void testDirtyUsesValueEquality() {
        PlainDto dto = new PlainDto(Map.of("name", "Alex"));

        dto.set("name", new String("Alex"));

        assertThat(dto.getDirty()).isEmpty();
    }

    @Test
    void testRestoringOriginalValueClearsDirtyEntry() {
        PlainDto dto = new PlainDto(Map.of("a", 1));

        dto.set("a", 2);
        dto.set("a", 1);

        assertThat(dto.getDirty()).isEmpty();
    }

    @Test
    void testSyncOriginalTakesCurrentValuesAndKeepsDirty() {
        PlainDto dto = new PlainDto(Map.of("a", 1));
        dto.set("a", 2);

        dto.syncOriginal();

        assertThat(dto.getOriginal()).containsExactly(entry("a", 2));
        assertThat(dto.getDirty("a")).isEqualTo(2);
        assertThat(dto.isInitialized()).isTrue();
    }

    @Test
    void testFillLaterEntriesWin() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("a", 1);
        values.put("b", 2);

        PlainDto dto = new PlainDto(values);
        dto.fill(Map.of("a", 3));

        assertThat(dto.all()).containsExactly(entry("a", 3), entry("b", 2));
    }

    @Test
    void testNumericKeyIsRejected() {
        PlainDto dto = new PlainDto();

        assertThatThrownBy(() -> dto.set("123", "x"))
                .isInstanceOf(DtoInvalidKeyException.class)
                .hasMessageContaining("123");
        assertThatThrownBy(() -> dto.set("", "x")).isInstanceOf(DtoInvalidKeyException.class);
        assertThatThrownBy(() -> dto.set(null, "x")).isInstanceOf(DtoInvalidKeyException.class);
        assertThat(dto.count()).isZero();
    }

    @Test
    void testUnknownAttributeReadFails() {
        PlainDto dto = new PlainDto(Map.of("a", 1));

        assertThatThrownBy(() -> dto.get("missing"))
                .isInstanceOf(DtoInvalidAttributeException.class)
                .hasMessage("Property [missing] was not found in this object.");
    }

    @Test
    void testNullValueIsStoredAndReadable() {
        PlainDto dto = new PlainDto(Collections.singletonMap("name", null));

        assertThat(dto.has("name")).isTrue();
        assertThat(dto.get("name")).isNull();
    }

    @Test
    void testIsEmptyLooksAtValues() {
        PlainDto dto = new PlainDto(Collections.singletonMap("name", null));

        assertThat(dto.isEmpty()).isTrue();
        assertThat(dto.isFilled()).isFalse();

        dto.set("name", "x");

        assertThat(dto.isEmpty()).isFalse();
        assertThat(dto.isFilled()).isTrue();
        assertThat(new PlainDto().isEmpty()).isTrue();
    }

    @Test
    void testUnsetRemovesAttributeAndDirtyEntry() {
        PlainDto dto = new PlainDto(Map.of("a", 1));
        dto.set("a", 2);

        dto.unset("a").unset("never-set");

        assertThat(dto.has("a")).isFalse();
        assertThat(dto.getDirty()).isEmpty();
    }

    @Test
    void testAccessorsReturnCopies() {
        PlainDto dto = new PlainDto(Map.of("a", 1));

        dto.all().put("b", 2);
        dto.toArray().clear();
        dto.getOriginal().clear();

        assertThat(dto.getAttributes()).containsExactly(entry("a", 1));
        assertThat(dto.getOriginal()).containsExactly(entry("a", 1));
    }

    @Test
    void testIterationFollowsInsertionOrder() {
        PlainDto dto = new PlainDto();
        dto.set("z", 1).set("a", 2).set("m", 3);

        List<String> names = new ArrayList<>();
        for (Map.Entry<String, Object> entry : dto) {
            names.add(entry.getKey());
        }

        assertThat(names).containsExactly("z", "a", "m");
        assertThat(dto.count()).isEqualTo(3);
    }

    @Test
    void testTypedGetter() {
        UserDto dto = new UserDto(Map.of("name", "Alex"));

        assertThat(dto.getName()).isEqualTo("Alex");
        assertThatThrownBy(() -> dto.get("name", Integer.class)).isInstanceOf(ClassCastException.class);
    }

    @Test
    void testToJsonRoundTrip() throws Exception {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", "Alex");
        values.put("age", 30);
        values.put("active", true);
        values.put("tags", List.of("a", "b"));
        values.put("manager", null);
        PlainDto dto = new PlainDto(values);

        String json = dto.toJson();
        Map<String, Object> decoded = new ObjectMapper().readValue(json, new TypeReference<Map<String, Object>>() {
        });

        assertThat(json).startsWith("{\"name\":\"Alex\",\"age\":30");
        assertThat(decoded).isEqualTo(dto.all());
    }

    @Test
    void testToJsonWithFeatures() {
        PlainDto dto = new PlainDto(Map.of("name", "Alex"));

        assertThat(dto.toJson(SerializationFeature.INDENT_OUTPUT)).contains(System.lineSeparator());
    }

    @Test
    void testToJsonPropagatesEncodingFailure() {
        PlainDto dto = new PlainDto(Map.of("handle", new Object()));

        assertThatThrownBy(dto::toJson)
                .isInstanceOf(DtoEncodingException.class)
                .hasCauseInstanceOf(JsonProcessingException.class);
    }

    @Test
    void testSilentModeAbsorbsFailures() {
        PlainDto dto = new PlainDto();
        dto.shouldBeSilent(true);

        dto.set("42", "x");

        assertThat(dto.count()).isZero();
        assertThat(dto.get("missing")).isNull();
        assertThat(dto.isSilent()).isTrue();

        dto.shouldBeSilent(false);

        assertThatThrownBy(() -> dto.get("missing")).isInstanceOf(DtoInvalidAttributeException.class);
    }

    @Test
    void testTrySetReportsOutcome() {
        PlainDto dto = new PlainDto();

        AttributeResult ok = dto.trySetAttribute("name", "Alex");
        AttributeResult rejected = dto.trySetAttribute("7", "x");

        assertThat(ok.isSuccess()).isTrue();
        assertThat(ok.getValue()).isEqualTo("Alex");
        assertThat(rejected.isFailure()).isTrue();
        assertThat(rejected.getError()).isInstanceOf(DtoInvalidKeyException.class);
        assertThatThrownBy(rejected::orElseThrow).isInstanceOf(DtoInvalidKeyException.class);
    }

    @Test
    void testTryGetReportsOutcome() {
        PlainDto dto = new PlainDto(Map.of("a", 1));

        assertThat(dto.tryGetAttribute("a").orElseThrow()).isEqualTo(1);
        assertThat(dto.tryGetAttribute("b").getErrorIfPresent())
                .containsInstanceOf(DtoInvalidAttributeException.class);
    }

    @Test
    void testFillQuietlyReturnsRejectedEntries() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", "Alex");
        values.put("age", 30);
        values.put("0", "zero");

        UserDto dto = new UserDto();
        List<AttributeResult> rejected = dto.fillQuietly(values);

        assertThat(dto.all()).containsExactly(entry("name", "Alex"));
        assertThat(rejected).extracting(AttributeResult::getName).containsExactly("age", "0");
        assertThat(dto.isInitialized()).isTrue();
    }

    @Test
    void testToStringShowsTypeAndAttributes() {
        Map<String, Object> values = new HashMap<>();
        values.put("a", 1);

        assertThat(new PlainDto(values).toString()).isEqualTo("PlainDto{a=1}");
    }
}
