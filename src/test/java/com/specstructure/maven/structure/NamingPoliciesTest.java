package com.specstructure.maven.structure;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.specstructure.maven.metadata.Characteristic;
import com.specstructure.maven.metadata.CharacteristicValue;

/**
 * Ordering, context words, descriptions and let lines for single (characteristic, value) pairs.
 */
class NamingPoliciesTest {

    private static Characteristic characteristic(String name, String type, String... values) {
        Map<String, Object> map = new HashMap<>();
        map.put("name", name);
        map.put("type", type);
        map.put("level", 1);
        List<Map<String, Object>> valueMaps = new ArrayList<>();
        for (String value : values) {
            valueMaps.add(Map.of("value", value));
        }
        map.put("values", valueMaps);
        return Characteristic.fromMap(map);
    }

    @ParameterizedTest
    @ValueSource(strings = { "not_found", "no_items", "invalid_token", "missing_user", "without_tax", "unpaid",
            "false", "nil", "" })
    void testStateOrdering_SwapsNegativeFirst(String negative) {
        Characteristic c = characteristic("state", Characteristic.BOOLEAN, negative, "ok");

        assertThat(StateOrdering.order(c)).extracting(CharacteristicValue::getValue).containsExactly("ok", negative);
    }

    @Test
    void testStateOrdering_KeepsAffirmativeFirst() {
        Characteristic c = characteristic("state", Characteristic.PRESENCE, "present", "absent");

        assertThat(StateOrdering.order(c)).extracting(CharacteristicValue::getValue)
                .containsExactly("present", "absent");
    }

    @Test
    void testStateOrdering_LeavesEnumAlone() {
        Characteristic c = characteristic("status", Characteristic.ENUM, "not_started", "running", "done");

        assertThat(StateOrdering.order(c)).extracting(CharacteristicValue::getValue)
                .containsExactly("not_started", "running", "done");
    }

    @ParameterizedTest
    @ValueSource(strings = { Characteristic.BOOLEAN, Characteristic.PRESENCE, Characteristic.ENUM,
            Characteristic.RANGE, Characteristic.SEQUENTIAL })
    void testContextWords_LevelOneIsAlwaysWhen(String type) {
        Characteristic c = characteristic("c", type, "a", "b", "c");

        assertThat(ContextWords.determine(c, 0, 1)).isEqualTo("when");
        assertThat(ContextWords.determine(c, 2, 1)).isEqualTo("when");
    }

    @Test
    void testContextWords_EnumAndSequentialContinue() {
        assertThat(ContextWords.determine(characteristic("c", Characteristic.ENUM, "a", "b"), 0, 2)).isEqualTo("and");
        assertThat(ContextWords.determine(characteristic("c", Characteristic.SEQUENTIAL, "a", "b"), 1, 3))
                .isEqualTo("and");
    }

    @Test
    void testContextWords_BinaryPairs() {
        Characteristic c = characteristic("c", Characteristic.BOOLEAN, "yes", "no");

        assertThat(ContextWords.determine(c, 0, 2)).isEqualTo("with");
        assertThat(ContextWords.determine(c, 1, 2)).isEqualTo("but");
    }

    @Test
    void testContextWords_Range() {
        Characteristic two = characteristic("amount", Characteristic.RANGE, "above", "below");
        Characteristic three = characteristic("amount", Characteristic.RANGE, "low", "mid", "high");

        assertThat(ContextWords.determine(two, 0, 2)).isEqualTo("with");
        assertThat(ContextWords.determine(two, 1, 2)).isEqualTo("but");
        assertThat(ContextWords.determine(three, 1, 2)).isEqualTo("and");
    }

    @Test
    void testContextWords_UnknownTypeIsPlaceholder() {
        Characteristic c = characteristic("c", "fuzzy", "a", "b");

        assertThat(ContextWords.determine(c, 0, 2)).isEqualTo(Placeholders.CONTEXT_WORD);
    }

    @Test
    void testDescription_BinaryUsesValueDescription() {
        Characteristic c = characteristic("user", Characteristic.BOOLEAN, "x");
        CharacteristicValue value = CharacteristicValue.fromMap(Map.of("value", "not_admin",
                "description", "the user is not an admin"));

        assertThat(DescriptionFormatter.format(c, value)).isEqualTo("the user is NOT an admin");
    }

    @Test
    void testDescription_EnumReadsNameIsValue() {
        Characteristic c = characteristic("payment_status", Characteristic.ENUM, "x");
        CharacteristicValue value = CharacteristicValue.fromMap(Map.of("value", "partially_paid"));

        assertThat(DescriptionFormatter.format(c, value)).isEqualTo("payment status is partially paid");
    }

    @Test
    void testDescription_NotInsideWordIsUntouched() {
        assertThat(DescriptionFormatter.emphasizeNot("nothing is not noted")).isEqualTo("nothing is NOT noted");
    }

    @Test
    void testLetBlock_PerType() {
        assertThat(LetBlockGenerator.generate(characteristic("admin", Characteristic.BOOLEAN, "x"),
                CharacteristicValue.fromMap(Map.of("value", "true")))).isEqualTo("let(:admin) { true }");
        assertThat(LetBlockGenerator.generate(characteristic("token", Characteristic.PRESENCE, "x"),
                CharacteristicValue.fromMap(Map.of("value", "present")))).isEqualTo("let(:token) { true }");
        assertThat(LetBlockGenerator.generate(characteristic("token", Characteristic.PRESENCE, "x"),
                CharacteristicValue.fromMap(Map.of("value", "absent")))).isEqualTo("let(:token) { nil }");
        assertThat(LetBlockGenerator.generate(characteristic("status", Characteristic.ENUM, "x"),
                CharacteristicValue.fromMap(Map.of("value", "draft")))).isEqualTo("let(:status) { :draft }");
        assertThat(LetBlockGenerator.generate(characteristic("c", "fuzzy", "x"),
                CharacteristicValue.fromMap(Map.of("value", "a")))).isNull();
    }

    @Test
    void testLetBlock_RangeKeepsThresholdPlaceholder() {
        Characteristic c = characteristic("amount", Characteristic.RANGE, "above", "below");
        c.setThresholdOperator(">=");
        c.setThresholdValue("100");

        assertThat(LetBlockGenerator.generate(c, c.getValues().get(0)))
                .isEqualTo("let(:amount) { {THRESHOLD_VALUE} }  # >= 100");
    }
}
