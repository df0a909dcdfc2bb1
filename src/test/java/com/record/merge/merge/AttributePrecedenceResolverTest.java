package com.record.merge.merge;

import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AttributePrecedenceResolver Tests")
class AttributePrecedenceResolverTest {

    private final AttributePrecedenceResolver resolver = new AttributePrecedenceResolver();

    private static Map<String, Object> attrs(Object... pairs) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], pairs[i + 1]);
        }
        return map;
    }

    private static CrmRecord account(String id, Object... pairs) {
        return CrmRecord.builder().id(id).type(RecordType.ACCOUNT).attributes(attrs(pairs)).build();
    }

    @Nested
    @DisplayName("Default precedence")
    class DefaultPrecedence {

        @Test
        @DisplayName("Present master value wins")
        void masterWins() {
            Map<String, AttributeSource> p = resolver.defaultPrecedence(
                    attrs("name", "Dup"), attrs("name", "Master"));
            assertEquals(AttributeSource.MASTER, p.get("name"));
        }

        @Test
        @DisplayName("Duplicate fills a blank master value")
        void duplicateFillsBlank() {
            Map<String, AttributeSource> p = resolver.defaultPrecedence(
                    attrs("phone", "555", "fax", "777", "email", "d@x"),
                    attrs("phone", null, "fax", "  ", "email", ""));
            assertEquals(AttributeSource.DUPLICATE, p.get("phone"));
            assertEquals(AttributeSource.DUPLICATE, p.get("fax"));
            assertEquals(AttributeSource.DUPLICATE, p.get("email"));
        }

        @Test
        @DisplayName("Attributes blank on both sides are omitted")
        void bothBlankOmitted() {
            Map<String, AttributeSource> p = resolver.defaultPrecedence(attrs("fax", ""), attrs("fax", null));
            assertFalse(p.containsKey("fax"));
        }

        @Test
        @DisplayName("false and 0 count as values")
        void falseAndZeroArePresent() {
            Map<String, AttributeSource> p = resolver.defaultPrecedence(
                    attrs("do_not_call", true, "rating", 5),
                    attrs("do_not_call", false, "rating", 0));
            assertEquals(AttributeSource.MASTER, p.get("do_not_call"));
            assertEquals(AttributeSource.MASTER, p.get("rating"));
        }

        @Test
        @DisplayName("Permanently ignored attributes never appear")
        void permanentlyIgnoredSkipped() {
            Map<String, AttributeSource> p = resolver.defaultPrecedence(
                    attrs("id", "d", "created_at", "x", "subscribed_users", "1,2"),
                    attrs("id", null, "updated_at", null));
            assertTrue(p.isEmpty());
        }
    }

    @Nested
    @DisplayName("Merge plan")
    class Plan {

        @Test
        @DisplayName("Caller-ignored attributes stay with the master even when blank there")
        void ignoredPinnedToMaster() {
            AttributePlan plan = resolver.plan(account("d", "website", "https://d.example"),
                    account("m", "name", "M"), List.of("website"));

            assertEquals(AttributeSource.MASTER, plan.sourceOf("website"));
            assertTrue(plan.excluded().contains("website"));
            assertTrue(plan.duplicateAttributes().isEmpty());
        }

        @Test
        @DisplayName("Explicit choice overrides the default, even for a blank duplicate value")
        void choiceOverridesDefault() {
            AttributePlan plan = resolver.plan(account("d", "phone", ""),
                    account("m", "phone", "555"), List.of(),
                    Map.of("phone", AttributeSource.DUPLICATE));

            CrmRecord master = account("m", "phone", "555");
            List<String> copied = plan.applyTo(master, account("d", "phone", ""));

            assertEquals(List.of("phone"), copied);
            assertEquals("", master.get("phone"));
        }

        @Test
        @DisplayName("Ignored attributes beat explicit choices")
        void ignoredBeatsChoice() {
            AttributePlan plan = resolver.plan(account("d", "phone", "1"), account("m", "phone", "2"),
                    List.of("phone"), Map.of("phone", AttributeSource.DUPLICATE));
            assertEquals(AttributeSource.MASTER, plan.sourceOf("phone"));
        }

        @Test
        @DisplayName("Custom fields are mergeable")
        void customFieldChoiceAccepted() {
            AttributePlan plan = resolver.plan(account("d"), account("m"), List.of(),
                    Map.of("cf_region", AttributeSource.DUPLICATE));
            assertEquals(AttributeSource.DUPLICATE, plan.sourceOf("cf_region"));
        }

        @Test
        @DisplayName("Choice on an unknown attribute is rejected")
        void unknownChoiceRejected() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
                    resolver.plan(account("d"), account("m"), List.of(),
                            Map.of("shoe_size", AttributeSource.MASTER)));
            assertTrue(e.getMessage().contains("shoe_size"));
        }

        @Test
        @DisplayName("Choice on a permanently ignored attribute is skipped")
        void permanentChoiceSkipped() {
            AttributePlan plan = resolver.plan(account("d"), account("m"), List.of(),
                    Map.of("created_at", AttributeSource.DUPLICATE));
            assertNull(plan.sourceOf("created_at"));
        }

        @Test
        @DisplayName("applyTo reports only values that changed")
        void applyReportsChanges() {
            CrmRecord duplicate = account("d", "phone", "555", "fax", "777");
            CrmRecord master = account("m", "fax", "777");
            AttributePlan plan = resolver.plan(duplicate, master, List.of(),
                    Map.of("fax", AttributeSource.DUPLICATE));

            assertEquals(List.of("phone"), plan.applyTo(master, duplicate));
            assertEquals("555", master.get("phone"));
        }
    }
}
