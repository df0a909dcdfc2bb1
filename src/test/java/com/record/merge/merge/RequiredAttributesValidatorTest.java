package com.record.merge.merge;

import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RequiredAttributesValidatorTest {

    private final RequiredAttributesValidator validator = new RequiredAttributesValidator();

    @Test
    void account_requiresName() {
        CrmRecord account = CrmRecord.builder().type(RecordType.ACCOUNT).attribute("name", "  ").build();

        assertEquals(List.of("name can't be blank"), validator.validate(account));
    }

    @Test
    void contact_requiresFirstAndLastName() {
        CrmRecord contact = CrmRecord.builder().type(RecordType.CONTACT).attribute("first_name", "Ann").build();

        assertEquals(List.of("last_name can't be blank"), validator.validate(contact));
    }

    @Test
    void customRules_replaceDefaults() {
        RequiredAttributesValidator custom = new RequiredAttributesValidator(
                Map.of(RecordType.ACCOUNT, List.of("email")));
        CrmRecord account = CrmRecord.builder().type(RecordType.ACCOUNT).build();

        assertEquals(List.of("email can't be blank"), custom.validate(account));
        assertTrue(custom.validate(CrmRecord.builder().type(RecordType.CONTACT).build()).isEmpty());
    }
}
