package com.example.permchange.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class PermissionDirectiveTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final PermissionDirectiveAttributeConverter converter = new PermissionDirectiveAttributeConverter();

    @Test
    @DisplayName("nullable booleans map onto the three directives")
    void ofNullableBoolean() {
        assertEquals(PermissionDirective.GRANT, PermissionDirective.of(true));
        assertEquals(PermissionDirective.REVOKE, PermissionDirective.of(false));
        assertEquals(PermissionDirective.UNSPECIFIED, PermissionDirective.of(null));

        assertEquals(Boolean.TRUE, PermissionDirective.GRANT.asBoolean());
        assertEquals(Boolean.FALSE, PermissionDirective.REVOKE.asBoolean());
        assertNull(PermissionDirective.UNSPECIFIED.asBoolean());
        assertFalse(PermissionDirective.UNSPECIFIED.isSpecified());
        assertTrue(PermissionDirective.REVOKE.isSpecified());
    }

    @Test
    @DisplayName("JSON form is the authority's nullable boolean")
    void jsonUsesNullableBoolean() throws Exception {
        assertEquals("true", MAPPER.writeValueAsString(PermissionDirective.GRANT));
        assertEquals("false", MAPPER.writeValueAsString(PermissionDirective.REVOKE));
        assertEquals("null", MAPPER.writeValueAsString(PermissionDirective.UNSPECIFIED));
        assertEquals(PermissionDirective.REVOKE, MAPPER.readValue("false", PermissionDirective.class));
    }

    @Test
    @DisplayName("converter writes BOOL for explicit directives and NULL for unspecified")
    void converterWritesAttributes() {
        assertEquals(Boolean.TRUE, converter.transformFrom(PermissionDirective.GRANT).bool());
        assertEquals(Boolean.FALSE, converter.transformFrom(PermissionDirective.REVOKE).bool());
        assertEquals(Boolean.TRUE, converter.transformFrom(PermissionDirective.UNSPECIFIED).nul());
        assertEquals(Boolean.TRUE, converter.transformFrom(null).nul());
    }

    @Test
    @DisplayName("converter reads NULL and missing attributes as unspecified")
    void converterReadsAttributes() {
        assertEquals(PermissionDirective.GRANT,
                converter.transformTo(AttributeValue.builder().bool(true).build()));
        assertEquals(PermissionDirective.REVOKE,
                converter.transformTo(AttributeValue.builder().bool(false).build()));
        assertEquals(PermissionDirective.UNSPECIFIED,
                converter.transformTo(AttributeValue.builder().nul(true).build()));
        assertEquals(PermissionDirective.UNSPECIFIED, converter.transformTo(null));
    }
}
