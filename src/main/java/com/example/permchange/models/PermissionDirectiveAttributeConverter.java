package com.example.permchange.models;

import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Stores directives as the nullable booleans the authority reads: BOOL for grant/revoke,
 * NULL for unspecified.
 */
public class PermissionDirectiveAttributeConverter implements AttributeConverter<PermissionDirective> {

    @Override
    public AttributeValue transformFrom(PermissionDirective input) {
        if (input == null || !input.isSpecified()) {
            return AttributeValue.builder().nul(true).build();
        }
        return AttributeValue.builder().bool(input.asBoolean()).build();
    }

    @Override
    public PermissionDirective transformTo(AttributeValue attributeValue) {
        if (attributeValue == null) {
            return PermissionDirective.UNSPECIFIED;
        }
        if (Boolean.TRUE.equals(attributeValue.nul())) {
            return PermissionDirective.UNSPECIFIED;
        }
        return PermissionDirective.of(attributeValue.bool());
    }

    @Override
    public EnhancedType<PermissionDirective> type() {
        return EnhancedType.of(PermissionDirective.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.BOOL;
    }
}
