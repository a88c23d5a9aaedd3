package com.example.permchange.access;

import com.example.permchange.config.PermissionChangeProperties;
import com.example.permchange.models.PermissionChange;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

@Component
public class DynamoPermissionChangeAccess implements PermissionChangeAccess {

    // status_code may be absent or stored as an explicit NULL attribute
    private static final String UNPROCESSED_CONDITION =
            "(attribute_not_exists(status_code) OR attribute_type(status_code, :null_type))";
    private static final AttributeValue NULL_TYPE = AttributeValue.builder().s("NULL").build();

    private final DynamoDbTable<PermissionChange> table;

    public DynamoPermissionChangeAccess(DynamoDbEnhancedClient enhancedClient,
                                        PermissionChangeProperties properties) {
        this.table = enhancedClient.table(properties.getTableName(),
                TableSchema.fromImmutableClass(PermissionChange.class));
    }

    @Override
    public Optional<PermissionChange> findById(String id) {
        return Optional.ofNullable(table.getItem(r -> r.key(Key.builder()
                        .partitionValue(id)
                        .build())
                .consistentRead(true)));
    }

    @Override
    public List<PermissionChange> findUnprocessed(int limit) {
        ScanEnhancedRequest scanRequest = ScanEnhancedRequest.builder()
                .filterExpression(Expression.builder()
                        .expression(UNPROCESSED_CONDITION)
                        .putExpressionValue(":null_type", NULL_TYPE)
                        .build())
                .build();

        return table.scan(scanRequest)
                .items()
                .stream()
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public PermissionChange save(PermissionChange change) {
        table.putItem(r -> r.item(change)
                .conditionExpression(Expression.builder()
                        .expression("attribute_not_exists(id)")
                        .build()));
        return change;
    }

    @Override
    public PermissionChange updateStatus(PermissionChange change) {
        // first write only; repeats are resolved by the caller after a re-read
        Expression condition = Expression.builder()
                .expression("attribute_exists(id) AND " + UNPROCESSED_CONDITION)
                .putExpressionValue(":null_type", NULL_TYPE)
                .build();

        return table.updateItem(r -> r.item(change).conditionExpression(condition));
    }
}
