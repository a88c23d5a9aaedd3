package com.example.permchange.requests;

import com.example.permchange.models.PermissionDirective;
import java.util.UUID;

/**
 * Service-layer command for creating a permission change. Targeting is passed through as given;
 * the {@link com.example.permchange.models.PermissionChange} builder decides whether it is
 * well-formed.
 */
public record CreatePermissionChangeServiceRequest(
        String userId,
        String metadataKey,
        String metadataValue,
        String realmUrl,
        PermissionDirective mayRead,
        PermissionDirective mayWrite,
        PermissionDirective mayManage,
        String requestId
) {

    public CreatePermissionChangeServiceRequest {
        mayRead = mayRead == null ? PermissionDirective.UNSPECIFIED : mayRead;
        mayWrite = mayWrite == null ? PermissionDirective.UNSPECIFIED : mayWrite;
        mayManage = mayManage == null ? PermissionDirective.UNSPECIFIED : mayManage;
        requestId = (requestId == null || requestId.isBlank()) ? UUID.randomUUID().toString() : requestId;
    }

    public static CreatePermissionChangeServiceRequest forUser(String userId,
                                                               String realmUrl,
                                                               PermissionDirective mayRead,
                                                               PermissionDirective mayWrite,
                                                               PermissionDirective mayManage) {
        return new CreatePermissionChangeServiceRequest(
                userId, null, null, realmUrl, mayRead, mayWrite, mayManage, null);
    }

    public static CreatePermissionChangeServiceRequest forMetadata(String metadataKey,
                                                                   String metadataValue,
                                                                   String realmUrl,
                                                                   PermissionDirective mayRead,
                                                                   PermissionDirective mayWrite,
                                                                   PermissionDirective mayManage) {
        return new CreatePermissionChangeServiceRequest(
                null, metadataKey, metadataValue, realmUrl, mayRead, mayWrite, mayManage, null);
    }

    public static CreatePermissionChangeServiceRequest from(CreatePermissionChangeHttpRequest request,
                                                            String requestId) {
        return new CreatePermissionChangeServiceRequest(
                request.userId(),
                request.metadataKey(),
                request.metadataValue(),
                request.realmUrl(),
                PermissionDirective.of(request.mayRead()),
                PermissionDirective.of(request.mayWrite()),
                PermissionDirective.of(request.mayManage()),
                requestId
        );
    }
}
