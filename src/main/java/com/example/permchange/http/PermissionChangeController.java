package com.example.permchange.http;

import com.example.permchange.models.PermissionChange;
import com.example.permchange.models.ProcessingStatus;
import com.example.permchange.models.ServerError;
import com.example.permchange.requests.ApplyStatusHttpRequest;
import com.example.permchange.requests.ApplyStatusServiceRequest;
import com.example.permchange.requests.CreatePermissionChangeHttpRequest;
import com.example.permchange.requests.CreatePermissionChangeServiceRequest;
import com.example.permchange.service.PermissionChangeService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for permission changes. Clients create changes and read their status; the
 * authority picks up unprocessed changes and writes the outcome back through the status endpoint.
 */
@RestController
public class PermissionChangeController {

    private final PermissionChangeService permissionChangeService;

    public PermissionChangeController(PermissionChangeService permissionChangeService) {
        this.permissionChangeService = permissionChangeService;
    }

    @PostMapping("/permission-changes")
    public ResponseEntity<PermissionChangeResponse> create(
            @Valid @RequestBody CreatePermissionChangeHttpRequest request,
            @RequestAttribute(value = RequestIdFilter.MDC_KEY, required = false) String requestId
    ) {
        PermissionChange change = permissionChangeService.create(
                CreatePermissionChangeServiceRequest.from(request, requestId));

        return ResponseEntity.status(HttpStatus.CREATED).body(map(change));
    }

    @GetMapping("/permission-changes/{changeId}")
    public ResponseEntity<PermissionChangeResponse> get(@PathVariable String changeId) {
        return ResponseEntity.ok(map(permissionChangeService.getById(changeId)));
    }

    @GetMapping("/permission-changes")
    public ResponseEntity<List<PermissionChangeResponse>> list(
            @RequestParam(value = "status", defaultValue = "NOT_PROCESSED") String status
    ) {
        if (!ProcessingStatus.NOT_PROCESSED.name().equals(status)) {
            throw new IllegalArgumentException("Only status=NOT_PROCESSED can be listed");
        }
        List<PermissionChangeResponse> response = permissionChangeService.findUnprocessed().stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(response);
    }

    @PutMapping("/permission-changes/{changeId}/status")
    public ResponseEntity<PermissionChangeResponse> applyStatus(
            @PathVariable String changeId,
            @Valid @RequestBody ApplyStatusHttpRequest request,
            @RequestAttribute(value = RequestIdFilter.MDC_KEY, required = false) String requestId
    ) {
        PermissionChange change = permissionChangeService.applyStatus(new ApplyStatusServiceRequest(
                changeId,
                request.statusCode(),
                request.statusMessage(),
                requestId
        ));
        return ResponseEntity.ok(map(change));
    }

    private PermissionChangeResponse map(PermissionChange change) {
        ServerErrorResponse error = change.getErrorCode()
                .map(this::map)
                .orElse(null);
        return new PermissionChangeResponse(
                change.getId(),
                change.getCreatedAt(),
                change.getUpdatedAt(),
                change.getUserId(),
                change.getMetadataKey(),
                change.getMetadataValue(),
                change.getRealmUrl(),
                change.getMayRead().asBoolean(),
                change.getMayWrite().asBoolean(),
                change.getMayManage().asBoolean(),
                change.getStatus(),
                change.getStatusCode(),
                change.getStatusMessage(),
                error
        );
    }

    private ServerErrorResponse map(ServerError error) {
        return new ServerErrorResponse(error.kind(), error.rawCode());
    }
}
