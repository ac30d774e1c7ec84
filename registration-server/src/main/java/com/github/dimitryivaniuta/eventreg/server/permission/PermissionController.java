package com.github.dimitryivaniuta.eventreg.server.permission;

import com.github.dimitryivaniuta.eventreg.common.query.QueryRequest;
import com.github.dimitryivaniuta.eventreg.server.security.CurrentClaims;
import com.github.dimitryivaniuta.eventreg.server.web.DeleteResponse;
import com.github.dimitryivaniuta.eventreg.server.web.IdsRequest;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Permission management endpoints.
 */
@RestController
@RequestMapping(path = "/permissions", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class PermissionController {

    private final PermissionService permissionService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Flux<PermissionDto> upsert(@RequestBody final List<PermissionDto> permissions) {
        return CurrentClaims.get()
                .flatMapMany(claims -> permissionService.upsert(claims, permissions))
                .map(PermissionDto::from);
    }

    @PostMapping(path = "/query")
    public Flux<PermissionDto> query(@RequestBody(required = false) final QueryRequest query) {
        return CurrentClaims.get()
                .flatMapMany(claims -> permissionService.query(claims, query))
                .map(PermissionDto::from);
    }

    @PostMapping(path = "/delete", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<DeleteResponse> delete(@RequestBody final IdsRequest request) {
        return CurrentClaims.get()
                .flatMap(claims -> permissionService.delete(claims, request.ids()))
                .map(DeleteResponse::new);
    }
}
