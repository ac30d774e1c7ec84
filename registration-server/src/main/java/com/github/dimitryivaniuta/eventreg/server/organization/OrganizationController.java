package com.github.dimitryivaniuta.eventreg.server.organization;

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

@RestController
@RequestMapping(path = "/organizations", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class OrganizationController {

    private final OrganizationService organizationService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Flux<Organization> upsert(@RequestBody final List<Organization> organizations) {
        return CurrentClaims.get().flatMapMany(claims -> organizationService.upsert(claims, organizations));
    }

    @PostMapping(path = "/query")
    public Flux<Organization> query(@RequestBody(required = false) final QueryRequest query) {
        return CurrentClaims.get().flatMapMany(claims -> organizationService.query(claims, query));
    }

    @PostMapping(path = "/delete", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<DeleteResponse> delete(@RequestBody final IdsRequest request) {
        return CurrentClaims.get()
                .flatMap(claims -> organizationService.delete(claims, request.ids()))
                .map(DeleteResponse::new);
    }
}
