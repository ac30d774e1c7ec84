package com.github.dimitryivaniuta.eventreg.server.user;

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
@RequestMapping(path = "/users", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Flux<UserDto> upsert(@RequestBody final List<UserDto> users) {
        return CurrentClaims.get().flatMapMany(claims -> userService.upsert(claims, users));
    }

    @PostMapping(path = "/query")
    public Flux<UserDto> query(@RequestBody(required = false) final QueryRequest query) {
        return CurrentClaims.get().flatMapMany(claims -> userService.query(claims, query));
    }

    @PostMapping(path = "/delete", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<DeleteResponse> delete(@RequestBody final IdsRequest request) {
        return CurrentClaims.get()
                .flatMap(claims -> userService.delete(claims, request.ids()))
                .map(DeleteResponse::new);
    }
}
