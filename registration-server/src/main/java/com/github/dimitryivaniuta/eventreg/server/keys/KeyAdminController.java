package com.github.dimitryivaniuta.eventreg.server.keys;

import com.github.dimitryivaniuta.eventreg.server.permission.Access;
import com.github.dimitryivaniuta.eventreg.server.permission.Capability;
import com.github.dimitryivaniuta.eventreg.server.permission.PermissionService;
import com.github.dimitryivaniuta.eventreg.server.security.CurrentClaims;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Manual key rotation for server administrators.
 */
@Slf4j
@RestController
@RequestMapping(path = "/admin/keys", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class KeyAdminController {

    private final KeyManager keyManager;

    private final PermissionService permissionService;

    /**
     * @param clearOld also drop every previous key, invalidating all issued tokens
     */
    @PostMapping(path = "/rotate")
    public Mono<RotationResponse> rotate(@RequestParam(name = "clearOld", defaultValue = "false") final boolean clearOld) {
        return CurrentClaims.get()
                .flatMap(claims -> permissionService.require(claims, Capability.server(Access.ADMIN))
                        .doOnSuccess(v -> log.info("Key rotation requested by sub={} clearOld={}",
                                claims.subject(), clearOld)))
                .then(keyManager.rotate(clearOld))
                .map(key -> new RotationResponse(key.getId(), key.getExpiresAt()));
    }

    /** Identifies the new active key. */
    public record RotationResponse(String kid, Instant expiresAt) {
    }
}
