package com.github.dimitryivaniuta.eventreg.server.token;

import com.github.dimitryivaniuta.eventreg.common.error.UnauthenticatedException;
import com.github.dimitryivaniuta.eventreg.server.config.TokenProperties;
import com.github.dimitryivaniuta.eventreg.server.keys.KeyManager;
import com.github.dimitryivaniuta.eventreg.server.keys.NoSigningKeyException;
import com.github.dimitryivaniuta.eventreg.server.keys.SigningKey;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * RS256 JWT implementation of {@link TokenService}.
 *
 * <p>Claims: {@code iss}, {@code sub}, {@code aud}, {@code iat}, {@code exp}. The header
 * carries the {@code kid} of the signing key, which validation uses to fetch the public key.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JwtTokenService implements TokenService {

    private final Clock clock;

    /** Supplies the active signing key and verifying keys by kid. */
    private final KeyManager keyManager;

    /** Issuer and access token TTL. */
    private final TokenProperties tokenProperties;

    @Override
    public Mono<IssuedToken> issue(final String subject, final Audience audience) {
        return keyManager.getSigningKey()
                .flatMap(key -> Mono.fromCallable(() -> sign(key, subject, audience))
                        .subscribeOn(Schedulers.boundedElastic()));
    }

    @Override
    public Mono<Claims> validate(final String token, final Audience expectedAudience) {
        if (token == null || token.isBlank()) {
            return Mono.error(new UnauthenticatedException());
        }
        return Mono.fromCallable(() -> SignedJWT.parse(token))
                .onErrorMap(ParseException.class, e -> new UnauthenticatedException())
                .flatMap(jwt -> {
                    final JWSHeader header = jwt.getHeader();
                    if (!JWSAlgorithm.RS256.equals(header.getAlgorithm()) || header.getKeyID() == null) {
                        return Mono.error(new UnauthenticatedException());
                    }
                    return keyManager.getVerifyingKey(header.getKeyID())
                            .switchIfEmpty(Mono.error(UnauthenticatedException::new))
                            .map(key -> verify(jwt, key, expectedAudience));
                })
                .doOnError(UnauthenticatedException.class, e -> log.debug("Token rejected"));
    }

    private IssuedToken sign(final SigningKey key, final String subject, final Audience audience)
            throws JOSEException {
        final Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        final Duration ttl = tokenProperties.getAccessTokenTtl();
        final Instant exp = now.plus(ttl);
        if (key.getExpiresAt().isBefore(exp)) {
            // a retired key must still verify every token it signed
            throw new NoSigningKeyException("active signing key expires before a token issued now");
        }

        final JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.RS256)
                .keyID(key.getId())
                .build();
        final JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .issuer(tokenProperties.getIssuer())
                .subject(subject)
                .audience(audience.getClaimValue())
                .issueTime(Date.from(now))
                .expirationTime(Date.from(exp))
                .build();

        final SignedJWT jwt = new SignedJWT(header, claims);
        jwt.sign(new RSASSASigner(key.getKey().toPrivateKey()));

        if (log.isDebugEnabled()) {
            log.debug("Issued token sub={} aud={} kid={} exp={}", subject, audience, key.getId(), exp);
        }
        return new IssuedToken(jwt.serialize(),
                new Claims(tokenProperties.getIssuer(), subject, audience, now, exp));
    }

    private Claims verify(final SignedJWT jwt, final RSAKey key, final Audience expectedAudience) {
        try {
            if (!jwt.verify(new RSASSAVerifier(key))) {
                throw new UnauthenticatedException();
            }
            final JWTClaimsSet set = jwt.getJWTClaimsSet();
            if (!tokenProperties.getIssuer().equals(set.getIssuer())) {
                throw new UnauthenticatedException();
            }
            final List<String> aud = set.getAudience();
            if (aud == null || aud.size() != 1 || !expectedAudience.getClaimValue().equals(aud.get(0))) {
                throw new UnauthenticatedException();
            }
            if (set.getSubject() == null || set.getIssueTime() == null || set.getExpirationTime() == null) {
                throw new UnauthenticatedException();
            }
            final Instant iat = set.getIssueTime().toInstant();
            final Instant exp = set.getExpirationTime().toInstant();
            final Instant now = clock.instant();
            if (now.isBefore(iat) || !now.isBefore(exp)) {
                throw new UnauthenticatedException();
            }
            return new Claims(set.getIssuer(), set.getSubject(), expectedAudience, iat, exp);
        } catch (JOSEException | ParseException e) {
            throw new UnauthenticatedException();
        }
    }
}
