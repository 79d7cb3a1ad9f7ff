package com.agrinova.backend.modules.auth.application;

import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.List;
import java.util.UUID;

import com.agrinova.backend.modules.auth.domain.AppUser;
import com.agrinova.backend.modules.auth.domain.AuthException;
import com.agrinova.backend.modules.auth.domain.AuthFailureKind;
import com.agrinova.backend.modules.auth.domain.ClientPlatform;
import com.agrinova.backend.modules.auth.domain.IssuedTokens;
import com.agrinova.backend.modules.auth.domain.SessionLineage;
import com.agrinova.backend.modules.auth.domain.TokenClaims;
import com.agrinova.backend.modules.auth.domain.TokenKind;
import com.agrinova.backend.modules.auth.domain.VerifiedIdentity;
import com.agrinova.backend.modules.auth.infrastructure.jwt.JwtKeyProvider;
import com.agrinova.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.agrinova.backend.modules.auth.infrastructure.persistence.RevocationMarkerRepository;
import com.agrinova.backend.modules.auth.infrastructure.persistence.SessionLineageRepository;
import com.agrinova.backend.modules.device.application.DeviceBindingValidator;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Header;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.LocatorAdapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues, validates, rotates and revokes signed tokens.
 * <p>
 * Every login starts a {@link SessionLineage}. Refresh rotation is a compare-and-swap on the lineage's
 * current refresh id, so of two concurrent refreshes with the same token exactly one succeeds. Revocation
 * appends a marker per lineage; validation rejects any token whose lineage carries a marker.
 */
@Service
public class JwtTokenService {

    public static final String REASON_LOGOUT = "LOGOUT";
    public static final String REASON_LOGOUT_ALL = "LOGOUT_ALL";
    public static final String REASON_PASSWORD_CHANGED = "PASSWORD_CHANGED";
    public static final String REASON_USER_INACTIVE = "USER_INACTIVE";
    public static final String REASON_DEVICE_UNBOUND = "DEVICE_UNBOUND";
    public static final String REASON_ADMIN = "ADMIN_REVOKED";
    public static final String REASON_OFFLINE_RENEWED = "OFFLINE_RENEWED";

    static final String CLAIM_TYPE = "typ";
    static final String CLAIM_LINEAGE = "lin";
    static final String CLAIM_DEVICE = "dev";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_COMPANY = "cid";

    private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);

    private final JwtKeyProvider keyProvider;
    private final SessionLineageRepository lineageRepository;
    private final RevocationMarkerRepository markerRepository;
    private final AppUserRepository appUserRepository;
    private final DeviceBindingValidator deviceBindingValidator;
    private final String issuer;
    private final Duration accessTtl;
    private final Duration refreshTtl;
    private final Duration offlineTtl;
    private final Clock clock;
    private final JwtParser parser;

    public JwtTokenService(
            JwtKeyProvider keyProvider,
            SessionLineageRepository lineageRepository,
            RevocationMarkerRepository markerRepository,
            AppUserRepository appUserRepository,
            DeviceBindingValidator deviceBindingValidator,
            @Value("${jwt.issuer:agrinova-auth}") String issuer,
            @Value("${jwt.access-ttl:PT15M}") Duration accessTtl,
            @Value("${jwt.refresh-ttl:P7D}") Duration refreshTtl,
            @Value("${jwt.offline-ttl:P30D}") Duration offlineTtl,
            @Value("${jwt.clock-skew-seconds:30}") long clockSkewSeconds,
            Clock clock
    ) {
        this.keyProvider = keyProvider;
        this.lineageRepository = lineageRepository;
        this.markerRepository = markerRepository;
        this.appUserRepository = appUserRepository;
        this.deviceBindingValidator = deviceBindingValidator;
        this.issuer = issuer;
        this.accessTtl = accessTtl;
        this.refreshTtl = refreshTtl;
        this.offlineTtl = offlineTtl;
        this.clock = clock;
        this.parser = Jwts.parser()
                .keyLocator(new LocatorAdapter<Key>() {
                    @Override
                    protected Key locate(JwsHeader header) {
                        return keyProvider.verificationKey(header.getKeyId());
                    }
                })
                .requireIssuer(issuer)
                .clockSkewSeconds(clockSkewSeconds)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    @Transactional
    public IssuedTokens issue(VerifiedIdentity identity, String deviceId, ClientPlatform platform, boolean offline) {
        Instant now = clock.instant();
        OffsetDateTime issuedAt = OffsetDateTime.ofInstant(now, clock.getZone());
        boolean withOffline = offline && platform.isMobile();

        SessionLineage lineage = new SessionLineage();
        lineage.setUserId(identity.userId());
        lineage.setDeviceId(deviceId);
        lineage.setPlatform(platform);
        lineage.setCurrentRefreshId(UUID.randomUUID());
        lineage.setRefreshExpiresAt(issuedAt.plus(refreshTtl));
        if (withOffline) {
            lineage.setOfflineExpiresAt(issuedAt.plus(offlineTtl));
        }
        lineageRepository.save(lineage);

        return sign(identity, lineage.getId(), deviceId, lineage.getCurrentRefreshId(), now, withOffline);
    }

    /**
     * Verifies signature, issuer, expiry (with leeway), kind and revocation.
     */
    @Transactional(readOnly = true)
    public TokenClaims validate(String token, TokenKind expectedKind) {
        TokenClaims claims;
        try {
            claims = toTokenClaims(parser.parseSignedClaims(token));
        } catch (ExpiredJwtException ex) {
            throw new AuthException(AuthFailureKind.EXPIRED, ex);
        } catch (JwtException | IllegalArgumentException ex) {
            throw new AuthException(AuthFailureKind.MALFORMED, ex);
        }
        if (claims.kind() != expectedKind) {
            throw new AuthException(AuthFailureKind.WRONG_KIND);
        }
        if (markerRepository.existsById(claims.lineageId())) {
            throw new AuthException(AuthFailureKind.REVOKED);
        }
        return claims;
    }

    /**
     * Same as {@link #validate} but accepts a token whose only defect is expiry. Used by logout, where an
     * expired but authentic token must still be able to end its lineage.
     */
    @Transactional(readOnly = true)
    public TokenClaims validateIgnoringExpiry(String token, TokenKind expectedKind) {
        TokenClaims claims;
        try {
            claims = toTokenClaims(parser.parseSignedClaims(token));
        } catch (ExpiredJwtException ex) {
            claims = toTokenClaims(ex.getHeader(), ex.getClaims());
        } catch (JwtException | IllegalArgumentException ex) {
            throw new AuthException(AuthFailureKind.MALFORMED, ex);
        }
        if (claims.kind() != expectedKind) {
            throw new AuthException(AuthFailureKind.WRONG_KIND);
        }
        return claims;
    }

    @Transactional(noRollbackFor = AuthException.class)
    public RotatedTokens refresh(String refreshToken) {
        TokenClaims claims = validate(refreshToken, TokenKind.REFRESH);

        SessionLineage lineage = lineageRepository.findById(claims.lineageId())
                .orElseThrow(() -> new AuthException(AuthFailureKind.REVOKED));
        if (lineage.isRevoked() || !claims.tokenId().equals(lineage.getCurrentRefreshId())) {
            throw new AuthException(AuthFailureKind.REVOKED);
        }
        if (claims.isDeviceBound()) {
            deviceBindingValidator.requireActive(claims.userId(), claims.deviceId());
        }

        AppUser user = appUserRepository.findWithRoleById(claims.userId()).orElse(null);
        if (user == null || !user.isActive()) {
            revokeLineage(lineage.getId(), REASON_USER_INACTIVE);
            throw new AuthException(AuthFailureKind.REVOKED);
        }

        Instant now = clock.instant();
        OffsetDateTime rotatedAt = OffsetDateTime.ofInstant(now, clock.getZone());
        UUID nextRefreshId = UUID.randomUUID();
        int rotated = lineageRepository.rotate(lineage.getId(), claims.tokenId(), nextRefreshId, rotatedAt,
                rotatedAt.plus(refreshTtl));
        if (rotated == 0) {
            throw new AuthException(AuthFailureKind.REVOKED);
        }

        VerifiedIdentity identity = VerifiedIdentity.from(user);
        IssuedTokens tokens = sign(identity, lineage.getId(), claims.deviceId(), nextRefreshId, now, false);
        return new RotatedTokens(identity, tokens);
    }

    /**
     * Accepts an offline token for air-gapped use while its lineage is live, its device binding is active
     * and its user is still active. Nothing is issued or rotated.
     */
    @Transactional(readOnly = true)
    public OfflineAccess validateOffline(String offlineToken) {
        TokenClaims claims = validate(offlineToken, TokenKind.OFFLINE);
        if (!claims.isDeviceBound()) {
            throw new AuthException(AuthFailureKind.MALFORMED);
        }
        SessionLineage lineage = lineageRepository.findById(claims.lineageId())
                .filter(candidate -> !candidate.isRevoked())
                .orElseThrow(() -> new AuthException(AuthFailureKind.REVOKED));
        deviceBindingValidator.requireActive(claims.userId(), claims.deviceId());
        AppUser user = appUserRepository.findWithRoleById(claims.userId())
                .filter(AppUser::isActive)
                .orElseThrow(() -> new AuthException(AuthFailureKind.REVOKED));
        return new OfflineAccess(claims, lineage.getPlatform(), VerifiedIdentity.from(user));
    }

    /**
     * Exchanges an offline token for a new lineage on the same device. The old lineage is revoked first, so
     * of two concurrent renewals with the same offline token exactly one succeeds.
     *
     * @param presentedDeviceId device id sent by the client, checked against the token when present
     * @param fingerprint       device fingerprint, checked against the binding when present
     */
    @Transactional(noRollbackFor = AuthException.class)
    public RotatedTokens renewOffline(String offlineToken, String presentedDeviceId, String fingerprint) {
        OfflineAccess access = validateOffline(offlineToken);
        TokenClaims claims = access.claims();
        if (presentedDeviceId != null
                && !claims.deviceId().equals(DeviceBindingValidator.normalizeDeviceId(presentedDeviceId))) {
            throw new AuthException(AuthFailureKind.DEVICE_MISMATCH);
        }
        if (fingerprint != null && !fingerprint.isBlank()) {
            deviceBindingValidator.validate(claims.userId(), claims.deviceId(), fingerprint, access.platform());
        }
        if (!revokeLineage(claims.lineageId(), REASON_OFFLINE_RENEWED)) {
            throw new AuthException(AuthFailureKind.REVOKED);
        }
        IssuedTokens tokens = issue(access.identity(), claims.deviceId(), access.platform(), true);
        return new RotatedTokens(access.identity(), tokens);
    }

    /**
     * Revokes every token of the lineage. Safe to repeat.
     *
     * @return {@code true} if this call moved the lineage to revoked
     */
    @Transactional
    public boolean revokeLineage(UUID lineageId, String reason) {
        SessionLineage lineage = lineageRepository.findById(lineageId).orElse(null);
        if (lineage == null) {
            return false;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        int updated = lineageRepository.markRevoked(lineageId, now, reason);
        OffsetDateTime expiresAt = lineage.latestTokenExpiry(now.plus(accessTtl));
        markerRepository.append(lineageId, lineage.getUserId(), reason, now, expiresAt);
        return updated > 0;
    }

    @Transactional
    public int revokeAllForUser(UUID userId, String reason) {
        List<SessionLineage> active = lineageRepository.findActiveByUserId(userId);
        int revoked = 0;
        for (SessionLineage lineage : active) {
            if (revokeLineage(lineage.getId(), reason)) {
                revoked++;
            }
        }
        log.info("Revoked {} session lineages for user {} ({})", revoked, userId, reason);
        return revoked;
    }

    @Transactional
    public int revokeAllForDevice(UUID userId, String deviceId, String reason) {
        List<SessionLineage> active = lineageRepository.findActiveByUserIdAndDeviceId(userId, deviceId);
        int revoked = 0;
        for (SessionLineage lineage : active) {
            if (revokeLineage(lineage.getId(), reason)) {
                revoked++;
            }
        }
        return revoked;
    }

    @Transactional
    public int purgeExpiredMarkers() {
        return markerRepository.deleteExpired(OffsetDateTime.now(clock));
    }

    @Transactional
    public int deleteExpiredLineages() {
        return lineageRepository.deleteExpired(OffsetDateTime.now(clock));
    }

    public long getAccessTtlSeconds() {
        return accessTtl.toSeconds();
    }

    private IssuedTokens sign(VerifiedIdentity identity, UUID lineageId, String deviceId, UUID refreshId,
                              Instant now, boolean withOffline) {
        String accessToken = build(TokenKind.ACCESS, UUID.randomUUID(), identity, lineageId, deviceId, now,
                now.plus(accessTtl));
        String refreshToken = build(TokenKind.REFRESH, refreshId, identity, lineageId, deviceId, now,
                now.plus(refreshTtl));
        String offlineToken = withOffline
                ? build(TokenKind.OFFLINE, UUID.randomUUID(), identity, lineageId, deviceId, now, now.plus(offlineTtl))
                : null;

        return new IssuedTokens(
                accessToken,
                refreshToken,
                offlineToken,
                accessTtl.toSeconds(),
                refreshTtl.toSeconds(),
                lineageId,
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
    }

    private String build(TokenKind kind, UUID tokenId, VerifiedIdentity identity, UUID lineageId, String deviceId,
                         Instant issuedAt, Instant expiresAt) {
        JwtBuilder builder = Jwts.builder()
                .header().keyId(keyProvider.keyId(kind)).and()
                .id(tokenId.toString())
                .issuer(issuer)
                .subject(identity.userId().toString())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .claim(CLAIM_TYPE, kind.claimValue())
                .claim(CLAIM_LINEAGE, lineageId.toString())
                .claim(CLAIM_ROLE, identity.role());
        if (deviceId != null) {
            builder.claim(CLAIM_DEVICE, deviceId);
        }
        if (identity.companyId() != null) {
            builder.claim(CLAIM_COMPANY, identity.companyId().toString());
        }
        return builder.signWith(keyProvider.signingKey(kind), SIG.HS256).compact();
    }

    private TokenClaims toTokenClaims(Jws<Claims> jws) {
        return toTokenClaims(jws.getHeader(), jws.getPayload());
    }

    private TokenClaims toTokenClaims(Header header, Claims claims) {
        TokenKind kind = TokenKind.fromClaim(claims.get(CLAIM_TYPE, String.class));
        String keyId = header instanceof JwsHeader jwsHeader ? jwsHeader.getKeyId() : null;
        if (kind == null || !kind.claimValue().equals(keyId)) {
            throw new AuthException(AuthFailureKind.MALFORMED);
        }
        String company = claims.get(CLAIM_COMPANY, String.class);
        try {
            return new TokenClaims(
                    UUID.fromString(claims.getId()),
                    kind,
                    UUID.fromString(claims.getSubject()),
                    UUID.fromString(claims.get(CLAIM_LINEAGE, String.class)),
                    claims.get(CLAIM_DEVICE, String.class),
                    claims.get(CLAIM_ROLE, String.class),
                    company != null ? UUID.fromString(company) : null,
                    claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null,
                    claims.getExpiration() != null ? claims.getExpiration().toInstant() : null
            );
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new AuthException(AuthFailureKind.MALFORMED, ex);
        }
    }

    public record RotatedTokens(VerifiedIdentity identity, IssuedTokens tokens) {
    }

    public record OfflineAccess(TokenClaims claims, ClientPlatform platform, VerifiedIdentity identity) {
    }
}
