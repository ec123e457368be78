package org.caureq.gpufleet.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.api.error.ApiException;
import org.caureq.gpufleet.api.error.ErrorCode;
import org.caureq.gpufleet.domain.WorkerAuthToken;
import org.caureq.gpufleet.repo.WorkerAuthTokenRepo;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;

/** Per-instance worker tokens. Only the SHA-256 of a token is stored. */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkerTokenService {
    public static final String TOKEN_PREFIX = "wk_";
    static final int DISPLAY_PREFIX_LENGTH = 12;

    private final WorkerAuthTokenRepo repo;
    private final Clock clock;

    /** Active (not revoked) token row for the instance. */
    public Optional<WorkerAuthToken> activeToken(UUID instanceId) {
        return repo.findById(instanceId).filter(t -> t.getRevokedAt() == null);
    }

    /**
     * Issues a fresh token and returns it in clear, the only time it is visible.
     * A concurrent issue for the same instance loses with 409.
     */
    public String issue(UUID instanceId) {
        var token = TOKEN_PREFIX + UUID.randomUUID() + "_" + UUID.randomUUID();
        var row = repo.findById(instanceId).orElseGet(() -> WorkerAuthToken.builder().instanceId(instanceId).build());
        row.setTokenHash(sha256Hex(token));
        row.setTokenPrefix(token.substring(0, DISPLAY_PREFIX_LENGTH));
        row.setCreatedAt(clock.instant());
        row.setLastUsedAt(null);
        row.setRevokedAt(null);
        try {
            repo.saveAndFlush(row);
        } catch (DataIntegrityViolationException | OptimisticLockingFailureException ex) {
            throw new ApiException(HttpStatus.CONFLICT, ErrorCode.TOKEN_CONFLICT,
                    "A token was issued concurrently for instance " + instanceId);
        }
        log.info("instance {}: worker token issued ({}...)", instanceId, row.getTokenPrefix());
        return token;
    }

    public boolean matches(WorkerAuthToken stored, String presented) {
        if (stored == null || presented == null || presented.isBlank()) return false;
        var expected = stored.getTokenHash().getBytes(StandardCharsets.US_ASCII);
        var actual = sha256Hex(presented.trim()).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    public void touch(UUID instanceId) {
        repo.touch(instanceId, clock.instant());
    }

    static String sha256Hex(String value) {
        try {
            var md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
