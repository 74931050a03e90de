package de.mirkosertic.mcp.vehiclesearch.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import de.mirkosertic.mcp.vehiclesearch.config.ApplicationConfig;
import de.mirkosertic.mcp.vehiclesearch.error.InvalidPageTokenException;
import de.mirkosertic.mcp.vehiclesearch.index.SortKey;
import de.mirkosertic.mcp.vehiclesearch.index.SortMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;

/**
 * Encodes keyset cursors as opaque, tamper-evident strings.
 *
 * <p>Format: {@code base64url(json payload) "." base64url(HMAC-SHA256(payload))}. Without a
 * configured secret a random key is generated per process, so tokens do not survive a restart
 * and callers simply restart pagination.</p>
 */
public class PageTokenCodec {

    private static final Logger logger = LoggerFactory.getLogger(PageTokenCodec.class);

    static final int VERSION = 2;

    private static final BaseEncoding BASE64 = BaseEncoding.base64Url().omitPadding();

    private final HashFunction mac;
    private final ObjectMapper objectMapper;

    public PageTokenCodec(final ApplicationConfig config, final ObjectMapper objectMapper) {
        this(secretFrom(config), objectMapper);
    }

    public PageTokenCodec(final byte[] secret, final ObjectMapper objectMapper) {
        this.mac = Hashing.hmacSha256(secret);
        this.objectMapper = objectMapper;
    }

    private static byte[] secretFrom(final ApplicationConfig config) {
        final String configured = config.getPageTokenSecret();
        if (configured != null && !configured.isEmpty()) {
            return configured.getBytes(StandardCharsets.UTF_8);
        }
        logger.info("No page token secret configured, page tokens are valid for this process only");
        final byte[] random = new byte[32];
        new SecureRandom().nextBytes(random);
        return random;
    }

    public String encode(final SortKey sortKey, final String filterFingerprint) {
        final PageToken token = new PageToken(VERSION, sortKey.mode().name(), sortKey.primary(), sortKey.secondary(),
                sortKey.id(), sortKey.snapshot(), filterFingerprint);
        final byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(token);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Page token payload could not be serialized", e);
        }
        return BASE64.encode(payload) + "." + BASE64.encode(mac.hashBytes(payload).asBytes());
    }

    /**
     * Verifies and decodes a token issued for the given sort mode and filter.
     *
     * @throws InvalidPageTokenException if the token is malformed, its signature does not match,
     *                                   or it belongs to a different search
     */
    public SortKey decode(final String token, final SortMode expectedMode, final String filterFingerprint)
            throws InvalidPageTokenException {
        final int separator = token.indexOf('.');
        if (separator <= 0 || separator != token.lastIndexOf('.')) {
            throw new InvalidPageTokenException("Page token is malformed, restart pagination without a token");
        }

        final byte[] payload;
        final byte[] signature;
        try {
            payload = BASE64.decode(token.substring(0, separator));
            signature = BASE64.decode(token.substring(separator + 1));
        } catch (final IllegalArgumentException e) {
            throw new InvalidPageTokenException("Page token is malformed, restart pagination without a token", e);
        }

        if (!MessageDigest.isEqual(signature, mac.hashBytes(payload).asBytes())) {
            throw new InvalidPageTokenException("Page token signature is invalid, restart pagination without a token");
        }

        final PageToken decoded;
        try {
            decoded = objectMapper.readValue(payload, PageToken.class);
        } catch (final IOException e) {
            throw new InvalidPageTokenException("Page token is malformed, restart pagination without a token", e);
        }

        if (decoded.version() != VERSION || decoded.id() == null) {
            throw new InvalidPageTokenException("Page token has an unsupported format, restart pagination without a token");
        }
        if (!expectedMode.name().equals(decoded.mode())) {
            throw new InvalidPageTokenException("Page token was issued for a search with a different ordering");
        }
        if (!filterFingerprint.equals(decoded.filterFingerprint())) {
            throw new InvalidPageTokenException("Page token was issued for different search criteria");
        }
        return new SortKey(expectedMode, decoded.primary(), decoded.secondary(), decoded.id(), decoded.snapshot());
    }
}
