package com.al.graphsubscriptions.service.correlation;

import com.al.graphsubscriptions.config.SubscriptionProperties;
import com.al.graphsubscriptions.model.enums.ResourceClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;

/**
 * Correlation tags of the form {@code v1.<class>.<userId>.<teamId>.<signature>}, signed with HMAC-SHA256 so a
 * notification cannot be attributed to a user it was not issued for.
 *
 * <p>
 * Ids are carried as-is apart from {@code %} and the {@code .} separator, which are percent-escaped. Graph
 * object ids and user principal names are otherwise URL-safe, so a channel tag for a GUID team leaves room for
 * an escaped userId of up to {@link #MAX_USER_ID_LENGTH} characters.
 */
@Component
@Slf4j
public class HmacClientStateFactory implements ClientStateFactory {

    /** Graph rejects longer clientState values. */
    static final int MAX_LENGTH = 128;

    /** Longest escaped userId for which a channel tag with a GUID team id still fits. */
    static final int MAX_USER_ID_LENGTH = 63;

    private static final String VERSION = "v1";
    private static final String ALGORITHM = "HmacSHA256";
    // Truncated MAC, 16 characters once encoded
    private static final int SIGNATURE_BYTES = 12;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecretKeySpec key;

    @Autowired
    public HmacClientStateFactory(SubscriptionProperties properties) {
        this(properties.getClientStateSecret());
    }

    HmacClientStateFactory(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("app.subscriptions.client-state-secret is not set");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    @Override
    public boolean supportsUserId(String userId) {
        return userId != null && !userId.isEmpty() && escape(userId).length() <= MAX_USER_ID_LENGTH;
    }

    @Override
    public String issue(NotificationOrigin origin) {
        if (origin.getUserId() == null || origin.getUserId().isEmpty()) {
            throw new IllegalArgumentException("userId is required for a correlation tag");
        }
        String payload = String.join(".",
                VERSION,
                origin.getResourceClass().getTag(),
                escape(origin.getUserId()),
                origin.getTeamId() == null ? "" : escape(origin.getTeamId()));
        String tag = payload + "." + ENCODER.encodeToString(sign(payload));
        if (tag.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Correlation tag exceeds " + MAX_LENGTH + " characters");
        }
        return tag;
    }

    @Override
    public Optional<NotificationOrigin> resolve(String clientState) {
        if (clientState == null) {
            return Optional.empty();
        }
        String[] parts = clientState.split("\\.", -1);
        if (parts.length != 5 || !VERSION.equals(parts[0])) {
            return Optional.empty();
        }

        String payload = clientState.substring(0, clientState.lastIndexOf('.'));
        try {
            byte[] presented = DECODER.decode(parts[4]);
            if (!MessageDigest.isEqual(sign(payload), presented)) {
                log.warn("Rejected correlation tag with invalid signature");
                return Optional.empty();
            }
            Optional<ResourceClass> resourceClass = ResourceClass.fromTag(parts[1]);
            if (resourceClass.isEmpty()) {
                return Optional.empty();
            }
            String userId = unescape(parts[2]);
            String teamId = parts[3].isEmpty() ? null : unescape(parts[3]);
            return Optional.of(new NotificationOrigin(resourceClass.get(), userId, teamId));
        } catch (IllegalArgumentException e) {
            log.warn("Rejected malformed correlation tag: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private byte[] sign(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] full = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            return Arrays.copyOf(full, SIGNATURE_BYTES);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    // "%2E" only ever comes from an escaped separator, so unescaping it first is unambiguous
    private static String escape(String value) {
        return value.replace("%", "%25").replace(".", "%2E");
    }

    private static String unescape(String value) {
        return value.replace("%2E", ".").replace("%25", "%");
    }
}
