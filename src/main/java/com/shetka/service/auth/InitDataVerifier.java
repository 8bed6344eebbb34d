package com.shetka.service.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shetka.config.AppProperties;
import com.shetka.error.AuthException;
import com.shetka.model.AuthenticatedUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.PrimitiveIterator;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Verifies Telegram WebApp {@code initData} payloads.
 *
 * <p>The payload is a URL-encoded query string. Every pair except {@code hash} is sorted by key
 * and joined as {@code key=value} lines; the result must match {@code hash} under
 * HMAC-SHA256 keyed by HMAC-SHA256("WebAppData", botToken).
 *
 * <p>Stateless once constructed: the derived secret key is computed once.
 */
@Component
@Slf4j
public class InitDataVerifier {

    static final String HMAC_ALGORITHM = "HmacSHA256";
    static final byte[] WEB_APP_DATA_KEY = "WebAppData".getBytes(StandardCharsets.UTF_8);

    private static final TypeReference<Map<String, Object>> USER_TYPE = new TypeReference<>() {};

    /** Orders keys by Unicode code point; String.compareTo orders by UTF-16 unit. */
    static final Comparator<String> CODE_POINT_ORDER = (a, b) -> {
        PrimitiveIterator.OfInt left = a.codePoints().iterator();
        PrimitiveIterator.OfInt right = b.codePoints().iterator();
        while (left.hasNext() && right.hasNext()) {
            int cmp = Integer.compare(left.nextInt(), right.nextInt());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Boolean.compare(left.hasNext(), right.hasNext());
    };

    private final byte[] secretKey;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration maxAge;

    @Autowired
    public InitDataVerifier(AppProperties properties, ObjectMapper objectMapper, Clock clock) {
        this(properties.getTelegram().getBotToken(), properties.getTelegram().getInitDataMaxAge(),
                objectMapper, clock);
    }

    InitDataVerifier(String botToken, Duration maxAge, ObjectMapper objectMapper, Clock clock) {
        this.secretKey = hmac(WEB_APP_DATA_KEY, botToken.strip().getBytes(StandardCharsets.UTF_8));
        this.maxAge = maxAge == null ? Duration.ZERO : maxAge;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public AuthenticatedUser verify(String rawPayload) {
        if (rawPayload == null || rawPayload.isEmpty()) {
            throw new AuthException("missing payload");
        }

        Map<String, String> pairs = parseQuery(rawPayload);

        String receivedHash = pairs.remove("hash");
        if (receivedHash == null || receivedHash.isEmpty()) {
            throw new AuthException("missing hash");
        }

        String expectedHash = sign(dataCheckString(pairs));
        if (!MessageDigest.isEqual(
                expectedHash.getBytes(StandardCharsets.UTF_8),
                receivedHash.getBytes(StandardCharsets.UTF_8))) {
            throw new AuthException("bad signature");
        }

        if (!maxAge.isZero() && !maxAge.isNegative()) {
            checkFreshness(pairs.get("auth_date"));
        }

        String userJson = pairs.get("user");
        if (userJson == null || userJson.isEmpty()) {
            throw new AuthException("missing user");
        }
        return new AuthenticatedUser(parseUser(userJson));
    }

    /**
     * Hex HMAC of a data-check string under this verifier's bot token.
     */
    String sign(String dataCheckString) {
        return HexFormat.of().formatHex(hmac(secretKey, dataCheckString.getBytes(StandardCharsets.UTF_8)));
    }

    static String dataCheckString(Map<String, String> pairs) {
        Map<String, String> sorted = new TreeMap<>(CODE_POINT_ORDER);
        sorted.putAll(pairs);
        return sorted.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("\n"));
    }

    /**
     * Query-string parsing that keeps blank values; a repeated key keeps its last value.
     */
    static Map<String, String> parseQuery(String query) {
        Map<String, String> pairs = new LinkedHashMap<>();
        for (String segment : query.split("&")) {
            if (segment.isEmpty()) continue;
            int eq = segment.indexOf('=');
            String key = eq >= 0 ? segment.substring(0, eq) : segment;
            String value = eq >= 0 ? segment.substring(eq + 1) : "";
            pairs.put(decode(key), decode(value));
        }
        return pairs;
    }

    private void checkFreshness(String authDate) {
        if (authDate == null || authDate.isEmpty()) {
            throw new AuthException("expired payload");
        }
        long epochSeconds;
        try {
            epochSeconds = Long.parseLong(authDate);
        } catch (NumberFormatException e) {
            throw new AuthException("expired payload");
        }
        Instant issuedAt = Instant.ofEpochSecond(epochSeconds);
        if (issuedAt.plus(maxAge).isBefore(clock.instant())) {
            log.debug("initData auth_date {} is older than {}", epochSeconds, maxAge);
            throw new AuthException("expired payload");
        }
    }

    private Map<String, Object> parseUser(String userJson) {
        try {
            JsonNode node = objectMapper.readTree(userJson);
            if (node == null || !node.isObject()) {
                throw new AuthException("bad user json");
            }
            return objectMapper.convertValue(node, USER_TYPE);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new AuthException("bad user json");
        }
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // malformed escapes are kept verbatim
            return value;
        }
    }

    private static byte[] hmac(byte[] key, byte[] message) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            return mac.doFinal(message);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
