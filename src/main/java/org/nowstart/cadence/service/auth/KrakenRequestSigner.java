package org.nowstart.cadence.service.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.RequiredArgsConstructor;

/**
 * Kraken private API signature: base64(HMAC-SHA512(path + SHA256(nonce + postData), base64decode(secret))).
 */
@RequiredArgsConstructor
public class KrakenRequestSigner {

    private final String apiKey;
    private final String apiSecret;

    public String apiKey() {
        return apiKey;
    }

    public boolean hasCredentials() {
        return apiKey != null && !apiKey.isBlank() && apiSecret != null && !apiSecret.isBlank();
    }

    public String sign(String path, String nonce, String postData) {
        byte[] digest = sha256((nonce + postData).getBytes(StandardCharsets.UTF_8));
        byte[] pathBytes = path.getBytes(StandardCharsets.UTF_8);
        byte[] message = new byte[pathBytes.length + digest.length];
        System.arraycopy(pathBytes, 0, message, 0, pathBytes.length);
        System.arraycopy(digest, 0, message, pathBytes.length, digest.length);
        return Base64.getEncoder().encodeToString(hmacSha512(message));
    }

    private static byte[] sha256(byte[] value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private byte[] hmacSha512(byte[] message) {
        try {
            Mac mac = Mac.getInstance("HmacSHA512");
            mac.init(new SecretKeySpec(Base64.getDecoder().decode(apiSecret), "HmacSHA512"));
            return mac.doFinal(message);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to sign Kraken request", e);
        }
    }
}
