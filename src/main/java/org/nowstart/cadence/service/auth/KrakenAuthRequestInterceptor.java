package org.nowstart.cadence.service.auth;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class KrakenAuthRequestInterceptor implements RequestInterceptor {

    static final String PRIVATE_PATH_PREFIX = "/0/private/";

    private final KrakenRequestSigner krakenRequestSigner;

    @Override
    public void apply(RequestTemplate template) {
        template.header("Accept", "application/json");
        template.header("User-Agent", "cadence-dca/1.0");

        String path = template.path();
        if (path == null || !path.startsWith(PRIVATE_PATH_PREFIX)) {
            return;
        }

        if (!krakenRequestSigner.hasCredentials()) {
            throw new IllegalStateException("Kraken API credentials are not configured. path=" + path);
        }

        byte[] body = template.body();
        String postData = body == null ? "" : new String(body, StandardCharsets.UTF_8);
        String nonce = extractNonce(postData);
        if (nonce.isEmpty()) {
            throw new IllegalStateException("Kraken private request requires a nonce. path=" + path);
        }

        template.header("API-Key", krakenRequestSigner.apiKey());
        template.header("API-Sign", krakenRequestSigner.sign(path, nonce, postData));
    }

    static String extractNonce(String postData) {
        for (String pair : postData.split("&")) {
            if (pair.startsWith("nonce=")) {
                return pair.substring("nonce=".length());
            }
        }
        return "";
    }
}
