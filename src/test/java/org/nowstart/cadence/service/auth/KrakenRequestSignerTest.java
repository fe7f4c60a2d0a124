package org.nowstart.cadence.service.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class KrakenRequestSignerTest {

    // published Kraken REST authentication example
    private static final String SECRET =
            "kQH5HW/8p1uGOVjbgWA7FunAmGO8lsSUXNsu3eow76sz84Q18fWxnyRzBHCd3pd5nE9qa99HAZtuZuj6F1huXg==";
    private static final String NONCE = "1616492376594";
    private static final String POST_DATA =
            "nonce=1616492376594&ordertype=limit&pair=XBTUSD&price=37500&type=buy&volume=1.25";

    @Test
    void sign_matchesReferenceSignature() {
        KrakenRequestSigner signer = new KrakenRequestSigner("key", SECRET);

        String signature = signer.sign("/0/private/AddOrder", NONCE, POST_DATA);

        assertThat(signature)
                .isEqualTo("4/dpxb3iT4tp/ZCVEwSnEsLxx0bqyhLpdfOpc6fn7OR8+UClSV5n9E6aSS8MPtnRfp32bAb0nmbRn6H8ndwLUQ==");
    }

    @Test
    void sign_dependsOnPath() {
        KrakenRequestSigner signer = new KrakenRequestSigner("key", SECRET);

        assertThat(signer.sign("/0/private/AddOrder", NONCE, POST_DATA))
                .isNotEqualTo(signer.sign("/0/private/QueryOrders", NONCE, POST_DATA));
    }

    @Test
    void hasCredentials_requiresKeyAndSecret() {
        assertThat(new KrakenRequestSigner("key", SECRET).hasCredentials()).isTrue();
        assertThat(new KrakenRequestSigner("", SECRET).hasCredentials()).isFalse();
        assertThat(new KrakenRequestSigner("key", null).hasCredentials()).isFalse();
    }

    @Test
    void sign_failsOnMalformedSecret() {
        KrakenRequestSigner signer = new KrakenRequestSigner("key", "not base64 !!");

        assertThatThrownBy(() -> signer.sign("/0/private/AddOrder", NONCE, POST_DATA))
                .isInstanceOf(IllegalStateException.class);
    }
}
