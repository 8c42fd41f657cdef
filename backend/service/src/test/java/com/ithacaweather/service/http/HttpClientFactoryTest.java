package com.ithacaweather.service.http;

import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpClientFactoryTest {
    @Test
    void defaultClientUsesConnectTimeout() {
        HttpClient client = HttpClientFactory.create(Duration.ofSeconds(3), Map.of());

        assertEquals(Duration.ofSeconds(3), client.connectTimeout().orElseThrow());
        assertEquals(HttpClient.Redirect.NORMAL, client.followRedirects());
    }

    @Test
    void loadsPkcs12Truststore() throws Exception {
        Path truststore = Files.createTempFile("truststore-", ".p12");
        writeEmptyTruststore(truststore, "PKCS12", "changeit".toCharArray());

        HttpClient client = HttpClientFactory.create(Duration.ofSeconds(1), Map.of(
                HttpClientFactory.TRUSTSTORE_PATH_ENV, truststore.toString(),
                HttpClientFactory.TRUSTSTORE_PASSWORD_ENV, "changeit"
        ));

        assertEquals("TLS", client.sslContext().getProtocol());
    }

    @Test
    void truststoreWithoutPasswordIsRejected() throws Exception {
        Path truststore = Files.createTempFile("truststore-", ".jks");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> HttpClientFactory.create(
                Duration.ofSeconds(1), Map.of(HttpClientFactory.TRUSTSTORE_PATH_ENV, truststore.toString())));
        assertTrue(ex.getMessage().contains(HttpClientFactory.TRUSTSTORE_PASSWORD_ENV));
    }

    @Test
    void missingTruststoreOrWrongPasswordFails() throws Exception {
        IllegalStateException missing = assertThrows(IllegalStateException.class, () -> HttpClientFactory.create(
                Duration.ofSeconds(1), Map.of(
                        HttpClientFactory.TRUSTSTORE_PATH_ENV, "/tmp/does-not-exist.jks",
                        HttpClientFactory.TRUSTSTORE_PASSWORD_ENV, "changeit"
                )));
        assertTrue(missing.getMessage().contains("Truststore file does not exist"));

        Path truststore = Files.createTempFile("truststore-", ".jks");
        writeEmptyTruststore(truststore, "JKS", "correct-password".toCharArray());
        IllegalStateException wrongPassword = assertThrows(IllegalStateException.class,
                () -> HttpClientFactory.create(Duration.ofSeconds(1), Map.of(
                        HttpClientFactory.TRUSTSTORE_PATH_ENV, truststore.toString(),
                        HttpClientFactory.TRUSTSTORE_PASSWORD_ENV, "wrong-password"
                )));
        assertTrue(wrongPassword.getMessage().contains("Failed to build SSL context"));
    }

    private static void writeEmptyTruststore(Path file, String type, char[] password) throws Exception {
        KeyStore keyStore = KeyStore.getInstance(type);
        keyStore.load(null, password);
        try (OutputStream out = Files.newOutputStream(file)) {
            keyStore.store(out, password);
        }
    }
}
