package com.ithacaweather.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Provider HTTP client. A custom truststore is used when {@code INGEST_TRUSTSTORE_PATH} is set,
 * for deployments behind a TLS-intercepting proxy.
 */
public final class HttpClientFactory {
    static final String TRUSTSTORE_PATH_ENV = "INGEST_TRUSTSTORE_PATH";
    static final String TRUSTSTORE_PASSWORD_ENV = "INGEST_TRUSTSTORE_PASSWORD";

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        truststoreContext(environment).ifPresent(builder::sslContext);
        return builder.build();
    }

    private static Optional<SSLContext> truststoreContext(Map<String, String> environment) {
        String truststorePath = environment.get(TRUSTSTORE_PATH_ENV);
        if (truststorePath == null || truststorePath.isBlank()) {
            return Optional.empty();
        }
        String password = environment.get(TRUSTSTORE_PASSWORD_ENV);
        if (password == null) {
            throw new IllegalStateException(TRUSTSTORE_PASSWORD_ENV + " must be set when " + TRUSTSTORE_PATH_ENV
                    + " is configured");
        }
        Path path = Path.of(truststorePath);
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }

        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        String type = lower.endsWith(".p12") || lower.endsWith(".pfx") ? "PKCS12" : "JKS";
        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(type);
            trustStore.load(in, password.toCharArray());
            TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            factory.init(trustStore);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, factory.getTrustManagers(), new SecureRandom());
            return Optional.of(context);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }
}
