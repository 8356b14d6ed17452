package com.dbseed.orchestration.util;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.rest.client.RestClientBuilder;

import java.io.Closeable;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Slf4j
@ApplicationScoped
public class DynamicRestClientUtils {

    private static final String DISABLE_DEFAULT_MAPPER_PROPERTY = "microprofile.rest.client.disable.default.mapper";

    /**
     * Creates client which returns every response as is: non-success statuses are not mapped to exceptions
     * and redirects are not followed, so request headers never reach another host.
     */
    public <T> T createRestClient(Class<T> clazz, URI baseUri, Duration connectTimeout, Duration readTimeout) {
        return RestClientBuilder.newBuilder()
                .baseUri(baseUri)
                .connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .followRedirects(false)
                .property(DISABLE_DEFAULT_MAPPER_PROPERTY, true)
                .build(clazz);
    }

    public void closeClient(Closeable client) {
        if (client == null) {
            return;
        }

        try {
            client.close();
        } catch (Exception e) {
            log.debug("Failed to close rest client", e);
        }
    }
}
