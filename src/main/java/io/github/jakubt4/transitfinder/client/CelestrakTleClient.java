package io.github.jakubt4.transitfinder.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Optional;

/**
 * Downloads element sets from CelesTrak in three-line TLE format.
 */
@Slf4j
@Service
public class CelestrakTleClient {

    private static final String GP_PATH = "/NORAD/elements/gp.php?GROUP={group}&FORMAT=tle";

    private final RestClient restClient;
    private final String group;

    public CelestrakTleClient(final RestClient.Builder restClientBuilder,
                              @Value("${tle.celestrak.base-url:https://celestrak.org}") final String baseUrl,
                              @Value("${tle.celestrak.group:visual}") final String group) {
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .build();
        this.group = group;
    }

    /**
     * @return the raw TLE text of the configured group, empty once retries are exhausted
     */
    @Retryable(retryFor = RestClientException.class, maxAttempts = 3,
               backoff = @Backoff(delay = 1000, maxDelay = 5000))
    public Optional<String> fetchGroup() {
        log.info("Downloading TLE group [{}] from CelesTrak", group);
        final var body = restClient.get()
                .uri(GP_PATH, group)
                .accept(MediaType.TEXT_PLAIN)
                .retrieve()
                .body(String.class);
        if (body == null || body.isBlank()) {
            throw new RestClientException("CelesTrak returned an empty TLE group " + group);
        }
        return Optional.of(body);
    }

    @Recover
    public Optional<String> recoverFetchGroup(final RestClientException e) {
        log.warn("Failed to download TLE group [{}] after retries: {}", group, e.getMessage());
        return Optional.empty();
    }
}
