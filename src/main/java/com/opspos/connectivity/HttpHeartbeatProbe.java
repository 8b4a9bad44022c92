package com.opspos.connectivity;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Probes an authority with a bounded HTTP GET against its health URL.
 *
 * <p>Any 2xx counts as reachable, and so does 401: the endpoint answered, only our
 * credentials were rejected, which is a different problem from a partition.
 */
@Component
public class HttpHeartbeatProbe implements HeartbeatProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpHeartbeatProbe.class);

    private final ConnectivityConfig connectivityConfig;
    private final RestClient restClient;

    public HttpHeartbeatProbe(ConnectivityConfig connectivityConfig) {
        this.connectivityConfig = connectivityConfig;
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(connectivityConfig.getProbeTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(connectivityConfig.getProbeTimeoutMs()));
        this.restClient = RestClient.builder().requestFactory(requestFactory).build();
    }

    @Override
    public boolean probe(Authority authority) {
        String url = connectivityConfig.urlFor(authority);
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            ResponseEntity<Void> response = restClient
                    .get()
                    .uri(url)
                    .retrieve()
                    .onStatus(status -> true, (request, httpResponse) -> {})
                    .toBodilessEntity();
            int statusCode = response.getStatusCode().value();
            return response.getStatusCode().is2xxSuccessful() || statusCode == 401;
        } catch (RestClientException e) {
            log.debug("Heartbeat to {} failed: {}", authority, e.getMessage());
            return false;
        }
    }
}
