package dev.minibook.webhook;

import dev.minibook.config.WebhookProperties;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;

/**
 * Performs a single webhook POST. Blocks the calling worker thread for at most
 * the configured timeout; callers run it off the request path.
 */
@Component
public class WebhookDeliveryClient {

    private final WebClient webClient;
    private final Duration timeout;

    public WebhookDeliveryClient(WebClient webhookWebClient, WebhookProperties properties) {
        this.webClient = webhookWebClient;
        this.timeout = properties.timeout();
    }

    /**
     * @return the response status code
     * @throws WebhookDeliveryException on a non-2xx response
     * @throws RuntimeException         on network errors or timeout
     */
    public int deliver(String url, WebhookEnvelope envelope) {
        ResponseEntity<Void> response = webClient.post()
                .uri(URI.create(url))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(envelope)
                .exchangeToMono(clientResponse -> clientResponse.toBodilessEntity())
                .block(timeout);
        if (response == null) {
            throw new WebhookDeliveryException(url, "empty response");
        }
        int status = response.getStatusCode().value();
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new WebhookDeliveryException(url, "HTTP " + status);
        }
        return status;
    }
}
