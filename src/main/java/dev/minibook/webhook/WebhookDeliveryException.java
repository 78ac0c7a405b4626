package dev.minibook.webhook;

public class WebhookDeliveryException extends RuntimeException {

    public WebhookDeliveryException(String url, String reason) {
        super("Webhook delivery to " + url + " failed: " + reason);
    }
}
