package apimonitor.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Webhook通知渠道
 */
public class WebhookChannel extends NotificationChannel {
    private static final Logger logger = LoggerFactory.getLogger(WebhookChannel.class);

    private final String webhookUrl;
    private final String method;
    private final Map<String, String> headers;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebhookChannel(String webhookUrl, String method, Map<String, String> customHeaders,
                          List<String> recipients, ObjectMapper objectMapper) {
        super(ChannelType.WEBHOOK, recipients);
        this.webhookUrl = webhookUrl;
        this.method = StringUtils.defaultIfBlank(method, "POST").toUpperCase();
        this.objectMapper = objectMapper;

        this.headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("User-Agent", "ApiMonitor/1.0");
        if (customHeaders != null) {
            headers.putAll(customHeaders);
        }

        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        validate();
    }

    @Override
    public void send(NotificationMessage message) throws NotificationException {
        HttpResponse<String> response;
        try {
            HttpRequest request = buildHttpRequest(buildPayload(message));
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException("发送Webhook通知被中断", e);
        } catch (IOException e) {
            throw new NotificationException("发送Webhook通知失败: " + e.getMessage(), e);
        }

        logger.info("Webhook响应: status={}, endpoint={}", response.statusCode(), message.getEndpointName());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new NotificationException(String.format("Webhook请求失败: status=%d, body=%s",
                    response.statusCode(), StringUtils.abbreviate(response.body(), 200)));
        }
    }

    String buildPayload(NotificationMessage message) throws JsonProcessingException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", message.getKind() == NotificationKind.FAILURE ? "endpoint_down" : "endpoint_recovered");
        payload.put("endpoint_id", message.getEndpointId());
        payload.put("endpoint_name", message.getEndpointName());
        payload.put("url", message.getUrl());
        payload.put("subject", message.getSubject());
        payload.put("text", message.getBody());
        payload.put("status_code", message.getStatusCode());
        payload.put("error", message.getError());
        payload.put("response_time_ms", message.getResponseTimeMs());
        payload.put("timestamp", String.valueOf(message.getCheckedAt()));
        if (!recipients.isEmpty()) {
            payload.put("recipients", recipients);
        }
        return objectMapper.writeValueAsString(payload);
    }

    private HttpRequest buildHttpRequest(String content) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(webhookUrl))
                .timeout(Duration.ofSeconds(10));
        headers.forEach(builder::header);
        if ("PUT".equals(method)) {
            builder.PUT(HttpRequest.BodyPublishers.ofString(content));
        } else {
            builder.POST(HttpRequest.BodyPublishers.ofString(content));
        }
        return builder.build();
    }

    private void validate() {
        if (StringUtils.isBlank(webhookUrl)) {
            throw new IllegalArgumentException("Webhook URL不能为空");
        }
        try {
            URI uri = new URI(webhookUrl);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("无效的Webhook URL: " + webhookUrl);
            }
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("无效的Webhook URL: " + webhookUrl);
        }
        if (!List.of("POST", "PUT").contains(method)) {
            throw new IllegalArgumentException("不支持的HTTP方法: " + method);
        }
    }
}
