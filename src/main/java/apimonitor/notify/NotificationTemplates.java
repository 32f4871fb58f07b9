package apimonitor.notify;

import apimonitor.endpoint.Endpoint;
import apimonitor.probe.ProbeResult;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * 通知模板，支持 {endpoint_name} {url} {method} {status_code} {error} {response_time} {timestamp}
 */
@Value
@Builder
public class NotificationTemplates {
    private static final String[] PLACEHOLDERS = {
            "{endpoint_name}", "{url}", "{method}", "{status_code}", "{error}", "{response_time}", "{timestamp}"
    };

    @Builder.Default
    String failureSubject = "🚨 Alert: {endpoint_name} is DOWN";
    @Builder.Default
    String failureBody = "Endpoint {endpoint_name} is unreachable. Error: {error}";
    @Builder.Default
    String recoverySubject = "✅ Recovery: {endpoint_name} is back online";
    @Builder.Default
    String recoveryBody = "{endpoint_name} is back online!\nURL: {url}\nRecovered at: {timestamp}";

    public static NotificationTemplates defaults() {
        return NotificationTemplates.builder().build();
    }

    public NotificationMessage render(NotificationKind kind, Endpoint endpoint, ProbeResult result) {
        String[] values = {
                endpoint.getName(),
                endpoint.getUrl(),
                endpoint.getMethod(),
                result.getStatusCode() == null ? "N/A" : String.valueOf(result.getStatusCode()),
                StringUtils.defaultIfBlank(result.getErrorMessage(), "Unknown error"),
                result.getLatency() == null ? "N/A" : result.getLatencyMs() + "ms",
                String.valueOf(result.getCheckedAt())
        };
        boolean failure = kind == NotificationKind.FAILURE;
        return NotificationMessage.builder()
                .kind(kind)
                .endpointId(endpoint.getId())
                .endpointName(endpoint.getName())
                .url(endpoint.getUrl())
                .method(endpoint.getMethod())
                .statusCode(result.getStatusCode())
                .error(result.getErrorMessage())
                .responseTimeMs(result.getLatencyMs())
                .checkedAt(result.getCheckedAt())
                .subject(StringUtils.replaceEach(failure ? failureSubject : recoverySubject, PLACEHOLDERS, values))
                .body(StringUtils.replaceEach(failure ? failureBody : recoveryBody, PLACEHOLDERS, values))
                .build();
    }
}
