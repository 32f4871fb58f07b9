package apimonitor.store;

import apimonitor.probe.ErrorCategory;
import apimonitor.probe.ProbeResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import org.apache.commons.codec.digest.DigestUtils;

import java.time.Duration;
import java.time.Instant;

/**
 * 探测结果的ES文档，时间字段使用ISO字符串
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProbeResultDocument {
    private String id;
    private long endpointId;
    private boolean success;
    private Integer statusCode;
    private long responseTimeMs;
    private String errorCategory;
    private String errorMessage;
    private String checkedAt;

    public static ProbeResultDocument from(long endpointId, ProbeResult result) {
        ProbeResultDocument document = new ProbeResultDocument();
        document.setEndpointId(endpointId);
        document.setSuccess(result.isSuccess());
        document.setStatusCode(result.getStatusCode());
        document.setResponseTimeMs(result.getLatencyMs());
        document.setErrorCategory(result.getErrorCategory() == null ? null : result.getErrorCategory().name());
        document.setErrorMessage(result.getErrorMessage());
        document.setCheckedAt(result.getCheckedAt().toString());
        document.setId(documentId(endpointId, result));
        return document;
    }

    /**
     * 由结果内容生成确定的文档id，重复写入覆盖同一文档
     */
    static String documentId(long endpointId, ProbeResult result) {
        return DigestUtils.md5Hex(endpointId + "_" + result.getCheckedAt() + "_" + result.isSuccess()
                + "_" + result.getStatusCode() + "_" + result.getLatencyMs());
    }

    public ProbeResult toResult() {
        return ProbeResult.builder()
                .endpointId(endpointId)
                .success(success)
                .statusCode(statusCode)
                .latency(Duration.ofMillis(responseTimeMs))
                .errorCategory(errorCategory == null ? null : ErrorCategory.valueOf(errorCategory))
                .errorMessage(errorMessage)
                .checkedAt(Instant.parse(checkedAt))
                .build();
    }
}
