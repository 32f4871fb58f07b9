package apimonitor.exception;

import lombok.Getter;

/**
 * 监控端点不存在
 */
@Getter
public class EndpointNotFoundException extends MonitorException {
    private final long endpointId;

    public EndpointNotFoundException(long endpointId) {
        super("Endpoint " + endpointId + " not found");
        this.endpointId = endpointId;
    }
}
