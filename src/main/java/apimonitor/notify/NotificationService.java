package apimonitor.notify;

import apimonitor.endpoint.Endpoint;
import apimonitor.probe.ProbeResult;

/**
 * 通知出口，调用方不关心投递结果
 */
public interface NotificationService {

    void notifyFailure(Endpoint endpoint, ProbeResult result);

    void notifyRecovery(Endpoint endpoint, ProbeResult result);
}
