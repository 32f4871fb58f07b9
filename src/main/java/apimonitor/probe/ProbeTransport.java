package apimonitor.probe;

import apimonitor.endpoint.Endpoint;

import java.util.concurrent.CompletableFuture;

/**
 * 发送一次HTTP请求；传输失败以 ProbeFailureException 结束 future
 */
public interface ProbeTransport {

    CompletableFuture<ProbeResponse> send(Endpoint endpoint);
}
