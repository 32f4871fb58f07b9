package apimonitor.endpoint;

/**
 * 端点变更监听器接口
 */
public interface EndpointChangeListener {
    void onEndpointAdded(Endpoint endpoint);

    void onEndpointUpdated(Endpoint endpoint);

    void onEndpointDeleted(Endpoint endpoint);

    default void onEndpointLoadError(String path, Exception error) {
    }
}
