package apimonitor.endpoint;

import java.util.List;
import java.util.Optional;

/**
 * 端点定义的只读访问
 */
public interface EndpointRepository {

    Optional<Endpoint> getEndpoint(long id);

    List<Endpoint> listActiveEndpoints();

    List<Endpoint> listAllEndpoints();
}
