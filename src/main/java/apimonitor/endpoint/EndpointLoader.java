package apimonitor.endpoint;

import apimonitor.exception.MonitorException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static java.nio.file.StandardWatchEventKinds.*;

/**
 * 端点加载器 - 从YAML目录加载端点定义并监听变更
 */
public class EndpointLoader implements EndpointRepository, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EndpointLoader.class);
    private static final String GLOB = "*.{yaml,yml}";

    private final Path endpointsDirectory;
    private final ObjectMapper yamlMapper;
    private final ScheduledExecutorService scheduler;
    private final Map<Long, Endpoint> loadedEndpoints = new ConcurrentHashMap<>();
    private final Map<String, FileState> fileStates = new ConcurrentHashMap<>();
    private final List<EndpointChangeListener> changeListeners = new CopyOnWriteArrayList<>();

    private WatchService watchService;
    private volatile boolean watching = false;
    private Thread watchThread;
    private ScheduledFuture<?> rescanTask;

    public EndpointLoader(Path endpointsDirectory, ScheduledExecutorService scheduler) {
        this.endpointsDirectory = endpointsDirectory;
        this.scheduler = scheduler;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * 文件状态
     */
    private static class FileState {
        private final String hash;
        private final long lastModified;
        private final long size;

        FileState(String hash, long lastModified, long size) {
            this.hash = hash;
            this.lastModified = lastModified;
            this.size = size;
        }

        boolean hasChanged(FileState other) {
            return !this.hash.equals(other.hash)
                    || this.lastModified != other.lastModified
                    || this.size != other.size;
        }
    }

    /**
     * 加载目录下所有端点，不触发监听器
     */
    public List<Endpoint> loadAll() throws IOException {
        logger.info("开始加载端点目录: {}", endpointsDirectory);
        if (!Files.isDirectory(endpointsDirectory)) {
            Files.createDirectories(endpointsDirectory);
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(endpointsDirectory, GLOB)) {
            for (Path path : stream) {
                if (!Files.isRegularFile(path)) {
                    continue;
                }
                try {
                    Endpoint endpoint = loadEndpoint(path);
                    loadedEndpoints.put(endpoint.getId(), endpoint);
                    fileStates.put(path.toString(), createFileState(path));
                } catch (Exception e) {
                    logger.error("加载端点文件失败: {}", path, e);
                    notifyLoadError(path.toString(), e);
                }
            }
        }
        logger.info("端点加载完成, 共 {} 个", loadedEndpoints.size());
        return listAllEndpoints();
    }

    @Override
    public Optional<Endpoint> getEndpoint(long id) {
        return Optional.ofNullable(loadedEndpoints.get(id));
    }

    @Override
    public List<Endpoint> listActiveEndpoints() {
        return loadedEndpoints.values().stream()
                .filter(Endpoint::isActive)
                .sorted(Comparator.comparingLong(Endpoint::getId))
                .collect(Collectors.toList());
    }

    @Override
    public List<Endpoint> listAllEndpoints() {
        return loadedEndpoints.values().stream()
                .sorted(Comparator.comparingLong(Endpoint::getId))
                .collect(Collectors.toList());
    }

    /**
     * 解析并校验单个端点文件
     */
    Endpoint loadEndpoint(Path path) throws IOException {
        logger.debug("加载端点文件: {}", path);
        @SuppressWarnings("unchecked")
        Map<String, Object> config = yamlMapper.readValue(path.toFile(), Map.class);
        if (config == null) {
            throw new ConfigurationException("端点文件为空: " + path);
        }
        for (String field : List.of("id", "name", "url")) {
            if (!config.containsKey(field)) {
                throw new ConfigurationException(String.format("端点配置缺少必需字段 '%s': %s", field, path));
            }
        }

        Endpoint endpoint = buildEndpoint(config, path);
        endpoint.validate();
        checkUniqueness(endpoint, path);
        return endpoint;
    }

    private void checkUniqueness(Endpoint endpoint, Path path) {
        for (Endpoint existing : loadedEndpoints.values()) {
            if (Objects.equals(existing.getSourcePath(), path.toString())) {
                continue;
            }
            if (existing.getId() == endpoint.getId()) {
                throw new ConfigurationException(
                        String.format("端点id %d 已存在于文件: %s", endpoint.getId(), existing.getSourcePath()));
            }
            if (existing.getName().equals(endpoint.getName())) {
                throw new ConfigurationException(
                        String.format("端点名称 '%s' 已存在于文件: %s", endpoint.getName(), existing.getSourcePath()));
            }
        }
    }

    @SuppressWarnings("unchecked")
    private Endpoint buildEndpoint(Map<String, Object> config, Path path) {
        Endpoint endpoint = new Endpoint();
        endpoint.setId(((Number) config.get("id")).longValue());
        endpoint.setName(String.valueOf(config.get("name")));
        endpoint.setUrl(String.valueOf(config.get("url")));
        endpoint.setMethod(String.valueOf(config.getOrDefault("method", "GET")).toUpperCase());
        endpoint.setSourcePath(path.toString());
        endpoint.setActive((Boolean) config.getOrDefault("active", true));

        if (config.containsKey("interval")) {
            endpoint.setInterval(parseDuration(config.get("interval")));
        }
        if (config.containsKey("timeout")) {
            endpoint.setTimeout(parseDuration(config.get("timeout")));
        }
        if (config.containsKey("expected_status")) {
            endpoint.setExpectedStatus(((Number) config.get("expected_status")).intValue());
        }
        Map<String, Object> headers = (Map<String, Object>) config.get("headers");
        if (headers != null) {
            Map<String, String> copy = new LinkedHashMap<>();
            headers.forEach((k, v) -> copy.put(k, String.valueOf(v)));
            endpoint.setHeaders(copy);
        }
        endpoint.setBody(config.get("body"));
        return endpoint;
    }

    /**
     * 解析时间配置，纯数字按秒处理，支持 30s / 5m / 1h / 1d
     */
    static Duration parseDuration(Object value) {
        if (value instanceof Number) {
            return Duration.ofSeconds(((Number) value).longValue());
        }
        if (!(value instanceof String) || ((String) value).isBlank()) {
            throw new ConfigurationException("无效的时间格式: " + value);
        }
        String text = ((String) value).trim();
        String number = text.replaceAll("[^0-9]", "");
        String unit = text.replaceAll("[0-9]", "").trim();
        if (number.isEmpty()) {
            throw new ConfigurationException("无效的时间格式: " + value);
        }
        long amount = Long.parseLong(number);

        switch (unit.toLowerCase()) {
            case "":
            case "s":
                return Duration.ofSeconds(amount);
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            case "d":
                return Duration.ofDays(amount);
            default:
                throw new ConfigurationException("无效的时间单位: " + unit);
        }
    }

    private boolean isYamlFile(Path path) {
        String fileName = path.getFileName().toString().toLowerCase();
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }

    private FileState createFileState(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        return new FileState(DigestUtils.md5Hex(Files.readAllBytes(path)),
                attrs.lastModifiedTime().toMillis(), attrs.size());
    }

    /**
     * 启动文件监听
     */
    public synchronized void startWatching() throws IOException {
        if (watching) {
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();
        endpointsDirectory.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY);

        watching = true;
        watchThread = new Thread(this::watchLoop, "endpoint-watcher");
        watchThread.setDaemon(true);
        watchThread.start();
        logger.info("端点文件监听已启动: {}", endpointsDirectory);

        // 定期完整检查，弥补丢失的事件
        rescanTask = scheduler.scheduleWithFixedDelay(this::checkAllFiles, 1, 5, TimeUnit.MINUTES);
    }

    private void watchLoop() {
        try {
            while (watching) {
                WatchKey key = watchService.take();
                boolean needCheck = false;

                for (WatchEvent<?> event : key.pollEvents()) {
                    WatchEvent.Kind<?> kind = event.kind();
                    if (kind == OVERFLOW) {
                        needCheck = true;
                        continue;
                    }
                    Path filename = (Path) event.context();
                    if (!isYamlFile(filename)) {
                        continue;
                    }
                    Path fullPath = endpointsDirectory.resolve(filename);
                    try {
                        if (kind == ENTRY_CREATE || kind == ENTRY_MODIFY) {
                            handleFileChanged(fullPath);
                        } else if (kind == ENTRY_DELETE) {
                            handleFileDeleted(fullPath);
                        }
                    } catch (IOException e) {
                        logger.error("处理文件变更失败: {}", fullPath, e);
                    }
                }

                if (needCheck) {
                    checkAllFiles();
                }
                if (!key.reset()) {
                    logger.error("端点目录不再可访问: {}", endpointsDirectory);
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            logger.debug("端点文件监听已关闭");
        }
    }

    private void handleFileChanged(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            return;
        }
        String pathStr = path.toString();
        FileState oldState = fileStates.get(pathStr);
        FileState newState = createFileState(path);
        if (oldState == null || oldState.hasChanged(newState)) {
            fileStates.put(pathStr, newState);
            logger.info("检测到端点文件变更: {}", path);
            loadAndNotify(path);
        }
    }

    /**
     * 延迟1秒确认删除，覆盖写入会先触发DELETE再触发CREATE
     */
    private void handleFileDeleted(Path path) {
        String pathStr = path.toString();
        if (fileStates.remove(pathStr) == null) {
            return;
        }
        logger.info("检测到端点文件删除: {}", path);
        scheduler.schedule(() -> {
            try {
                if (Files.exists(path)) {
                    logger.info("文件仍然存在，按覆盖处理: {}", path);
                    fileStates.put(pathStr, createFileState(path));
                    loadAndNotify(path);
                } else {
                    notifyDeleted(pathStr);
                }
            } catch (IOException e) {
                logger.error("删除后检查失败: {}", path, e);
                notifyDeleted(pathStr);
            }
        }, 1, TimeUnit.SECONDS);
    }

    /**
     * 完整扫描目录，同步新增、修改和删除
     */
    synchronized void checkAllFiles() {
        try {
            Set<String> currentFiles = new HashSet<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(endpointsDirectory, GLOB)) {
                for (Path path : stream) {
                    if (Files.isRegularFile(path)) {
                        currentFiles.add(path.toString());
                        handleFileChanged(path);
                    }
                }
            }

            Set<String> deletedFiles = new HashSet<>(fileStates.keySet());
            deletedFiles.removeAll(currentFiles);
            for (String deletedFile : deletedFiles) {
                fileStates.remove(deletedFile);
                logger.info("检测到端点文件删除: {}", deletedFile);
                notifyDeleted(deletedFile);
            }
            // 之前加载失败、从未进入fileStates的定义也可能已被删除
            loadedEndpoints.values().stream()
                    .filter(e -> !currentFiles.contains(e.getSourcePath()))
                    .map(Endpoint::getSourcePath)
                    .distinct()
                    .collect(Collectors.toList())
                    .forEach(this::notifyDeleted);
        } catch (IOException e) {
            logger.error("检查端点文件失败", e);
        }
    }

    /**
     * 手动重新加载，返回当前端点数量
     */
    public int reload() {
        logger.info("手动重新加载端点目录: {}", endpointsDirectory);
        checkAllFiles();
        return loadedEndpoints.size();
    }

    private void loadAndNotify(Path path) {
        Endpoint endpoint;
        try {
            endpoint = loadEndpoint(path);
        } catch (Exception e) {
            logger.error("加载端点失败: {}", path, e);
            notifyLoadError(path.toString(), e);
            return;
        }

        // 同一文件中id被修改时，旧定义视为删除
        loadedEndpoints.values().stream()
                .filter(e -> path.toString().equals(e.getSourcePath()) && e.getId() != endpoint.getId())
                .collect(Collectors.toList())
                .forEach(stale -> {
                    loadedEndpoints.remove(stale.getId());
                    fireDeleted(stale);
                });

        Endpoint existing = loadedEndpoints.put(endpoint.getId(), endpoint);
        if (existing == null) {
            fireAdded(endpoint);
        } else if (!existing.equals(endpoint)) {
            fireUpdated(endpoint);
        }
    }

    private void notifyDeleted(String path) {
        List<Endpoint> deleted = loadedEndpoints.values().stream()
                .filter(e -> path.equals(e.getSourcePath()))
                .collect(Collectors.toList());
        for (Endpoint endpoint : deleted) {
            loadedEndpoints.remove(endpoint.getId());
            fireDeleted(endpoint);
        }
    }

    private void fireAdded(Endpoint endpoint) {
        for (EndpointChangeListener listener : changeListeners) {
            try {
                listener.onEndpointAdded(endpoint);
            } catch (Exception e) {
                logger.error("通知端点添加失败: {}", endpoint.getName(), e);
            }
        }
    }

    private void fireUpdated(Endpoint endpoint) {
        for (EndpointChangeListener listener : changeListeners) {
            try {
                listener.onEndpointUpdated(endpoint);
            } catch (Exception e) {
                logger.error("通知端点更新失败: {}", endpoint.getName(), e);
            }
        }
    }

    private void fireDeleted(Endpoint endpoint) {
        for (EndpointChangeListener listener : changeListeners) {
            try {
                listener.onEndpointDeleted(endpoint);
            } catch (Exception e) {
                logger.error("通知端点删除失败: {}", endpoint.getName(), e);
            }
        }
    }

    private void notifyLoadError(String path, Exception error) {
        for (EndpointChangeListener listener : changeListeners) {
            try {
                listener.onEndpointLoadError(path, error);
            } catch (Exception e) {
                logger.error("通知端点加载失败出错: {}", path, e);
            }
        }
    }

    public void addChangeListener(EndpointChangeListener listener) {
        changeListeners.add(listener);
    }

    public void removeChangeListener(EndpointChangeListener listener) {
        changeListeners.remove(listener);
    }

    @Override
    public void close() {
        watching = false;
        if (rescanTask != null) {
            rescanTask.cancel(false);
        }
        if (watchThread != null) {
            watchThread.interrupt();
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                logger.error("关闭文件监听服务失败", e);
            }
        }
    }

    /**
     * 配置异常
     */
    public static class ConfigurationException extends MonitorException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
