package apimonitor.scheduler;

import apimonitor.cooldown.CooldownGate;
import apimonitor.endpoint.Endpoint;
import apimonitor.endpoint.EndpointChangeListener;
import apimonitor.endpoint.EndpointRepository;
import apimonitor.notify.NotificationService;
import apimonitor.probe.HealthProbe;
import apimonitor.probe.ProbeResult;
import apimonitor.store.ProbeResultStore;
import apimonitor.utils.FutureUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 监控调度器 - 每个启用的端点一个周期任务，检测失败/恢复边沿并触发通知。
 * <p>
 * 同一端点的检查串行执行：上一次检查结束后才排下一次，不会重叠。
 */
public class MonitorScheduler implements EndpointChangeListener, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MonitorScheduler.class);

    private final EndpointRepository endpoints;
    private final HealthProbe healthProbe;
    private final ProbeResultStore resultStore;
    private final CooldownGate cooldownGate;
    private final NotificationService notificationService;
    private final boolean notificationsEnabled;
    private final boolean sendRecovery;
    private final ScheduledExecutorService scheduler;
    private final Executor workerExecutor;
    private final Clock clock;

    private final Map<Long, JobHandle> jobs = new ConcurrentHashMap<>();
    // endpointId -> 上一次检查是否成功
    private final Map<Long, Boolean> edgeStates = new ConcurrentHashMap<>();
    private volatile boolean running;
    private volatile boolean closed;

    public MonitorScheduler(EndpointRepository endpoints,
                            HealthProbe healthProbe,
                            ProbeResultStore resultStore,
                            CooldownGate cooldownGate,
                            NotificationService notificationService,
                            boolean notificationsEnabled,
                            boolean sendRecovery,
                            ScheduledExecutorService scheduler,
                            Executor workerExecutor,
                            Clock clock) {
        this.endpoints = endpoints;
        this.healthProbe = healthProbe;
        this.resultStore = resultStore;
        this.cooldownGate = cooldownGate;
        this.notificationService = notificationService;
        this.notificationsEnabled = notificationsEnabled;
        this.sendRecovery = sendRecovery;
        this.scheduler = scheduler;
        this.workerExecutor = workerExecutor;
        this.clock = clock;
    }

    /**
     * 启动调度，为所有启用的端点创建任务
     */
    public void start() {
        if (running) {
            logger.warn("调度器已经在运行");
            return;
        }
        running = true;
        int count = 0;
        for (Endpoint endpoint : endpoints.listActiveEndpoints()) {
            if (addJob(endpoint)) {
                count++;
            }
        }
        logger.info("监控调度器已启动, 调度端点 {} 个", count);
    }

    /**
     * 添加任务，已存在时不做任何事
     */
    public boolean addJob(Endpoint endpoint) {
        if (!endpoint.isActive()) {
            logger.debug("端点未启用, 不调度: {}", endpoint.getName());
            return false;
        }
        JobHandle handle = new JobHandle(endpoint.getId(), endpoint.getInterval());
        if (jobs.putIfAbsent(endpoint.getId(), handle) != null) {
            return false;
        }
        scheduleNext(handle, clock.instant().plus(endpoint.getInterval()));
        logger.info("端点已调度: {}(id={}), 间隔: {}秒", endpoint.getName(), endpoint.getId(),
                endpoint.getInterval().toSeconds());
        return true;
    }

    /**
     * 移除任务并清除边沿状态，不存在时不做任何事
     */
    public boolean removeJob(long endpointId) {
        JobHandle handle = jobs.remove(endpointId);
        edgeStates.remove(endpointId);
        if (handle == null) {
            return false;
        }
        handle.cancel();
        logger.info("端点任务已移除: id={}", endpointId);
        return true;
    }

    /**
     * 先移除再按新定义添加，端点停用时只移除
     */
    public void updateJob(Endpoint endpoint) {
        removeJob(endpoint.getId());
        if (endpoint.isActive()) {
            addJob(endpoint);
        }
    }

    private void scheduleNext(JobHandle handle, Instant dueAt) {
        if (closed || handle.isCancelled()) {
            return;
        }
        long delay = Math.max(0, Duration.between(clock.instant(), dueAt).toMillis());
        try {
            ScheduledFuture<?> future = scheduler.schedule(() -> runTick(handle, dueAt), delay, TimeUnit.MILLISECONDS);
            handle.arm(future, dueAt);
        } catch (RejectedExecutionException e) {
            logger.debug("调度线程池已关闭, 停止端点任务: id={}", handle.getEndpointId());
        }
    }

    private void runTick(JobHandle handle, Instant dueAt) {
        if (handle.isCancelled()) {
            return;
        }
        tick(handle.getEndpointId()).whenComplete((ignored, error) -> {
            Instant next = dueAt.plus(handle.getInterval());
            Instant now = clock.instant();
            // 检查耗时超过间隔时，错过的轮次不补跑
            while (next.isBefore(now)) {
                next = next.plus(handle.getInterval());
            }
            scheduleNext(handle, next);
        });
    }

    /**
     * 执行一次检查，返回的 future 总是正常完成
     */
    CompletableFuture<Void> tick(long endpointId) {
        Optional<Endpoint> current;
        try {
            current = endpoints.getEndpoint(endpointId);
        } catch (Exception e) {
            logger.error("读取端点定义失败: id={}", endpointId, e);
            return CompletableFuture.completedFuture(null);
        }

        if (current.isEmpty()) {
            logger.info("端点已删除, 取消任务: id={}", endpointId);
            removeJob(endpointId);
            return CompletableFuture.completedFuture(null);
        }
        Endpoint endpoint = current.get();
        if (!endpoint.isActive()) {
            logger.debug("端点未启用, 跳过本次检查: {}", endpoint.getName());
            return CompletableFuture.completedFuture(null);
        }

        return FutureUtils.invoke(() -> healthProbe.check(endpoint))
                .thenAcceptAsync(result -> handleResult(endpoint, result), workerExecutor)
                .exceptionally(error -> {
                    logger.error("端点检查任务异常: {}", endpoint.getName(), FutureUtils.unwrap(error));
                    return null;
                });
    }

    private void handleResult(Endpoint endpoint, ProbeResult result) {
        long endpointId = endpoint.getId();
        try {
            resultStore.save(endpointId, result);
        } catch (Exception e) {
            logger.error("保存检查结果失败: {}", endpoint.getName(), e);
        }

        Boolean previous = edgeStates.get(endpointId);
        boolean success = result.isSuccess();
        try {
            if (!success && (previous == null || previous)) {
                onFailureEdge(endpoint, result);
            } else if (success && Boolean.FALSE.equals(previous)) {
                onRecoveryEdge(endpoint, result);
            }
        } catch (Exception e) {
            logger.error("处理状态变化失败: {}", endpoint.getName(), e);
        } finally {
            // 任务已被移除时不再写回状态
            if (jobs.containsKey(endpointId)) {
                edgeStates.put(endpointId, success);
            }
        }
    }

    private void onFailureEdge(Endpoint endpoint, ProbeResult result) {
        logger.warn("端点故障: {} - {}", endpoint.getName(), result.getErrorMessage());
        if (!notificationsEnabled) {
            return;
        }
        if (cooldownGate.tryAcquire(endpoint.getId())) {
            notificationService.notifyFailure(endpoint, result);
        } else {
            logger.info("端点 {} 处于通知冷却期, 跳过故障通知", endpoint.getName());
        }
    }

    private void onRecoveryEdge(Endpoint endpoint, ProbeResult result) {
        logger.info("端点恢复: {}", endpoint.getName());
        if (notificationsEnabled && sendRecovery) {
            notificationService.notifyRecovery(endpoint, result);
        }
    }

    public Optional<JobStatus> getJobStatus(long endpointId) {
        return Optional.ofNullable(jobs.get(endpointId)).map(JobHandle::status);
    }

    public Map<Long, JobStatus> getAllJobStatuses() {
        Map<Long, JobStatus> statuses = new TreeMap<>();
        jobs.forEach((id, handle) -> statuses.put(id, handle.status()));
        return statuses;
    }

    /**
     * 上一次检查结果，未检查过为空
     */
    public Optional<Boolean> lastKnownState(long endpointId) {
        return Optional.ofNullable(edgeStates.get(endpointId));
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void onEndpointAdded(Endpoint endpoint) {
        logger.info("添加新端点: {}", endpoint.getName());
        addJob(endpoint);
    }

    @Override
    public void onEndpointUpdated(Endpoint endpoint) {
        logger.info("更新端点: {}", endpoint.getName());
        updateJob(endpoint);
    }

    @Override
    public void onEndpointDeleted(Endpoint endpoint) {
        logger.info("删除端点: {}", endpoint.getName());
        removeJob(endpoint.getId());
    }

    @Override
    public void onEndpointLoadError(String path, Exception error) {
        logger.error("加载端点失败: {}", path, error);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        running = false;
        jobs.keySet().forEach(this::removeJob);
        logger.info("监控调度器已停止");
    }
}
