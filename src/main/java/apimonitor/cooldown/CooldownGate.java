package apimonitor.cooldown;

/**
 * 告警冷却闸门 - 决定某个端点此刻能否发送失败通知
 */
public interface CooldownGate {

    /**
     * 没有未过期的记录时写入新记录并返回 true，否则返回 false
     */
    boolean tryAcquire(long endpointId);

    /**
     * 清除端点的冷却记录
     */
    void reset(long endpointId);

    /**
     * 重新检查后端可用性，返回后端是否可用
     */
    default boolean revalidate() {
        return true;
    }
}
