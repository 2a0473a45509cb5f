package xyz.firestige.release.infrastructure.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.release.domain.shared.exception.ConflictException;
import xyz.firestige.release.domain.shared.exception.ErrorType;
import xyz.firestige.release.domain.shared.exception.OrchestrationException;
import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.domain.shared.vo.EnvironmentId;
import xyz.firestige.release.domain.shared.vo.ReleaseId;
import xyz.firestige.release.domain.shared.vo.ServiceId;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 部署锁管理器（单实例内存锁）
 *
 * <p>锁的粒度：
 * <ul>
 *   <li>deployment:{id}：串行化同一部署的所有状态变更，不同部署完全并行
 *   <li>pair:{releaseId}|{environmentId}：覆盖"是否存在活跃部署"的检查与插入
 *   <li>service:{serviceId}：覆盖版本号唯一性的检查与插入
 * </ul>
 *
 * <p>获取锁有超时上限，超时返回冲突，任何操作都不会无限阻塞。
 * 锁条目按使用者计数，没有线程持有或等待时立即移除，map 大小只与并发中的操作数相关。
 */
public class DeploymentLockManager {

    private static final Logger log = LoggerFactory.getLogger(DeploymentLockManager.class);

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final Duration acquireTimeout;

    public DeploymentLockManager(Duration acquireTimeout) {
        this.acquireTimeout = Objects.requireNonNull(acquireTimeout, "acquireTimeout");
        log.info("DeploymentLockManager 初始化完成，获取超时: {}", acquireTimeout);
    }

    public <T> T withDeploymentLock(DeploymentId deploymentId, Supplier<T> action) {
        return withLock(deploymentKey(deploymentId), action);
    }

    public <T> T withPairLock(ReleaseId releaseId, EnvironmentId environmentId, Supplier<T> action) {
        return withLock("pair:" + releaseId + "|" + environmentId, action);
    }

    public <T> T withServiceLock(ServiceId serviceId, Supplier<T> action) {
        return withLock("service:" + serviceId, action);
    }

    public boolean isHeld(DeploymentId deploymentId) {
        LockEntry entry = locks.get(deploymentKey(deploymentId));
        return entry != null && entry.lock.isLocked();
    }

    int size() {
        return locks.size();
    }

    private <T> T withLock(String key, Supplier<T> action) {
        LockEntry entry = locks.compute(key, (k, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.users++;
            return e;
        });
        try {
            boolean acquired;
            try {
                acquired = entry.lock.tryLock(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OrchestrationException(ErrorType.SYSTEM_ERROR, "等待锁时被中断: " + key, e);
            }
            if (!acquired) {
                log.warn("获取锁超时: key={}, timeout={}", key, acquireTimeout);
                ConflictException e = new ConflictException("资源正忙，请稍后重试: " + key);
                e.addContext("lockKey", key);
                throw e;
            }
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
        }
    }

    private static String deploymentKey(DeploymentId deploymentId) {
        return "deployment:" + deploymentId;
    }

    /**
     * users 只在 map 的 compute 内修改
     */
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
