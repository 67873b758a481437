package id.go.kemenkeu.djpbn.sakti.wf.starter.aspect;

import id.go.kemenkeu.djpbn.sakti.wf.core.context.CorrelationContext;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.DistributedMutex;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.LockHandle;
import id.go.kemenkeu.djpbn.sakti.wf.starter.annotation.ResourceLock;
import id.go.kemenkeu.djpbn.sakti.wf.starter.config.SaktiWfProperties;
import id.go.kemenkeu.djpbn.sakti.wf.starter.util.SpelExpressionEvaluator;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;

@Aspect
public class ResourceLockAspect {

    private static final Logger log = LoggerFactory.getLogger(ResourceLockAspect.class);

    private final DistributedMutex mutex;
    private final SaktiWfProperties properties;

    public ResourceLockAspect(DistributedMutex mutex, SaktiWfProperties properties) {
        this.mutex = mutex;
        this.properties = properties;
    }

    @Around("@annotation(id.go.kemenkeu.djpbn.sakti.wf.starter.annotation.ResourceLock)")
    public Object around(ProceedingJoinPoint pjp) throws Throwable {
        MethodSignature signature = (MethodSignature) pjp.getSignature();
        Method method = signature.getMethod();
        ResourceLock annotation = method.getAnnotation(ResourceLock.class);

        String key = properties.getLock().getPrefix()
            + SpelExpressionEvaluator.evaluate(annotation.key(), pjp, method.getName());
        long ttl = annotation.ttlMs() > 0 ? annotation.ttlMs() : properties.getLock().getTtlMs();
        long wait = annotation.blockingTimeoutMs() >= 0
            ? annotation.blockingTimeoutMs() : properties.getLock().getBlockingTimeoutMs();

        try (CorrelationContext ctx = CorrelationContext.open(null)) {
            log.debug("Acquiring {} for {} (ttl: {}ms, wait: {}ms)", key, method.getName(), ttl, wait);
            try (LockHandle handle = mutex.acquire(key, ttl, wait)) {
                return pjp.proceed();
            }
        }
    }
}
