package id.go.kemenkeu.djpbn.sakti.wf.starter.config;

import id.go.kemenkeu.djpbn.sakti.wf.core.retry.RetryPolicy;
import id.go.kemenkeu.djpbn.sakti.wf.core.retry.RetryPolicyName;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sakti.wf")
public class SaktiWfProperties {

    private Dragonfly dragonfly = new Dragonfly();
    private Lock lock = new Lock();
    private Database database = new Database();
    private Retry retry = new Retry();
    private Audit audit = new Audit();
    private Job job = new Job();
    private Ticket ticket = new Ticket();
    private Health health = new Health();
    private Observability observability = new Observability();

    public static class Dragonfly {
        private boolean enabled = false;
        private String url = "redis://localhost:6379";
        private String password = "";
        private Pool pool = new Pool();
        private int timeout = 3000;
        private int connectTimeout = 5000;

        public static class Pool {
            private int size = 64;
            private int minIdle = 10;

            public int getSize() { return size; }
            public void setSize(int size) { this.size = size; }
            public int getMinIdle() { return minIdle; }
            public void setMinIdle(int minIdle) { this.minIdle = minIdle; }
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public Pool getPool() { return pool; }
        public void setPool(Pool pool) { this.pool = pool; }
        public int getTimeout() { return timeout; }
        public void setTimeout(int timeout) { this.timeout = timeout; }
        public int getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(int connectTimeout) { this.connectTimeout = connectTimeout; }
    }

    public static class Lock {
        private boolean enabled = true;
        private String prefix = "workflow:";
        private long ttlMs = 15000;
        private long blockingTimeoutMs = 10000;
        private long pollMinMs = 10;
        private long pollMaxMs = 50;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
        public long getTtlMs() { return ttlMs; }
        public void setTtlMs(long ttlMs) { this.ttlMs = ttlMs; }
        public long getBlockingTimeoutMs() { return blockingTimeoutMs; }
        public void setBlockingTimeoutMs(long blockingTimeoutMs) { this.blockingTimeoutMs = blockingTimeoutMs; }
        public long getPollMinMs() { return pollMinMs; }
        public void setPollMinMs(long pollMinMs) { this.pollMinMs = pollMinMs; }
        public long getPollMaxMs() { return pollMaxMs; }
        public void setPollMaxMs(long pollMaxMs) { this.pollMaxMs = pollMaxMs; }
    }

    public static class Database {
        // Transaction timeout of every critical section; must not exceed lock.ttl-ms
        private long lockTimeoutMs = 10000;

        public long getLockTimeoutMs() { return lockTimeoutMs; }
        public void setLockTimeoutMs(long lockTimeoutMs) { this.lockTimeoutMs = lockTimeoutMs; }
    }

    public static class Retry {
        private Policy defaultPolicy = Policy.from(RetryPolicy.defaults(RetryPolicyName.DEFAULT));
        private Policy highContention = Policy.from(RetryPolicy.defaults(RetryPolicyName.HIGH_CONTENTION));
        private Policy multiRow = Policy.from(RetryPolicy.defaults(RetryPolicyName.MULTI_ROW));
        private Policy infrastructure = Policy.from(RetryPolicy.defaults(RetryPolicyName.INFRASTRUCTURE));

        public static class Policy {
            private int maxAttempts;
            private long baseDelayMs;
            private long maxDelayMs;

            static Policy from(RetryPolicy policy) {
                Policy p = new Policy();
                p.maxAttempts = policy.getMaxAttempts();
                p.baseDelayMs = policy.getBaseDelayMs();
                p.maxDelayMs = policy.getMaxDelayMs();
                return p;
            }

            public int getMaxAttempts() { return maxAttempts; }
            public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
            public long getBaseDelayMs() { return baseDelayMs; }
            public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
            public long getMaxDelayMs() { return maxDelayMs; }
            public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }
        }

        public Policy get(RetryPolicyName name) {
            switch (name) {
                case HIGH_CONTENTION:
                    return highContention;
                case MULTI_ROW:
                    return multiRow;
                case INFRASTRUCTURE:
                    return infrastructure;
                default:
                    return defaultPolicy;
            }
        }

        public Policy getDefaultPolicy() { return defaultPolicy; }
        public void setDefaultPolicy(Policy defaultPolicy) { this.defaultPolicy = defaultPolicy; }
        public Policy getHighContention() { return highContention; }
        public void setHighContention(Policy highContention) { this.highContention = highContention; }
        public Policy getMultiRow() { return multiRow; }
        public void setMultiRow(Policy multiRow) { this.multiRow = multiRow; }
        public Policy getInfrastructure() { return infrastructure; }
        public void setInfrastructure(Policy infrastructure) { this.infrastructure = infrastructure; }
    }

    public static class Audit {
        private boolean enabled = true;
        private String table = "workflow_audit_log";
        private int pageSize = 100;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getTable() { return table; }
        public void setTable(String table) { this.table = table; }
        public int getPageSize() { return pageSize; }
        public void setPageSize(int pageSize) { this.pageSize = pageSize; }
    }

    public static class Job {
        private boolean enabled = true;
        private String table = "job";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getTable() { return table; }
        public void setTable(String table) { this.table = table; }
    }

    public static class Ticket {
        private boolean enabled = true;
        private String table = "ticket";
        private int historyMaxLength = 50;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getTable() { return table; }
        public void setTable(String table) { this.table = table; }
        public int getHistoryMaxLength() { return historyMaxLength; }
        public void setHistoryMaxLength(int historyMaxLength) { this.historyMaxLength = historyMaxLength; }
    }

    public static class Health {
        private boolean enabled = true;
        private int failureThreshold = 5;
        private long recoveryTimeoutMs = 30000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public long getRecoveryTimeoutMs() { return recoveryTimeoutMs; }
        public void setRecoveryTimeoutMs(long recoveryTimeoutMs) { this.recoveryTimeoutMs = recoveryTimeoutMs; }
    }

    public static class Observability {
        private boolean metricsEnabled = true;

        public boolean isMetricsEnabled() { return metricsEnabled; }
        public void setMetricsEnabled(boolean metricsEnabled) { this.metricsEnabled = metricsEnabled; }
    }

    public Dragonfly getDragonfly() { return dragonfly; }
    public void setDragonfly(Dragonfly dragonfly) { this.dragonfly = dragonfly; }
    public Lock getLock() { return lock; }
    public void setLock(Lock lock) { this.lock = lock; }
    public Database getDatabase() { return database; }
    public void setDatabase(Database database) { this.database = database; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }
    public Job getJob() { return job; }
    public void setJob(Job job) { this.job = job; }
    public Ticket getTicket() { return ticket; }
    public void setTicket(Ticket ticket) { this.ticket = ticket; }
    public Health getHealth() { return health; }
    public void setHealth(Health health) { this.health = health; }
    public Observability getObservability() { return observability; }
    public void setObservability(Observability observability) { this.observability = observability; }
}
