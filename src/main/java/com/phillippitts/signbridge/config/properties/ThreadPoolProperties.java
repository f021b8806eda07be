package com.phillippitts.signbridge.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Thread pool sizing.
 *
 * <ul>
 *   <li>{@code threadpool.pipeline.*} - mediation completion handling</li>
 *   <li>{@code threadpool.event.*} - async Spring event listeners</li>
 *   <li>{@code threadpool.idle-scheduler-thread-name} - single timer thread of the idle-state manager</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private PoolProperties pipeline = new PoolProperties(2, 4, 20, "pipeline-");

    @Valid
    private PoolProperties event = new PoolProperties(1, 2, 50, "event-pool-");

    @NotBlank
    private String idleSchedulerThreadName = "idle-timer";

    public PoolProperties getPipeline() {
        return pipeline;
    }

    public void setPipeline(PoolProperties pipeline) {
        this.pipeline = pipeline;
    }

    public PoolProperties getEvent() {
        return event;
    }

    public void setEvent(PoolProperties event) {
        this.event = event;
    }

    public String getIdleSchedulerThreadName() {
        return idleSchedulerThreadName;
    }

    public void setIdleSchedulerThreadName(String idleSchedulerThreadName) {
        this.idleSchedulerThreadName = idleSchedulerThreadName;
    }

    /**
     * Settings for one {@code ThreadPoolTaskExecutor}.
     */
    public static class PoolProperties {
        @Positive
        private int corePoolSize;
        @Positive
        private int maxPoolSize;
        @PositiveOrZero
        private int queueCapacity;
        @Positive
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix;

        public PoolProperties() {
            this(1, 1, 0, "pool-");
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
