package com.taskchain.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskchain.core.port.Notifier;
import com.taskchain.core.repository.CacheStore;
import com.taskchain.core.repository.ChainLeaseStore;
import com.taskchain.engine.cache.TaskCache;
import com.taskchain.engine.coordinator.TaskDispatcher;
import com.taskchain.engine.coordinator.TaskRunner;
import com.taskchain.engine.coordinator.TriggerCoordinator;
import com.taskchain.engine.job.RetryingJobRunner;
import com.taskchain.engine.metrics.TaskChainMetrics;
import com.taskchain.engine.notify.LoggingNotifier;
import com.taskchain.engine.persistence.InMemoryCacheStore;
import com.taskchain.engine.persistence.InMemoryChainLeaseStore;
import com.taskchain.engine.persistence.redis.RedisCacheStore;
import com.taskchain.engine.persistence.redis.RedisChainLeaseStore;
import com.taskchain.engine.presence.InMemoryListenerRegistry;
import com.taskchain.engine.queue.InProcessTaskQueue;
import com.taskchain.engine.registry.TaskRegistry;
import com.taskchain.tasks.cloud.BackendSettings;
import com.taskchain.tasks.cloud.CloudInventory;
import com.taskchain.tasks.cloud.CloudTasks;
import com.taskchain.tasks.cloud.MachineCountJob;
import com.taskchain.tasks.deploy.MonitoringService;
import com.taskchain.tasks.deploy.PostDeployStepsJob;
import com.taskchain.tasks.deploy.RemoteShell;
import com.taskchain.tasks.deploy.SshCommandJob;
import com.taskchain.tasks.machine.HostPinger;
import com.taskchain.tasks.machine.MachineTasks;
import com.taskchain.tasks.machine.SshProber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Wires the engine and the concrete tasks.
 *
 * Cloud and machine tasks are registered only when the application context
 * provides the provider integrations they need ({@link CloudInventory},
 * {@link SshProber}, {@link RemoteShell} and so on).
 */
@Configuration
public class TaskChainConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TaskChainConfiguration.class);

    @Bean
    public Clock taskChainClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper taskChainObjectMapper() {
        return TaskCache.defaultObjectMapper();
    }

    @Bean
    public TaskChainMetrics taskChainMetrics() {
        return new TaskChainMetrics();
    }

    // Stores

    @Bean
    @ConditionalOnProperty(prefix = "taskchain", name = "store", havingValue = "memory", matchIfMissing = true)
    public CacheStore inMemoryCacheStore() {
        log.warn("Using in-memory cache store; results are not shared between processes");
        return new InMemoryCacheStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "taskchain", name = "store", havingValue = "memory", matchIfMissing = true)
    public ChainLeaseStore inMemoryChainLeaseStore() {
        return new InMemoryChainLeaseStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "taskchain", name = "store", havingValue = "redis")
    public CacheStore redisCacheStore(StringRedisTemplate redis, ObjectMapper taskChainObjectMapper) {
        return new RedisCacheStore(redis, taskChainObjectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "taskchain", name = "store", havingValue = "redis")
    public ChainLeaseStore redisChainLeaseStore(StringRedisTemplate redis) {
        return new RedisChainLeaseStore(redis);
    }

    @Bean
    public TaskCache taskCache(CacheStore cacheStore, ObjectMapper taskChainObjectMapper) {
        return new TaskCache(cacheStore, taskChainObjectMapper);
    }

    // Collaborators

    @Bean
    public InMemoryListenerRegistry listenerRegistry() {
        return new InMemoryListenerRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(Notifier.class)
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }

    @Bean(destroyMethod = "stop")
    public InProcessTaskQueue taskQueue(TaskChainProperties properties, TaskChainMetrics metrics) {
        return new InProcessTaskQueue(properties.workers(), metrics);
    }

    // Tasks and jobs

    @Bean
    public TaskRegistry taskRegistry(
            ObjectProvider<CloudInventory> inventory,
            ObjectProvider<BackendSettings> backendSettings,
            ObjectProvider<SshProber> prober,
            ObjectProvider<HostPinger> pinger) {
        TaskRegistry registry = new TaskRegistry();
        inventory.ifAvailable(cloud -> {
            backendSettings.ifAvailable(settings -> registry.register(CloudTasks.listMachines(cloud, settings)));
            registry.register(CloudTasks.listImages(cloud));
            registry.register(CloudTasks.listSizes(cloud));
            registry.register(CloudTasks.listLocations(cloud));
        });
        prober.ifAvailable(p -> registry.register(MachineTasks.probe(p)));
        pinger.ifAvailable(p -> registry.register(MachineTasks.ping(p)));
        log.info("Chain tasks registered: {}", registry.names());
        return registry;
    }

    @Bean
    public RetryingJobRunner retryingJobRunner(
            InProcessTaskQueue taskQueue,
            TaskChainMetrics metrics,
            Notifier notifier,
            Clock taskChainClock,
            ObjectProvider<CloudInventory> inventory,
            ObjectProvider<BackendSettings> backendSettings,
            ObjectProvider<RemoteShell> shell,
            ObjectProvider<MonitoringService> monitoring) {
        RetryingJobRunner runner = new RetryingJobRunner(taskQueue, metrics);
        backendSettings.ifAvailable(settings -> runner.register(new MachineCountJob(settings)));
        shell.ifAvailable(remote -> {
            runner.register(new SshCommandJob(remote, notifier));
            inventory.ifAvailable(cloud -> monitoring.ifAvailable(m ->
                runner.register(new PostDeployStepsJob(cloud, remote, m, notifier, taskChainClock))));
        });
        return runner;
    }

    @Bean
    public TaskRunner taskRunner(
            TaskChainProperties properties,
            TaskRegistry taskRegistry,
            TaskCache taskCache,
            InMemoryListenerRegistry listenerRegistry,
            InProcessTaskQueue taskQueue,
            ChainLeaseStore chainLeaseStore,
            TaskChainMetrics metrics,
            Clock taskChainClock,
            ObjectMapper taskChainObjectMapper) {
        TaskRunner.Builder builder = TaskRunner.builder()
            .registry(taskRegistry)
            .cache(taskCache)
            .presence(listenerRegistry)
            .publisher(listenerRegistry)
            .queue(taskQueue)
            .metrics(metrics)
            .clock(taskChainClock)
            .objectMapper(taskChainObjectMapper);
        if (properties.lease().enabled()) {
            builder.leaseStore(chainLeaseStore, properties.lease().duration());
        }
        return builder.build();
    }

    @Bean
    public TriggerCoordinator triggerCoordinator(
            TaskRegistry taskRegistry,
            TaskCache taskCache,
            InProcessTaskQueue taskQueue,
            Clock taskChainClock) {
        return new TriggerCoordinator(taskRegistry, taskCache, taskQueue, taskChainClock);
    }

    @Bean
    public TaskDispatcher taskDispatcher(
            TaskRegistry taskRegistry,
            TaskRunner taskRunner,
            RetryingJobRunner retryingJobRunner,
            TaskChainMetrics metrics) {
        return new TaskDispatcher(taskRegistry, taskRunner, retryingJobRunner, metrics);
    }

    @Bean
    public TaskQueueLifecycle taskQueueLifecycle(InProcessTaskQueue taskQueue, TaskDispatcher taskDispatcher) {
        return new TaskQueueLifecycle(taskQueue, taskDispatcher);
    }
}
