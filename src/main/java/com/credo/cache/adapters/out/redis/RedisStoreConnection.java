package com.credo.cache.adapters.out.redis;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import com.credo.cache.application.port.out.StoreConnection;
import com.credo.cache.application.port.out.StoreError;
import com.credo.cache.application.port.out.StoreErrorListener;
import com.credo.cache.domain.config.RedisConnectionConfig;
import com.credo.cache.domain.retry.ReconnectContext;
import com.credo.cache.domain.retry.ReconnectDecision;
import com.credo.cache.domain.retry.ReconnectPolicy;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.event.DefaultEventBus;
import io.lettuce.core.event.Event;
import io.lettuce.core.event.connection.ConnectionActivatedEvent;
import io.lettuce.core.event.connection.DisconnectedEvent;
import io.lettuce.core.event.connection.ReconnectFailedEvent;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;

/**
 * Redis implementation of the StoreConnection outbound port.
 * <p>
 * Commands go through a {@link ReactiveStringRedisTemplate} over one shared
 * Lettuce connection, so nothing here blocks. Scripts run on the same native
 * connection with an {@code OBJECT} reply so integer and array replies survive.
 * Keys are namespaced by {@link PrefixedKeySerializer}.
 * </p>
 * <p>
 * The first connection is opened by {@link #connect()}. Until it succeeds,
 * each failure is reported to the error listeners and the reconnect policy
 * decides whether to try again; after that Lettuce's watchdog reconnects.
 * </p>
 */
public class RedisStoreConnection implements StoreConnection {

    private static final Logger log = LoggerFactory.getLogger(RedisStoreConnection.class);

    private final String cacheName;
    private final ReactiveStringRedisTemplate redisTemplate;
    private final SharedLettuceConnectionFactory connectionFactory;
    private final ClientResources clientResources;
    private final ReconnectTracker tracker;
    private final PolicyReconnectDelay reconnectDelay;
    private final RedisSerializer<String> keySerializer;
    private final List<StoreErrorListener> errorListeners = new CopyOnWriteArrayList<>();

    private volatile Disposable eventSubscription;
    private volatile boolean closed;

    RedisStoreConnection(String cacheName,
            ReactiveStringRedisTemplate redisTemplate,
            SharedLettuceConnectionFactory connectionFactory,
            ClientResources clientResources,
            ReconnectTracker tracker,
            PolicyReconnectDelay reconnectDelay,
            RedisSerializer<String> keySerializer) {
        this.cacheName = cacheName;
        this.redisTemplate = redisTemplate;
        this.connectionFactory = connectionFactory;
        this.clientResources = clientResources;
        this.tracker = tracker;
        this.reconnectDelay = reconnectDelay;
        this.keySerializer = keySerializer;
        tracker.onGiveUp(this::abandon);
    }

    /**
     * Opens a connection to the configured Redis server.
     *
     * @param cacheName name used in logs and passed to the reconnect policy
     * @param config    connection settings
     * @param policy    reconnect policy to install into Lettuce
     * @return store, owned by the caller; not connected until
     *         {@link #connect()}
     */
    public static RedisStoreConnection open(String cacheName, RedisConnectionConfig config, ReconnectPolicy policy) {
        if (config == null)
            throw new IllegalArgumentException("config cannot be null");
        if (policy == null)
            throw new IllegalArgumentException("policy cannot be null");

        ReconnectTracker tracker = new ReconnectTracker(Clock.systemUTC());
        ReconnectContext context = new ReconnectContext(cacheName, log);
        PolicyReconnectDelay reconnectDelay = new PolicyReconnectDelay(policy, tracker, context);
        ClientResources clientResources = DefaultClientResources.builder()
                .eventBus(new TrackingEventBus(new DefaultEventBus(Schedulers.boundedElastic()), tracker))
                .reconnectDelay(reconnectDelay)
                .build();

        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(config.getHost(), config.getPort());
        standalone.setPassword(RedisPassword.of(config.getPassword()));

        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .clientResources(clientResources)
                .clientOptions(ClientOptions.builder().autoReconnect(true).build())
                .build();

        SharedLettuceConnectionFactory connectionFactory = new SharedLettuceConnectionFactory(standalone, clientConfig);
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();

        PrefixedKeySerializer keySerializer = new PrefixedKeySerializer(config.getPrefix());
        RedisSerializationContext<String, String> serializationContext = RedisSerializationContext
                .<String, String>newSerializationContext(StringRedisSerializer.UTF_8)
                .key(keySerializer)
                .build();
        ReactiveStringRedisTemplate redisTemplate = new ReactiveStringRedisTemplate(
                connectionFactory, serializationContext);

        RedisStoreConnection connection = new RedisStoreConnection(cacheName, redisTemplate,
                connectionFactory, clientResources, tracker, reconnectDelay, keySerializer);
        connection.eventSubscription = clientResources.eventBus().get()
                .subscribe(connection::handleEvent);

        log.info("action=redis_connection_configured cache={} host={} port={} prefix={}",
                cacheName, config.getHost(), config.getPort(), config.getPrefix());
        return connection;
    }

    // ─────────────────── Commands ───────────────────

    @Override
    public CompletableFuture<String> get(String key) {
        return redisTemplate.opsForValue().get(key).toFuture();
    }

    @Override
    public CompletableFuture<List<String>> mget(List<String> keys) {
        return redisTemplate.opsForValue().multiGet(keys).toFuture();
    }

    @Override
    public CompletableFuture<Void> set(String key, String value) {
        return redisTemplate.opsForValue().set(key, value).then().toFuture();
    }

    @Override
    public CompletableFuture<Void> setex(String key, long seconds, String value) {
        return redisTemplate.opsForValue().set(key, value, Duration.ofSeconds(seconds)).then().toFuture();
    }

    @Override
    public CompletableFuture<Long> del(List<String> keys) {
        return redisTemplate.delete(keys.toArray(new String[0])).toFuture();
    }

    @Override
    public CompletableFuture<Object> eval(String script, List<String> keys, List<String> args) {
        ByteBuffer[] keyBuffers = new ByteBuffer[keys.size()];
        for (int i = 0; i < keyBuffers.length; i++) {
            keyBuffers[i] = ByteBuffer.wrap(keySerializer.serialize(keys.get(i)));
        }
        ByteBuffer[] argBuffers = new ByteBuffer[args.size()];
        for (int i = 0; i < argBuffers.length; i++) {
            argBuffers[i] = ByteBuffer.wrap(StringRedisSerializer.UTF_8.serialize(args.get(i)));
        }

        try {
            return connectionFactory.sharedConnection().async()
                    .<Object>eval(script, ScriptOutputType.OBJECT, keyBuffers, argBuffers)
                    .toCompletableFuture()
                    .thenApply(ScriptReplies::toValue);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // ─────────────────── Initial Connection ───────────────────

    @Override
    public CompletableFuture<Void> connect() {
        CompletableFuture<Void> connected = new CompletableFuture<>();
        attemptConnect(1, connected, CompletableFuture.delayedExecutor(0, TimeUnit.MILLISECONDS));
        return connected;
    }

    private void attemptConnect(int attempt, CompletableFuture<Void> connected, Executor executor) {
        CompletableFuture.runAsync(() -> {
            if (closed) {
                connected.cancel(false);
                return;
            }
            connectionFactory.sharedConnection();
        }, executor).whenComplete((ignored, error) -> {
            if (connected.isDone()) {
                return;
            }
            if (error == null) {
                log.info("action=redis_initial_connection cache={} attempt={}", cacheName, attempt);
                connected.complete(null);
                return;
            }

            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            log.warn("action=redis_initial_connection_failed cache={} attempt={} error={}",
                    cacheName, attempt, cause.getMessage());
            tracker.reconnectFailed(cause);
            publish(StoreError.transport(cause));

            ReconnectDecision decision = reconnectDelay.decide(attempt);
            if (decision.isTerminal()) {
                tracker.giveUp(decision.getTerminalError());
                connected.completeExceptionally(decision.getTerminalError());
                return;
            }
            attemptConnect(attempt + 1, connected, CompletableFuture.delayedExecutor(
                    decision.getDelay().toMillis(), TimeUnit.MILLISECONDS));
        });
    }

    // ─────────────────── Connection Events ───────────────────

    @Override
    public void onError(StoreErrorListener listener) {
        if (listener == null)
            throw new IllegalArgumentException("listener cannot be null");
        errorListeners.add(listener);
    }

    void handleEvent(Event event) {
        if (event instanceof ConnectionActivatedEvent) {
            log.info("action=redis_connected cache={} timesConnected={}", cacheName, tracker.getTimesConnected());
        } else if (event instanceof DisconnectedEvent) {
            log.warn("action=redis_disconnected cache={}", cacheName);
        } else if (event instanceof ReconnectFailedEvent) {
            ReconnectFailedEvent failed = (ReconnectFailedEvent) event;
            publish(StoreErrorClassifier.classifyReconnectFailure(failed.getCause()));
        }
    }

    void publish(StoreError error) {
        for (StoreErrorListener listener : errorListeners) {
            try {
                listener.onError(error);
            } catch (RuntimeException e) {
                log.error("action=store_error_listener_failed cache={} error={}", cacheName, e.getMessage(), e);
            }
        }
    }

    private void abandon(Exception terminalError) {
        log.error("action=redis_retry_abandoned cache={} reason={}", cacheName, terminalError.getMessage());
        publish(new StoreError(StoreError.Kind.RETRY_ABANDONED, terminalError));
        if (connectionFactory != null) {
            // off the Lettuce event loop: resetting closes the channel the watchdog runs on
            CompletableFuture.runAsync(connectionFactory::resetConnection);
        }
    }

    @Override
    public void close() {
        closed = true;
        Disposable subscription = eventSubscription;
        if (subscription != null) {
            subscription.dispose();
        }
        if (connectionFactory != null) {
            connectionFactory.destroy();
        }
        if (clientResources != null) {
            clientResources.shutdown(0, 2, TimeUnit.SECONDS);
        }
        log.info("action=redis_connection_closed cache={}", cacheName);
    }
}
