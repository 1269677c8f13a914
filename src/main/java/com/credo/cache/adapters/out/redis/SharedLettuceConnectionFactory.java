package com.credo.cache.adapters.out.redis;

import java.nio.ByteBuffer;

import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;

import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.api.StatefulRedisConnection;

/**
 * Connection factory that also hands out the native connection behind the
 * reactive template, for commands the template cannot express (scripts with
 * arbitrary reply types) and for opening that connection up front.
 */
class SharedLettuceConnectionFactory extends LettuceConnectionFactory {

    SharedLettuceConnectionFactory(RedisStandaloneConfiguration standalone,
            LettuceClientConfiguration clientConfig) {
        super(standalone, clientConfig);
    }

    /**
     * Returns the shared reactive connection, connecting first if needed.
     *
     * @throws org.springframework.data.redis.RedisConnectionFailureException
     *         if Redis cannot be reached
     */
    @SuppressWarnings("unchecked")
    StatefulRedisConnection<ByteBuffer, ByteBuffer> sharedConnection() {
        StatefulConnection<ByteBuffer, ByteBuffer> connection = getSharedReactiveConnection();
        if (!(connection instanceof StatefulRedisConnection)) {
            throw new IllegalStateException("A shared standalone Redis connection is required");
        }
        return (StatefulRedisConnection<ByteBuffer, ByteBuffer>) connection;
    }
}
