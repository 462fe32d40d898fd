package com.hao.feedhub.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.cluster.ClusterClientOptions;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisConfiguration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Redis 连接配置类
 * <p>
 * 类职责：
 * 构建 Lettuce 连接工厂与 StringRedisTemplate。
 *
 * 设计目的：
 * 1. 统一 Redis 连接与超时配置，避免多处重复。
 * 2. 严格的连接/命令超时，Redis 变慢时触发降级而不是拖住请求线程。
 *
 * 为什么需要该类：
 * 限流、响应缓存、跨进程推送都依赖同一个连接工厂，超时参数直接决定故障时的降级速度。
 *
 * 核心实现思路：
 * - 配置了 spring.data.redis.cluster.nodes 时使用集群模式，否则使用单机模式。
 * - 连接超时与命令超时默认 2 秒。
 * - 关闭连接共享，配合连接池使用独立物理连接。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RedisProperties.class)
public class RedisConfig {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

    private final RedisProperties redisProperties;

    public RedisConfig(RedisProperties redisProperties) {
        this.redisProperties = redisProperties;
    }

    /**
     * 创建并配置 Lettuce 连接工厂
     *
     * 实现逻辑：
     * 1. 按是否配置集群节点选择集群/单机配置。
     * 2. 组装连接池参数与超时参数。
     * 3. 关闭连接共享。连接在首次使用时才建立，Redis 宕机不影响容器启动。
     *
     * @return LettuceConnectionFactory 配置好的连接工厂
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory(
            @Value("${app.redis.connect-timeout:2s}") Duration connectTimeout) {
        RedisConfiguration serverConfig = buildServerConfiguration();

        // --- 连接池参数 (GenericObjectPool) ---
        GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig = new GenericObjectPoolConfig<>();
        RedisProperties.Pool pool = redisProperties.getLettuce().getPool();
        if (pool != null) {
            poolConfig.setMaxTotal(pool.getMaxActive());
            poolConfig.setMaxIdle(pool.getMaxIdle());
            poolConfig.setMinIdle(pool.getMinIdle());
            // 获取连接最大等待时间，超时抛异常进入降级
            if (pool.getMaxWait() != null && !pool.getMaxWait().isNegative()) {
                poolConfig.setMaxWait(pool.getMaxWait());
            }
        }

        Duration commandTimeout = redisProperties.getTimeout() != null ? redisProperties.getTimeout() : DEFAULT_TIMEOUT;
        SocketOptions socketOptions = SocketOptions.builder().connectTimeout(connectTimeout).build();
        ClientOptions clientOptions = isCluster()
                ? ClusterClientOptions.builder().socketOptions(socketOptions).build()
                : ClientOptions.builder().socketOptions(socketOptions).build();

        LettuceClientConfiguration clientConfiguration = LettucePoolingClientConfiguration.builder()
                .commandTimeout(commandTimeout)
                .clientOptions(clientOptions)
                .poolConfig(poolConfig)
                .build();

        LettuceConnectionFactory connectionFactory = serverConfig instanceof RedisClusterConfiguration
                ? new LettuceConnectionFactory((RedisClusterConfiguration) serverConfig, clientConfiguration)
                : new LettuceConnectionFactory((RedisStandaloneConfiguration) serverConfig, clientConfiguration);

        // 核心代码：关闭连接共享
        connectionFactory.setShareNativeConnection(false);
        log.info("Redis连接工厂创建完成|Redis_factory_created,mode={},commandTimeout={},connectTimeout={},poolMax={}",
                isCluster() ? "cluster" : "standalone", commandTimeout, connectTimeout, poolConfig.getMaxTotal());
        return connectionFactory;
    }

    /**
     * 配置 StringRedisTemplate
     * <p>
     * 键和值都是 String 序列化；缓存内容以 JSON 字符串存放。
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(connectionFactory);
        template.afterPropertiesSet();
        log.info("StringRedisTemplate初始化完成|StringRedisTemplate_init_done");
        return template;
    }

    private boolean isCluster() {
        RedisProperties.Cluster cluster = redisProperties.getCluster();
        return cluster != null && !CollectionUtils.isEmpty(cluster.getNodes());
    }

    private RedisConfiguration buildServerConfiguration() {
        if (isCluster()) {
            RedisProperties.Cluster cluster = redisProperties.getCluster();
            RedisClusterConfiguration config = new RedisClusterConfiguration(cluster.getNodes());
            // 防止集群拓扑变更时的重定向死循环
            if (cluster.getMaxRedirects() != null) {
                config.setMaxRedirects(cluster.getMaxRedirects());
            }
            if (StringUtils.hasText(redisProperties.getPassword())) {
                config.setPassword(RedisPassword.of(redisProperties.getPassword()));
            }
            return config;
        }
        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration(redisProperties.getHost(), redisProperties.getPort());
        config.setDatabase(redisProperties.getDatabase());
        if (StringUtils.hasText(redisProperties.getPassword())) {
            config.setPassword(RedisPassword.of(redisProperties.getPassword()));
        }
        return config;
    }
}
