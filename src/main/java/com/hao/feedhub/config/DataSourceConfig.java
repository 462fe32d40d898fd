package com.hao.feedhub.config;

import com.hao.feedhub.integration.datasource.ReadWriteRouter;
import com.hao.feedhub.integration.datasource.ReadWriteRoutingDataSource;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * 读写分离数据源配置类
 *
 * 类职责：
 * 构建主库与只读副本两个 HikariCP 连接池，并对外只暴露一个路由数据源。
 *
 * 设计目的：
 * 1. 副本是可选的：只有配置了 app.datasource.replica.url 且不同于主库地址时才构建。
 * 2. 副本构建失败（地址不可达、认证失败）只记录告警，读流量回到主库，应用照常启动。
 *
 * 核心实现思路：
 * - 主库连接池延迟初始化，首次取连接时才建立物理连接。
 * - 副本连接池立即初始化，借此在启动阶段发现不可用的副本。
 * - 连接池参数：池大小 10、溢出 10（最大 20）、连接超时 5 秒。
 */
@Slf4j
@Configuration
public class DataSourceConfig {

    @Value("${app.datasource.pool-size:10}")
    private int poolSize;

    @Value("${app.datasource.max-overflow:10}")
    private int maxOverflow;

    @Value("${app.datasource.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Bean
    @Primary
    public ReadWriteRoutingDataSource dataSource(DataSourceProperties properties,
                                                 @Value("${app.datasource.replica.url:}") String replicaUrl,
                                                 @Value("${app.datasource.replica.username:}") String replicaUsername,
                                                 @Value("${app.datasource.replica.password:}") String replicaPassword) {
        HikariDataSource primary = new HikariDataSource();
        applyPool(primary, "feedhub-primary", properties.determineUrl(),
                properties.determineUsername(), properties.determinePassword(), properties.determineDriverClassName());

        HikariDataSource replica = null;
        if (StringUtils.hasText(replicaUrl) && !replicaUrl.equals(properties.determineUrl())) {
            replica = buildReplica(replicaUrl,
                    StringUtils.hasText(replicaUsername) ? replicaUsername : properties.determineUsername(),
                    StringUtils.hasText(replicaPassword) ? replicaPassword : properties.determinePassword(),
                    properties.determineDriverClassName());
        } else {
            log.info("未配置只读副本_读写均走主库|Replica_not_configured");
        }
        return new ReadWriteRoutingDataSource(primary, replica);
    }

    @Bean
    public ReadWriteRouter readWriteRouter(ReadWriteRoutingDataSource dataSource,
                                           @Value("${app.datasource.replica.url:}") String replicaUrl,
                                           @Value("${app.datasource.replica.paths:}") List<String> replicaPaths) {
        return new ReadWriteRouter(dataSource, replicaUrl, replicaPaths);
    }

    private HikariDataSource buildReplica(String url, String username, String password, String driverClassName) {
        HikariConfig config = new HikariConfig();
        applyPool(config, "feedhub-replica", url, username, password, driverClassName);
        config.setReadOnly(true);
        try {
            HikariDataSource replica = new HikariDataSource(config);
            log.info("只读副本连接池创建完成|Replica_pool_created,poolName={}", replica.getPoolName());
            return replica;
        } catch (RuntimeException e) {
            log.warn("只读副本连接池创建失败_读流量回退主库|Replica_pool_create_fail,error={}", e.getMessage());
            return null;
        }
    }

    private void applyPool(HikariConfig config, String poolName, String url, String username, String password,
                           String driverClassName) {
        config.setPoolName(poolName);
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        if (StringUtils.hasText(driverClassName)) {
            config.setDriverClassName(driverClassName);
        }
        config.setMinimumIdle(Math.min(2, poolSize));
        config.setMaximumPoolSize(poolSize + maxOverflow);
        config.setConnectionTimeout(connectTimeoutMs);
        // 连接最长存活 30 分钟
        config.setMaxLifetime(30 * 60 * 1000L);
    }
}
