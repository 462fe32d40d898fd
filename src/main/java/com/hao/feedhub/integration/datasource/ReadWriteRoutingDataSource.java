package com.hao.feedhub.integration.datasource;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.datasource.AbstractDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.LongAdder;

/**
 * 读写路由数据源
 *
 * 类职责：
 * 作为应用唯一暴露的 DataSource，按当前线程绑定的路由把连接请求转给主库或只读副本。
 *
 * 设计目的：
 * 1. MyBatis、JdbcTemplate 等上层组件无感知，只通过线程路由切换读写。
 * 2. 副本获取连接失败时本次回退主库，绝不因为副本不可用让请求失败。
 *
 * 核心实现思路：
 * - ThreadLocal 保存路由，默认主库。
 * - replica 为 null（未配置或构建失败）时 REPLICA 路由等同主库。
 */
@Slf4j
public class ReadWriteRoutingDataSource extends AbstractDataSource {

    private static final ThreadLocal<DataSourceRoute> ROUTE = new ThreadLocal<>();

    private final DataSource primary;
    private final DataSource replica;
    private final LongAdder replicaFallbacks = new LongAdder();

    public ReadWriteRoutingDataSource(DataSource primary, DataSource replica) {
        this.primary = primary;
        this.replica = replica;
    }

    /**
     * 绑定当前线程路由
     *
     * @param route 目标路由
     * @return 之前的路由，用于恢复，可能为 null
     */
    public static DataSourceRoute bind(DataSourceRoute route) {
        DataSourceRoute previous = ROUTE.get();
        ROUTE.set(route);
        return previous;
    }

    /**
     * 恢复之前的路由
     */
    public static void restore(DataSourceRoute previous) {
        if (previous == null) {
            ROUTE.remove();
        } else {
            ROUTE.set(previous);
        }
    }

    public static DataSourceRoute currentRoute() {
        DataSourceRoute route = ROUTE.get();
        return route == null ? DataSourceRoute.PRIMARY : route;
    }

    @Override
    public Connection getConnection() throws SQLException {
        if (currentRoute() == DataSourceRoute.REPLICA && replica != null) {
            try {
                return replica.getConnection();
            } catch (SQLException | RuntimeException e) {
                replicaFallbacks.increment();
                log.warn("只读副本获取连接失败_回退主库|Replica_connection_fail_fallback_primary,error={}", e.getMessage());
            }
        }
        return primary.getConnection();
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        if (currentRoute() == DataSourceRoute.REPLICA && replica != null) {
            try {
                return replica.getConnection(username, password);
            } catch (SQLException | RuntimeException e) {
                replicaFallbacks.increment();
                log.warn("只读副本获取连接失败_回退主库|Replica_connection_fail_fallback_primary,error={}", e.getMessage());
            }
        }
        return primary.getConnection(username, password);
    }

    public DataSource getPrimary() {
        return primary;
    }

    public DataSource getReplica() {
        return replica;
    }

    public long getReplicaFallbacks() {
        return replicaFallbacks.sum();
    }
}
