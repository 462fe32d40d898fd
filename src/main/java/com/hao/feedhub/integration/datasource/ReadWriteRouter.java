package com.hao.feedhub.integration.datasource;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * 读写分离路由器
 *
 * 类职责：
 * 提供读/写两种作用域的数据库访问入口：读走只读副本，写走主库，副本不可用时透明回退主库。
 *
 * 设计目的：
 * 1. 读多写少的列表接口把查询压力分摊到副本。
 * 2. 副本宕机、未配置或构建失败都不影响请求成功。
 *
 * 为什么需要该类：
 * 路由规则（哪些 SQL、哪些路径走副本）需要集中定义，中间件与业务代码共用同一套判断。
 *
 * 核心实现思路：
 * - read/write 在代码块执行期间绑定线程路由，结束后恢复之前的路由，支持嵌套。
 * - openRead/openWrite 直接返回原始连接，调用方负责关闭。
 * - isReadQuery 为无状态 SQL 分类器；shouldUseReplica 为可配置的路径前缀白名单。
 */
@Slf4j
public class ReadWriteRouter {

    public static final List<String> DEFAULT_REPLICA_PATHS = List.of(
            "/api/feed",
            "/api/search",
            "/api/users/profile",
            "/api/posts/list",
            "/api/jobs/list",
            "/api/notifications/list"
    );

    private static final Pattern READ_PREFIX = Pattern.compile("^(select|show|describe|desc|explain)\\b");
    private static final Pattern MUTATING_KEYWORD = Pattern.compile("\\b(insert|update|delete|merge|upsert)\\b");

    private final ReadWriteRoutingDataSource routingDataSource;
    private final String replicaUrl;
    private final List<String> replicaPaths;

    public ReadWriteRouter(ReadWriteRoutingDataSource routingDataSource, String replicaUrl, List<String> replicaPaths) {
        this.routingDataSource = routingDataSource;
        this.replicaUrl = replicaUrl;
        this.replicaPaths = replicaPaths == null || replicaPaths.isEmpty() ? DEFAULT_REPLICA_PATHS : List.copyOf(replicaPaths);
        log.info("读写路由初始化|Read_write_router_init,replicaEnabled={},replicaUrl={},paths={}",
                hasReplica(), maskUrl(replicaUrl), this.replicaPaths);
    }

    /**
     * 在只读作用域内执行
     */
    public <T> T read(Supplier<T> action) {
        return routed(DataSourceRoute.REPLICA, action);
    }

    /**
     * 在主库作用域内执行
     */
    public <T> T write(Supplier<T> action) {
        return routed(DataSourceRoute.PRIMARY, action);
    }

    /**
     * 获取读连接，副本失败时回退主库
     *
     * @return 原始连接，调用方负责关闭
     * @throws SQLException 主库也无法获取连接
     */
    public Connection openRead() throws SQLException {
        DataSourceRoute previous = ReadWriteRoutingDataSource.bind(DataSourceRoute.REPLICA);
        try {
            return routingDataSource.getConnection();
        } finally {
            ReadWriteRoutingDataSource.restore(previous);
        }
    }

    public Connection openWrite() throws SQLException {
        return routingDataSource.getPrimary().getConnection();
    }

    /**
     * 读连接池：未配置副本时与写连接池是同一个
     */
    public DataSource readDataSource() {
        return hasReplica() ? routingDataSource.getReplica() : routingDataSource.getPrimary();
    }

    public DataSource writeDataSource() {
        return routingDataSource.getPrimary();
    }

    public boolean hasReplica() {
        return routingDataSource.getReplica() != null;
    }

    /**
     * 判断 SQL 是否为只读语句
     *
     * 实现逻辑：
     * 1. 去掉首部空白后忽略大小写。
     * 2. SELECT/SHOW/DESCRIBE/EXPLAIN 开头为只读。
     * 3. WITH 开头且不含写关键字时视为只读。
     */
    public static boolean isReadQuery(String sql) {
        if (sql == null) {
            return false;
        }
        String normalized = sql.strip().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return false;
        }
        if (READ_PREFIX.matcher(normalized).find()) {
            return true;
        }
        if (normalized.startsWith("with")) {
            return normalized.contains("select") && !MUTATING_KEYWORD.matcher(normalized).find();
        }
        return false;
    }

    /**
     * 路径是否属于读多写少、可以走副本的接口
     */
    public boolean shouldUseReplica(String path) {
        if (path == null) {
            return false;
        }
        for (String prefix : replicaPaths) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 副本健康检查
     *
     * @return status、masked url、latency_ms 等信息
     */
    public Map<String, Object> checkReplicaHealth() {
        Map<String, Object> result = new LinkedHashMap<>();
        if (!hasReplica()) {
            result.put("status", "not_configured");
            result.put("message", "Using primary database for reads");
            return result;
        }
        result.put("url", maskUrl(replicaUrl));
        long start = System.nanoTime();
        try (Connection connection = routingDataSource.getReplica().getConnection()) {
            boolean valid = connection.isValid(5);
            result.put("status", valid ? "healthy" : "unhealthy");
            result.put("latency_ms", (System.nanoTime() - start) / 1_000_000.0);
        } catch (SQLException | RuntimeException e) {
            log.warn("只读副本健康检查失败|Replica_health_check_fail,error={}", e.getMessage());
            result.put("status", "unhealthy");
            result.put("error", e.getMessage());
        }
        return result;
    }

    /**
     * 连接池状态
     */
    public Map<String, Object> poolStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("primary", describePool(routingDataSource.getPrimary()));
        status.put("replica", hasReplica() ? describePool(routingDataSource.getReplica()) : null);
        status.put("replica_fallbacks", routingDataSource.getReplicaFallbacks());
        return status;
    }

    /**
     * 关闭连接池
     */
    @PreDestroy
    public void close() {
        closePool(routingDataSource.getReplica(), "replica");
        closePool(routingDataSource.getPrimary(), "primary");
    }

    static String maskUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        // user:password@host -> user:***@host，password=xxx -> password=***
        return url.replaceAll("(//[^:/@]+):[^@]*@", "$1:***@")
                .replaceAll("(?i)(password=)[^&;]*", "$1***");
    }

    private <T> T routed(DataSourceRoute route, Supplier<T> action) {
        DataSourceRoute previous = ReadWriteRoutingDataSource.bind(route);
        try {
            return action.get();
        } finally {
            ReadWriteRoutingDataSource.restore(previous);
        }
    }

    private Map<String, Object> describePool(DataSource dataSource) {
        Map<String, Object> pool = new LinkedHashMap<>();
        if (dataSource instanceof HikariDataSource) {
            HikariDataSource hikari = (HikariDataSource) dataSource;
            pool.put("name", hikari.getPoolName());
            pool.put("max_size", hikari.getMaximumPoolSize());
            HikariPoolMXBean mxBean = hikari.getHikariPoolMXBean();
            if (mxBean != null) {
                pool.put("active", mxBean.getActiveConnections());
                pool.put("idle", mxBean.getIdleConnections());
                pool.put("total", mxBean.getTotalConnections());
                pool.put("waiting", mxBean.getThreadsAwaitingConnection());
            }
        } else if (dataSource != null) {
            pool.put("type", dataSource.getClass().getSimpleName());
        }
        return pool;
    }

    private void closePool(DataSource dataSource, String name) {
        if (dataSource instanceof HikariDataSource && !((HikariDataSource) dataSource).isClosed()) {
            ((HikariDataSource) dataSource).close();
            log.info("连接池已关闭|Pool_closed,name={}", name);
        }
    }
}
