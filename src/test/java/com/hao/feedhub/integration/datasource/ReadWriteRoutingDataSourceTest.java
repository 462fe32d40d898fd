package com.hao.feedhub.integration.datasource;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 读写路由数据源测试
 *
 * 测试目的：
 * 1. 默认路由主库，REPLICA 路由走副本。
 * 2. 副本获取连接失败时本次回退主库并计数，请求不失败。
 */
public class ReadWriteRoutingDataSourceTest {

    private final DataSource primary = mock(DataSource.class);
    private final DataSource replica = mock(DataSource.class);
    private final Connection primaryConnection = mock(Connection.class);
    private final Connection replicaConnection = mock(Connection.class);

    @AfterEach
    void tearDown() {
        ReadWriteRoutingDataSource.restore(null);
    }

    @Test
    @DisplayName("默认路由主库")
    void testGetConnection_DefaultPrimary() throws SQLException {
        when(primary.getConnection()).thenReturn(primaryConnection);
        ReadWriteRoutingDataSource dataSource = new ReadWriteRoutingDataSource(primary, replica);

        assertSame(primaryConnection, dataSource.getConnection());
        verify(replica, never()).getConnection();
    }

    @Test
    @DisplayName("REPLICA 路由走副本")
    void testGetConnection_Replica() throws SQLException {
        when(replica.getConnection()).thenReturn(replicaConnection);
        ReadWriteRoutingDataSource dataSource = new ReadWriteRoutingDataSource(primary, replica);

        ReadWriteRoutingDataSource.bind(DataSourceRoute.REPLICA);
        assertSame(replicaConnection, dataSource.getConnection());
        assertEquals(0L, dataSource.getReplicaFallbacks());
    }

    @Test
    @DisplayName("副本失败回退主库并计数")
    void testGetConnection_ReplicaFallback() throws SQLException {
        when(replica.getConnection()).thenThrow(new SQLException("replica down"));
        when(primary.getConnection()).thenReturn(primaryConnection);
        ReadWriteRoutingDataSource dataSource = new ReadWriteRoutingDataSource(primary, replica);

        ReadWriteRoutingDataSource.bind(DataSourceRoute.REPLICA);
        assertSame(primaryConnection, dataSource.getConnection());
        assertSame(primaryConnection, dataSource.getConnection());
        assertEquals(2L, dataSource.getReplicaFallbacks());
    }

    @Test
    @DisplayName("未配置副本时 REPLICA 路由等同主库")
    void testGetConnection_NoReplica() throws SQLException {
        when(primary.getConnection()).thenReturn(primaryConnection);
        ReadWriteRoutingDataSource dataSource = new ReadWriteRoutingDataSource(primary, null);

        DataSourceRoute previous = ReadWriteRoutingDataSource.bind(DataSourceRoute.REPLICA);
        assertSame(primaryConnection, dataSource.getConnection());
        ReadWriteRoutingDataSource.restore(previous);
        assertEquals(DataSourceRoute.PRIMARY, ReadWriteRoutingDataSource.currentRoute());
    }
}
