package com.hao.feedhub.integration.datasource;

/**
 * 数据源路由目标
 */
public enum DataSourceRoute {

    /** 主库：写操作与兜底读 */
    PRIMARY,

    /** 只读副本 */
    REPLICA
}
