package com.hao.feedhub.realtime;

/**
 * 连接状态机
 *
 * CONNECTING -> AUTHENTICATED -> JOINED -> DISCONNECTED
 */
public enum ConnectionState {

    /** 已建立传输连接，尚未通过鉴权 */
    CONNECTING,

    /** 令牌校验通过，尚未完成注册 */
    AUTHENTICATED,

    /** 已注册并加入个人房间，可以收发事件 */
    JOINED,

    /** 已断开，所有索引已清理 */
    DISCONNECTED
}
