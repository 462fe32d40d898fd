package com.hao.feedhub.realtime;

/**
 * 推送事件名与房间命名
 *
 * 帧格式统一为 {"event": name, "data": {...}}。
 */
public final class HubEvents {

    // ===========================
    // 1. 客户端 -> 服务端
    // ===========================
    public static final String CONNECT = "connect";
    public static final String PING = "ping";
    public static final String JOIN_CONVERSATION = "join_conversation";
    public static final String LEAVE_CONVERSATION = "leave_conversation";
    public static final String TYPING = "typing";
    public static final String LOGOUT = "logout";

    // ===========================
    // 2. 服务端 -> 客户端
    // ===========================
    public static final String CONNECTED = "connected";
    public static final String PONG = "pong";
    public static final String NOTIFICATION = "notification";
    public static final String LIKE_UPDATE = "like_update";
    public static final String COMMENT_UPDATE = "comment_update";
    public static final String USER_STATUS = "user_status";
    public static final String NEW_MESSAGE = "new_message";
    public static final String JOINED_CONVERSATION = "joined_conversation";
    public static final String LEFT_CONVERSATION = "left_conversation";
    public static final String ERROR = "error";

    public static final String STATUS_ONLINE = "online";
    public static final String STATUS_OFFLINE = "offline";

    /** WebSocket 关闭码：策略违规（鉴权失败） */
    public static final int CLOSE_POLICY_VIOLATION = 1008;

    /** WebSocket 关闭码：服务端过载，客户端稍后重连（出站队列积压超限） */
    public static final int CLOSE_TRY_AGAIN_LATER = 1013;

    /** WebSocket 关闭码：正常关闭 */
    public static final int CLOSE_NORMAL = 1000;

    private HubEvents() {
    }

    public static String userRoom(String userId) {
        return "user_" + userId;
    }

    public static String conversationRoom(String conversationId) {
        return "conversation_" + conversationId;
    }
}
