package com.hao.feedhub.realtime;

import com.hao.feedhub.common.util.JsonUtil;
import com.hao.feedhub.realtime.auth.HubAuthenticationException;
import com.hao.feedhub.realtime.auth.TokenVerifier;
import com.hao.feedhub.realtime.bridge.FanoutBridge;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 实时推送中心
 *
 * 类职责：
 * 管理已鉴权连接、房间索引与在线状态，并把业务事件扇出到对应房间的连接。
 *
 * 设计目的：
 * 1. 所有注册表由一个对象持有，生命周期随容器创建与销毁。
 * 2. 房间索引的加入/离开/连接/断开与扇出读取互斥，扇出看到的永远是一致快照。
 * 3. 注册要么全部成功，要么什么都不留下。
 *
 * 为什么需要该类：
 * 点赞、评论、私信、通知等事件需要实时送达在线用户，同时在线状态要对外可查。
 *
 * 核心实现思路：
 * - 一把读写锁保护 connections / presence / rooms 三个索引。
 * - 每个连接独占出站队列，由共享线程池串行排空，同一连接严格 FIFO。
 * - 锁内只入队，排空调度在释放锁之后进行，慢连接不会拖住注册表。
 * - 出站队列积压超过上限的连接被断开。
 * - 每次扇出同时交给 FanoutBridge 发布，兄弟进程收到后只做本地投递。
 * - 用户第一条连接建立时广播 online，最后一条连接断开时广播 offline，各一次。
 */
@Slf4j
public class NotificationHub {

    /** 单连接出站队列默认上限 */
    public static final int DEFAULT_MAX_PENDING_FRAMES = 1000;

    private final TokenVerifier tokenVerifier;
    private final FanoutBridge bridge;
    private final Executor deliveryExecutor;
    private final Clock clock;
    private final int maxPendingFrames;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** connectionId -> 连接 */
    private final Map<String, HubConnection> connections = new HashMap<>();

    /** userId -> connectionId 集合，非空即在线 */
    private final Map<String, Set<String>> presence = new HashMap<>();

    /** room -> connectionId 集合 */
    private final Map<String, Set<String>> rooms = new HashMap<>();

    public NotificationHub(TokenVerifier tokenVerifier, FanoutBridge bridge, Executor deliveryExecutor, Clock clock) {
        this(tokenVerifier, bridge, deliveryExecutor, clock, DEFAULT_MAX_PENDING_FRAMES);
    }

    public NotificationHub(TokenVerifier tokenVerifier, FanoutBridge bridge, Executor deliveryExecutor, Clock clock,
                           int maxPendingFrames) {
        if (maxPendingFrames < 1) {
            throw new IllegalArgumentException("maxPendingFrames must be positive");
        }
        this.tokenVerifier = tokenVerifier;
        this.bridge = bridge;
        this.deliveryExecutor = deliveryExecutor;
        this.clock = clock;
        this.maxPendingFrames = maxPendingFrames;
        bridge.subscribe(this::deliverFromBridge);
        log.info("推送中心初始化|Notification_hub_init,nodeId={},distributed={},maxPendingFrames={}",
                bridge.nodeId(), bridge.isDistributed(), maxPendingFrames);
    }

    // ===========================
    // 1. 连接生命周期
    // ===========================

    /**
     * 鉴权并注册连接
     *
     * 实现逻辑：
     * 1. 同步校验令牌，失败立即以 1008 关闭连接，不创建任何索引。
     * 2. 校验通过后注册。
     *
     * @param transport 传输连接
     * @param token 令牌
     * @return 注册后的连接；鉴权失败或连接已断开时返回 null
     */
    public HubConnection connect(ConnectionTransport transport, String token) {
        AuthenticatedUser user;
        try {
            user = tokenVerifier.verify(token);
        } catch (HubAuthenticationException e) {
            log.info("推送连接鉴权失败|Hub_auth_fail,connectionId={},reason={}", transport.id(), e.getMessage());
            transport.close(HubEvents.CLOSE_POLICY_VIOLATION, "authentication failed");
            return null;
        }
        return register(transport, user);
    }

    /**
     * 注册已鉴权连接
     *
     * 实现逻辑：
     * 1. 写锁内一次性写入连接表、在线表与个人房间，连接状态 AUTHENTICATED -> JOINED。
     * 2. 写锁内入队 connected 帧，保证它是该连接收到的第一帧；释放锁后再调度发送。
     * 3. 若为该用户第一条连接，广播 online。
     *
     * @param transport 传输连接
     * @param user 鉴权用户
     * @return 注册后的连接；传输层已关闭时返回 null
     */
    public HubConnection register(ConnectionTransport transport, AuthenticatedUser user) {
        Instant now = clock.instant();
        HubConnection connection = new HubConnection(transport, user, now, deliveryExecutor, maxPendingFrames);
        boolean firstConnection;

        lock.writeLock().lock();
        try {
            // 握手期间客户端已断开：不留下任何注册痕迹
            if (!transport.isOpen()) {
                log.debug("握手期间连接已关闭|Hub_closed_during_handshake,connectionId={}", transport.id());
                return null;
            }
            if (connections.containsKey(connection.getId())) {
                return connections.get(connection.getId());
            }
            String userRoom = HubEvents.userRoom(user.getUserId());
            connections.put(connection.getId(), connection);
            Set<String> userConnections = presence.computeIfAbsent(user.getUserId(), k -> new LinkedHashSet<>());
            firstConnection = userConnections.isEmpty();
            userConnections.add(connection.getId());
            rooms.computeIfAbsent(userRoom, k -> new LinkedHashSet<>()).add(connection.getId());
            connection.joinedRoomsForUpdate().add(userRoom);
            connection.setState(ConnectionState.JOINED);

            Map<String, Object> connected = new LinkedHashMap<>();
            connected.put("sid", connection.getId());
            connected.put("user_id", user.getUserId());
            connected.put("timestamp", now.toString());
            connection.offer(frame(HubEvents.CONNECTED, connected));
        } finally {
            lock.writeLock().unlock();
        }
        connection.scheduleDrain();

        log.info("推送连接注册成功|Hub_connection_registered,connectionId={},userId={},first={}",
                connection.getId(), user.getUserId(), firstConnection);
        if (firstConnection) {
            broadcastUserStatus(user.getUserId(), HubEvents.STATUS_ONLINE);
        }
        return connection;
    }

    /**
     * 断开连接
     *
     * 实现逻辑：
     * 1. 写锁内从连接表、所有房间索引、在线表中移除。
     * 2. 若为该用户最后一条连接，广播 offline。
     * 3. 传输层仍打开时主动关闭（登出、服务端踢下线）。
     *
     * @param connectionId 连接 ID
     * @param reason 断开原因，用于日志
     * @return 连接存在并被移除时返回 true；重复断开返回 false
     */
    public boolean disconnect(String connectionId, String reason) {
        HubConnection connection;
        boolean lastConnection = false;

        lock.writeLock().lock();
        try {
            connection = connections.remove(connectionId);
            if (connection == null) {
                return false;
            }
            for (String room : connection.joinedRoomsForUpdate()) {
                removeFromIndex(rooms, room, connectionId);
            }
            connection.joinedRoomsForUpdate().clear();
            Set<String> userConnections = presence.get(connection.getUserId());
            if (userConnections != null) {
                userConnections.remove(connectionId);
                if (userConnections.isEmpty()) {
                    presence.remove(connection.getUserId());
                    lastConnection = true;
                }
            }
            connection.setState(ConnectionState.DISCONNECTED);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("推送连接断开|Hub_connection_removed,connectionId={},userId={},reason={},last={}",
                connectionId, connection.getUserId(), reason, lastConnection);
        if (connection.getTransport().isOpen()) {
            connection.getTransport().close(HubEvents.CLOSE_NORMAL, reason);
        }
        if (lastConnection) {
            broadcastUserStatus(connection.getUserId(), HubEvents.STATUS_OFFLINE);
        }
        return true;
    }

    /**
     * 服务端强制某用户的全部连接下线
     *
     * @return 断开的连接数
     */
    public int disconnectUser(String userId) {
        List<String> ids;
        lock.readLock().lock();
        try {
            Set<String> userConnections = presence.get(userId);
            ids = userConnections == null ? Collections.emptyList() : new ArrayList<>(userConnections);
        } finally {
            lock.readLock().unlock();
        }
        int removed = 0;
        for (String id : ids) {
            if (disconnect(id, "disconnect_user")) {
                removed++;
            }
        }
        return removed;
    }

    // ===========================
    // 2. 房间
    // ===========================

    /**
     * 加入会话房间，幂等
     */
    public boolean joinConversation(String connectionId, String conversationId) {
        String room = HubEvents.conversationRoom(conversationId);
        HubConnection connection;
        lock.writeLock().lock();
        try {
            connection = connections.get(connectionId);
            if (connection == null) {
                return false;
            }
            rooms.computeIfAbsent(room, k -> new LinkedHashSet<>()).add(connectionId);
            connection.joinedRoomsForUpdate().add(room);
        } finally {
            lock.writeLock().unlock();
        }
        deliverDirect(connection, frame(HubEvents.JOINED_CONVERSATION, Collections.singletonMap("conversation_id", conversationId)));
        return true;
    }

    /**
     * 离开会话房间，幂等
     */
    public boolean leaveConversation(String connectionId, String conversationId) {
        String room = HubEvents.conversationRoom(conversationId);
        HubConnection connection;
        lock.writeLock().lock();
        try {
            connection = connections.get(connectionId);
            if (connection == null) {
                return false;
            }
            removeFromIndex(rooms, room, connectionId);
            connection.joinedRoomsForUpdate().remove(room);
        } finally {
            lock.writeLock().unlock();
        }
        deliverDirect(connection, frame(HubEvents.LEFT_CONVERSATION, Collections.singletonMap("conversation_id", conversationId)));
        return true;
    }

    // ===========================
    // 3. 扇出
    // ===========================

    /**
     * 给用户推送通知，用户不在线时静默忽略
     *
     * @return 本进程投递的连接数
     */
    public int sendNotification(String userId, Map<String, Object> payload) {
        return emit(HubEvents.userRoom(userId), HubEvents.NOTIFICATION, withTimestamp(payload), null, true);
    }

    /**
     * 全局广播点赞数变化
     */
    public int broadcastLikeUpdate(String postId, long likeCount, String userId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("post_id", postId);
        data.put("like_count", likeCount);
        data.put("user_id", userId);
        return emit(null, HubEvents.LIKE_UPDATE, withTimestamp(data), null, true);
    }

    /**
     * 全局广播评论数变化
     */
    public int broadcastCommentUpdate(String postId, long commentCount, Map<String, Object> comment) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("post_id", postId);
        data.put("comment_count", commentCount);
        if (comment != null) {
            data.put("comment", comment);
        }
        return emit(null, HubEvents.COMMENT_UPDATE, withTimestamp(data), null, true);
    }

    /**
     * 推送会话消息
     */
    public int sendMessage(String conversationId, Map<String, Object> payload) {
        return emit(HubEvents.conversationRoom(conversationId), HubEvents.NEW_MESSAGE, withTimestamp(payload), null, true);
    }

    /**
     * 输入状态，推送给房间内除发送者外的所有连接
     */
    public int typing(String connectionId, String conversationId, boolean isTyping) {
        HubConnection sender = getConnection(connectionId);
        if (sender == null) {
            return 0;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_id", sender.getUserId());
        data.put("user_name", sender.getUserName());
        data.put("is_typing", isTyping);
        data.put("conversation_id", conversationId);
        return emit(HubEvents.conversationRoom(conversationId), HubEvents.TYPING, data, connectionId, true);
    }

    /**
     * 心跳
     */
    public boolean ping(String connectionId) {
        HubConnection connection = getConnection(connectionId);
        if (connection == null) {
            return false;
        }
        deliverDirect(connection, frame(HubEvents.PONG, Collections.singletonMap("timestamp", clock.instant().toString())));
        return true;
    }

    /**
     * 客户端事件分发
     *
     * @param connectionId 连接 ID
     * @param event 事件名
     * @param data 事件数据，可为空
     */
    public void dispatch(String connectionId, String event, Map<String, Object> data) {
        Map<String, Object> body = data == null ? Collections.emptyMap() : data;
        String eventName = event == null ? "" : event;
        switch (eventName) {
            case HubEvents.PING:
                ping(connectionId);
                break;
            case HubEvents.JOIN_CONVERSATION:
                if (requireField(connectionId, eventName, body, "conversation_id")) {
                    joinConversation(connectionId, String.valueOf(body.get("conversation_id")));
                }
                break;
            case HubEvents.LEAVE_CONVERSATION:
                if (requireField(connectionId, eventName, body, "conversation_id")) {
                    leaveConversation(connectionId, String.valueOf(body.get("conversation_id")));
                }
                break;
            case HubEvents.TYPING:
                if (requireField(connectionId, eventName, body, "conversation_id")) {
                    typing(connectionId, String.valueOf(body.get("conversation_id")), Boolean.TRUE.equals(body.get("is_typing")));
                }
                break;
            case HubEvents.LOGOUT:
                disconnect(connectionId, "logout");
                break;
            default:
                sendError(connectionId, "unknown event: " + eventName);
        }
    }

    /**
     * 投递兄弟进程转发的信封，只做本地投递，不再发布
     */
    public int deliverFromBridge(HubEnvelope envelope) {
        if (envelope == null || bridge.nodeId().equals(envelope.getOrigin())) {
            return 0;
        }
        return emit(envelope.getRoom(), envelope.getEvent(), envelope.getData(), envelope.getExcludeConnectionId(), false);
    }

    // ===========================
    // 4. 查询
    // ===========================

    public List<String> getOnlineUsers() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(presence.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isUserOnline(String userId) {
        lock.readLock().lock();
        try {
            return presence.containsKey(userId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getConnectionCount() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public HubConnection getConnection(String connectionId) {
        lock.readLock().lock();
        try {
            return connections.get(connectionId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isDistributed() {
        return bridge.isDistributed();
    }

    /**
     * 关闭全部连接
     */
    public void shutdown() {
        List<String> ids;
        lock.readLock().lock();
        try {
            ids = new ArrayList<>(connections.keySet());
        } finally {
            lock.readLock().unlock();
        }
        for (String id : ids) {
            disconnect(id, "server_shutdown");
        }
        log.info("推送中心已关闭|Notification_hub_shutdown,closed={}", ids.size());
    }

    // ===========================
    // 5. 内部实现
    // ===========================

    /**
     * 扇出
     *
     * 实现逻辑：
     * 1. 读锁内取房间快照（room 为 null 表示全部连接）并入队，入队与索引变更互斥。
     * 2. 释放读锁后调度各连接的排空任务，队列已满的连接被断开。
     * 3. 需要时交给桥接发布。
     *
     * @return 本进程投递的连接数
     */
    private int emit(String room, String event, Map<String, Object> data, String excludeConnectionId, boolean publish) {
        String frame = frame(event, data);
        List<HubConnection> accepted = new ArrayList<>();
        List<HubConnection> overflowed = new ArrayList<>();

        lock.readLock().lock();
        try {
            Iterable<String> targets = room == null ? connections.keySet() : rooms.getOrDefault(room, Collections.emptySet());
            for (String id : targets) {
                if (id.equals(excludeConnectionId)) {
                    continue;
                }
                HubConnection connection = connections.get(id);
                if (connection == null) {
                    continue;
                }
                if (connection.offer(frame)) {
                    accepted.add(connection);
                } else {
                    overflowed.add(connection);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        for (HubConnection connection : accepted) {
            connection.scheduleDrain();
        }
        for (HubConnection connection : overflowed) {
            disconnectOverflowed(connection);
        }
        int delivered = accepted.size();

        if (publish) {
            bridge.publish(new HubEnvelope(bridge.nodeId(), room, event, data, excludeConnectionId));
        }
        log.debug("推送扇出|Hub_emit,event={},room={},delivered={}", event, room, delivered);
        return delivered;
    }

    private void broadcastUserStatus(String userId, String status) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_id", userId);
        data.put("status", status);
        data.put("timestamp", clock.instant().toString());
        emit(null, HubEvents.USER_STATUS, data, null, true);
    }

    private Map<String, Object> withTimestamp(Map<String, Object> payload) {
        Map<String, Object> data = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
        data.putIfAbsent("timestamp", clock.instant().toString());
        return data;
    }

    private boolean requireField(String connectionId, String event, Map<String, Object> body, String field) {
        if (body.get(field) == null) {
            sendError(connectionId, event + " requires " + field);
            return false;
        }
        return true;
    }

    private void sendError(String connectionId, String message) {
        HubConnection connection = getConnection(connectionId);
        if (connection != null) {
            deliverDirect(connection, frame(HubEvents.ERROR, Collections.singletonMap("message", message)));
        }
    }

    /**
     * 单连接投递，调用时不得持有锁
     */
    private void deliverDirect(HubConnection connection, String frame) {
        if (!connection.enqueue(frame)) {
            disconnectOverflowed(connection);
        }
    }

    private void disconnectOverflowed(HubConnection connection) {
        log.warn("推送出站队列积压超限_断开连接|Hub_outbound_overflow,connectionId={},userId={},pending={}",
                connection.getId(), connection.getUserId(), connection.getPendingFrames());
        if (connection.getTransport().isOpen()) {
            connection.getTransport().close(HubEvents.CLOSE_TRY_AGAIN_LATER, "outbound queue overflow");
        }
        disconnect(connection.getId(), "outbound_overflow");
    }

    private static void removeFromIndex(Map<String, Set<String>> index, String key, String connectionId) {
        Set<String> members = index.get(key);
        if (members != null) {
            members.remove(connectionId);
            if (members.isEmpty()) {
                index.remove(key);
            }
        }
    }

    static String frame(String event, Object data) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("event", event);
        frame.put("data", data);
        return JsonUtil.toJson(frame);
    }
}
