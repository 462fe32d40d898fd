package com.hao.feedhub.realtime;

import com.hao.feedhub.config.NotificationHubConfig;
import com.hao.feedhub.realtime.auth.HubAuthenticationException;
import com.hao.feedhub.realtime.auth.TokenVerifier;
import com.hao.feedhub.support.MutableClock;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 推送中心测试
 *
 * 测试目的：
 * 1. 在线状态：第一条连接广播 online，最后一条连接断开广播 offline，各一次。
 * 2. 鉴权失败的连接以 1008 关闭，不留下任何注册。
 * 3. 房间扇出、排除发送者、离线用户静默忽略。
 * 4. 桥接信封：自己发布的忽略，兄弟进程的只做本地投递。
 *
 * 设计思路：
 * - 投递线程池使用 Runnable::run 同步执行，帧在调用返回时已写入 FakeTransport。
 * - 令牌校验器以 "token-{userId}" 约定模拟，"expired" 抛出鉴权异常。
 */
@Slf4j
public class NotificationHubTest {

    private RecordingBridge bridge;
    private NotificationHub hub;

    @BeforeEach
    void setUp() {
        TokenVerifier verifier = token -> {
            if (token == null || !token.startsWith("token-")) {
                throw new HubAuthenticationException("token expired");
            }
            String userId = token.substring("token-".length());
            return new AuthenticatedUser(userId, "user" + userId);
        };
        bridge = new RecordingBridge("node-a");
        hub = new NotificationHub(verifier, bridge, Runnable::run, new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
    }

    @Test
    @DisplayName("连接成功_首帧为 connected")
    void testConnect_ConnectedFrameFirst() {
        FakeTransport transport = new FakeTransport("c1");
        HubConnection connection = hub.connect(transport, "token-42");

        assertNotNull(connection);
        assertEquals(ConnectionState.JOINED, connection.getState());
        assertEquals(HubEvents.CONNECTED, transport.events().get(0));
        Map<String, Object> data = transport.lastData(HubEvents.CONNECTED);
        assertEquals("c1", data.get("sid"));
        assertEquals("42", data.get("user_id"));
        assertTrue(connection.getJoinedRooms().contains("user_42"));
        assertTrue(hub.isUserOnline("42"));
    }

    @Test
    @DisplayName("令牌过期_1008 关闭且不注册")
    void testConnect_ExpiredToken() {
        FakeTransport transport = new FakeTransport("c1");

        assertNull(hub.connect(transport, "expired"));
        assertEquals(HubEvents.CLOSE_POLICY_VIOLATION, transport.getCloseCode());
        assertEquals(0, hub.getConnectionCount());
        assertFalse(hub.isUserOnline("expired"));
        assertTrue(transport.events().isEmpty());
        assertTrue(bridge.getPublished().isEmpty());
    }

    @Test
    @DisplayName("握手期间已断开_不留下注册")
    void testRegister_ClosedDuringHandshake() {
        FakeTransport transport = new FakeTransport("c1");
        transport.markClosed();

        assertNull(hub.register(transport, new AuthenticatedUser("42", "u")));
        assertEquals(0, hub.getConnectionCount());
        assertFalse(hub.isUserOnline("42"));
    }

    @Test
    @DisplayName("在线状态只在首末连接时翻转")
    void testPresence_FlipsOnce() {
        FakeTransport observer = new FakeTransport("obs");
        hub.connect(observer, "token-1");
        observer.clear();

        FakeTransport first = new FakeTransport("c1");
        FakeTransport second = new FakeTransport("c2");
        hub.connect(first, "token-42");
        hub.connect(second, "token-42");
        assertEquals(1, statusEvents(observer, "online"));

        assertTrue(hub.disconnect("c1", "closed"));
        assertTrue(hub.isUserOnline("42"));
        assertEquals(0, statusEvents(observer, "offline"));

        assertTrue(hub.disconnect("c2", "closed"));
        assertFalse(hub.isUserOnline("42"));
        assertEquals(1, statusEvents(observer, "offline"));

        assertFalse(hub.disconnect("c2", "closed"), "重复断开返回 false");
        assertEquals(1, statusEvents(observer, "offline"));
        assertEquals(List.of("1"), hub.getOnlineUsers());
    }

    @Test
    @DisplayName("给离线用户发通知_静默忽略")
    void testSendNotification_OfflineUser() {
        hub.connect(new FakeTransport("c1"), "token-1");

        assertEquals(0, hub.sendNotification("999", Map.of("type", "comment")));
    }

    @Test
    @DisplayName("通知送达用户的所有连接")
    void testSendNotification_AllUserConnections() {
        FakeTransport phone = new FakeTransport("phone");
        FakeTransport laptop = new FakeTransport("laptop");
        FakeTransport other = new FakeTransport("other");
        hub.connect(phone, "token-42");
        hub.connect(laptop, "token-42");
        hub.connect(other, "token-7");

        assertEquals(2, hub.sendNotification("42", Map.of("type", "comment", "post_id", 9)));
        assertEquals("comment", phone.lastData(HubEvents.NOTIFICATION).get("type"));
        assertNotNull(laptop.lastData(HubEvents.NOTIFICATION).get("timestamp"));
        assertNull(other.lastData(HubEvents.NOTIFICATION));
    }

    @Test
    @DisplayName("输入状态不回送给发送者")
    void testTyping_ExcludesSender() {
        FakeTransport alice = new FakeTransport("alice");
        FakeTransport bob = new FakeTransport("bob");
        hub.connect(alice, "token-1");
        hub.connect(bob, "token-2");
        hub.joinConversation("alice", "c9");
        hub.joinConversation("bob", "c9");

        assertEquals(1, hub.typing("alice", "c9", true));
        Map<String, Object> typing = bob.lastData(HubEvents.TYPING);
        assertEquals("1", typing.get("user_id"));
        assertEquals(true, typing.get("is_typing"));
        assertNull(alice.lastData(HubEvents.TYPING));

        HubEnvelope envelope = bridge.getPublished().get(bridge.getPublished().size() - 1);
        assertEquals("alice", envelope.getExcludeConnectionId());
        assertEquals("conversation_c9", envelope.getRoom());
    }

    @Test
    @DisplayName("加入/离开会话幂等")
    void testJoinLeave_Idempotent() {
        FakeTransport transport = new FakeTransport("c1");
        hub.connect(transport, "token-1");

        assertTrue(hub.joinConversation("c1", "c9"));
        assertTrue(hub.joinConversation("c1", "c9"));
        assertEquals(1, hub.sendMessage("c9", Map.of("text", "hi")));

        assertTrue(hub.leaveConversation("c1", "c9"));
        assertTrue(hub.leaveConversation("c1", "c9"));
        assertEquals(0, hub.sendMessage("c9", Map.of("text", "hi")));
        assertFalse(hub.joinConversation("unknown", "c9"));
    }

    @Test
    @DisplayName("断开后从所有房间移除")
    void testDisconnect_RemovesRooms() {
        FakeTransport transport = new FakeTransport("c1");
        HubConnection connection = hub.connect(transport, "token-1");
        hub.joinConversation("c1", "c9");

        hub.disconnect("c1", "logout");

        assertEquals(ConnectionState.DISCONNECTED, connection.getState());
        assertTrue(connection.getJoinedRooms().isEmpty());
        assertEquals(0, hub.sendMessage("c9", Map.of("text", "hi")));
        assertEquals(HubEvents.CLOSE_NORMAL, transport.getCloseCode());
    }

    @Test
    @DisplayName("桥接信封_自己发布的忽略")
    void testDeliverFromBridge_OwnOrigin() {
        FakeTransport transport = new FakeTransport("c1");
        hub.connect(transport, "token-1");
        transport.clear();

        bridge.receive(new HubEnvelope("node-a", null, HubEvents.LIKE_UPDATE, Map.of("post_id", "5"), null));

        assertTrue(transport.events().isEmpty());
    }

    @Test
    @DisplayName("桥接信封_兄弟进程的只做本地投递")
    void testDeliverFromBridge_OtherOrigin() {
        FakeTransport transport = new FakeTransport("c1");
        hub.connect(transport, "token-1");
        int publishedBefore = bridge.getPublished().size();

        bridge.receive(new HubEnvelope("node-b", "user_1", HubEvents.NOTIFICATION, Map.of("type", "like"), null));

        assertEquals("like", transport.lastData(HubEvents.NOTIFICATION).get("type"));
        assertEquals(publishedBefore, bridge.getPublished().size(), "不应再次发布");
    }

    @Test
    @DisplayName("点赞广播同时发布到桥接")
    void testBroadcastLikeUpdate() {
        FakeTransport a = new FakeTransport("a");
        FakeTransport b = new FakeTransport("b");
        hub.connect(a, "token-1");
        hub.connect(b, "token-2");

        assertEquals(2, hub.broadcastLikeUpdate("5", 11, "1"));
        assertEquals(11, ((Number) b.lastData(HubEvents.LIKE_UPDATE).get("like_count")).intValue());
        HubEnvelope envelope = bridge.getPublished().get(bridge.getPublished().size() - 1);
        assertEquals("node-a", envelope.getOrigin());
        assertNull(envelope.getRoom());
    }

    @Test
    @DisplayName("客户端事件分发")
    void testDispatch() {
        FakeTransport transport = new FakeTransport("c1");
        hub.connect(transport, "token-1");

        hub.dispatch("c1", "ping", null);
        assertEquals("2024-05-01T10:00:00Z", transport.lastData(HubEvents.PONG).get("timestamp"));

        hub.dispatch("c1", "join_conversation", Map.of());
        assertEquals("join_conversation requires conversation_id", transport.lastData(HubEvents.ERROR).get("message"));

        hub.dispatch("c1", "join_conversation", Map.of("conversation_id", 77));
        assertEquals("77", transport.lastData(HubEvents.JOINED_CONVERSATION).get("conversation_id"));

        hub.dispatch("c1", "dance", Map.of());
        assertEquals("unknown event: dance", transport.lastData(HubEvents.ERROR).get("message"));

        hub.dispatch("c1", "logout", null);
        assertEquals(0, hub.getConnectionCount());
        assertEquals(HubEvents.CLOSE_NORMAL, transport.getCloseCode());
    }

    @Test
    @DisplayName("强制下线与关闭")
    void testDisconnectUserAndShutdown() {
        hub.connect(new FakeTransport("a"), "token-1");
        hub.connect(new FakeTransport("b"), "token-1");
        hub.connect(new FakeTransport("c"), "token-2");

        assertEquals(2, hub.disconnectUser("1"));
        assertEquals(0, hub.disconnectUser("1"));
        assertEquals(1, hub.getConnectionCount());

        hub.shutdown();
        assertEquals(0, hub.getConnectionCount());
    }

    @Test
    @DisplayName("并发推送_同一连接保持 FIFO")
    void testEmit_PerConnectionFifo() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        NotificationHub asyncHub = new NotificationHub(token -> new AuthenticatedUser("1", "u"),
                new RecordingBridge("node-x"), pool, new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
        FakeTransport transport = new FakeTransport("c1");
        asyncHub.connect(transport, "any");

        for (int i = 0; i < 200; i++) {
            asyncHub.sendNotification("1", Map.of("seq", i));
        }
        // connected + user_status(online) + 200 条通知
        long deadline = System.currentTimeMillis() + 5000;
        while (transport.frames().size() < 202 && System.currentTimeMillis() < deadline) {
            TimeUnit.MILLISECONDS.sleep(10);
        }
        pool.shutdown();

        List<Map<String, Object>> frames = transport.frames();
        assertEquals(HubEvents.CONNECTED, frames.get(0).get("event"));
        List<Integer> seqs = frames.stream()
                .filter(f -> HubEvents.NOTIFICATION.equals(f.get("event")))
                .map(f -> ((Number) ((Map<?, ?>) f.get("data")).get("seq")).intValue())
                .collect(Collectors.toList());
        log.info("收到通知数|Notifications_received,count={}", seqs.size());
        assertEquals(200, seqs.size());
        for (int i = 0; i < seqs.size(); i++) {
            assertEquals(i, seqs.get(i));
        }
    }

    @Test
    @DisplayName("慢连接阻塞发送_推送线程池打满时其他连接照常注册")
    void testSlowConnection_DoesNotBlockHub() throws Exception {
        ThreadPoolTaskExecutor executor = new NotificationHubConfig().hubDeliveryExecutor(1, 1);
        CountDownLatch release = new CountDownLatch(1);
        NotificationHub slowHub = new NotificationHub(token -> new AuthenticatedUser(token, "u" + token),
                new RecordingBridge("node-s"), executor, new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
        try {
            // a 占住唯一线程，b 占满队列，c 与 d 的排空任务被拒绝
            CompletableFuture<HubConnection> registered = CompletableFuture.supplyAsync(() -> {
                slowHub.connect(new BlockingTransport("a", release), "1");
                slowHub.connect(new BlockingTransport("b", release), "2");
                slowHub.connect(new BlockingTransport("c", release), "3");
                return slowHub.connect(new FakeTransport("d"), "4");
            });

            assertNotNull(registered.get(3, TimeUnit.SECONDS));
            assertEquals(4, slowHub.getConnectionCount());
            assertTrue(slowHub.isUserOnline("3"));
            assertEquals(4, slowHub.getOnlineUsers().size());
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("线程池拒绝排空任务_帧保留并在下次推送时补发")
    void testRejectedDrain_RetriedOnNextFrame() {
        AtomicBoolean rejecting = new AtomicBoolean(true);
        Executor flaky = task -> {
            if (rejecting.get()) {
                throw new RejectedExecutionException("queue full");
            }
            task.run();
        };
        NotificationHub flakyHub = new NotificationHub(token -> new AuthenticatedUser("1", "u"),
                new RecordingBridge("node-f"), flaky, new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
        FakeTransport transport = new FakeTransport("c1");

        HubConnection connection = flakyHub.connect(transport, "any");
        assertNotNull(connection);
        assertTrue(transport.events().isEmpty());
        assertEquals(2, connection.getPendingFrames());

        rejecting.set(false);
        flakyHub.sendNotification("1", Map.of("seq", 1));

        assertEquals(List.of(HubEvents.CONNECTED, HubEvents.USER_STATUS, HubEvents.NOTIFICATION), transport.events());
        assertEquals(0, connection.getPendingFrames());
    }

    @Test
    @DisplayName("出站队列积压超限_断开该连接并以 1013 关闭")
    void testOutboundOverflow_Disconnects() {
        List<Runnable> parked = new ArrayList<>();
        NotificationHub cappedHub = new NotificationHub(token -> new AuthenticatedUser(token, "u" + token),
                new RecordingBridge("node-c"), parked::add, new MutableClock(Instant.parse("2024-05-01T10:00:00Z")), 3);
        FakeTransport stalled = new FakeTransport("c1");
        cappedHub.connect(stalled, "1");

        // connected + user_status 已占 2 个位置
        assertEquals(1, cappedHub.sendNotification("1", Map.of("seq", 0)));
        assertEquals(0, cappedHub.sendNotification("1", Map.of("seq", 1)));

        assertEquals(HubEvents.CLOSE_TRY_AGAIN_LATER, stalled.getCloseCode());
        assertEquals(0, cappedHub.getConnectionCount());
        assertFalse(cappedHub.isUserOnline("1"));
    }

    @Test
    @DisplayName("已加入房间返回快照_后续加入不影响已取得的集合")
    void testJoinedRooms_Snapshot() {
        FakeTransport transport = new FakeTransport("c1");
        HubConnection connection = hub.connect(transport, "token-5");
        Set<String> before = connection.getJoinedRooms();

        hub.joinConversation("c1", "9");

        assertEquals(Set.of("user_5"), before);
        assertEquals(Set.of("user_5", "conversation_9"), connection.getJoinedRooms());
    }

    /**
     * send 阻塞直到放行的传输层，模拟不读数据的客户端
     */
    private static class BlockingTransport extends FakeTransport {

        private final CountDownLatch release;

        BlockingTransport(String id, CountDownLatch release) {
            super(id);
            this.release = release;
        }

        @Override
        public void send(String frame) {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            super.send(frame);
        }
    }

    private static long statusEvents(FakeTransport transport, String status) {
        return transport.frames().stream()
                .filter(f -> HubEvents.USER_STATUS.equals(f.get("event")))
                .filter(f -> status.equals(((Map<?, ?>) f.get("data")).get("status")))
                .count();
    }
}
