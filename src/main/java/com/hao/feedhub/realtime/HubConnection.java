package com.hao.feedhub.realtime;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 推送连接
 *
 * 类职责：
 * 记录一个已鉴权连接的用户、状态与已加入房间，并持有该连接独占的出站队列。
 *
 * 核心实现思路：
 * - 出站帧先入队，再由共享线程池串行排空：同一连接严格按入队顺序发送，且不会出现并发写同一 socket。
 * - draining 标志保证同一时刻最多一个排空任务；排空结束后复查队列，避免丢帧。
 * - 入队（offer）与调度排空（scheduleDrain）分开：前者可在推送中心的锁内调用，后者必须在锁外调用，
 *   发送永远不会发生在持有推送中心锁的线程上。
 * - 出站队列有上限，超过上限说明客户端长时间不读，由推送中心断开该连接。
 * - joinedRooms 只在 NotificationHub 的写锁内修改。
 */
@Slf4j
public class HubConnection {

    private final String id;
    private final AuthenticatedUser user;
    private final Instant authenticatedAt;
    private final ConnectionTransport transport;
    private final Executor deliveryExecutor;
    private final int maxPendingFrames;

    private final Set<String> joinedRooms = new CopyOnWriteArraySet<>();
    private final Queue<String> outbound = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    private volatile ConnectionState state = ConnectionState.AUTHENTICATED;

    HubConnection(ConnectionTransport transport, AuthenticatedUser user, Instant authenticatedAt,
                  Executor deliveryExecutor, int maxPendingFrames) {
        this.id = transport.id();
        this.transport = transport;
        this.user = user;
        this.authenticatedAt = authenticatedAt;
        this.deliveryExecutor = deliveryExecutor;
        this.maxPendingFrames = maxPendingFrames;
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return user.getUserId();
    }

    public String getUserName() {
        return user.getUserName();
    }

    public Instant getAuthenticatedAt() {
        return authenticatedAt;
    }

    public ConnectionState getState() {
        return state;
    }

    void setState(ConnectionState state) {
        this.state = state;
    }

    ConnectionTransport getTransport() {
        return transport;
    }

    /**
     * 已加入房间的只读快照，调用方可在任意线程遍历
     */
    public Set<String> getJoinedRooms() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(joinedRooms));
    }

    public int getPendingFrames() {
        return pending.get();
    }

    Set<String> joinedRoomsForUpdate() {
        return joinedRooms;
    }

    /**
     * 出站帧入队并触发排空，只能在不持有推送中心锁时调用
     *
     * @return 队列已满时返回 false，帧未入队
     */
    boolean enqueue(String frame) {
        if (!offer(frame)) {
            return false;
        }
        scheduleDrain();
        return true;
    }

    /**
     * 出站帧入队，不触发排空
     *
     * @return 连接已断开时返回 true 并丢弃该帧；队列已满时返回 false
     */
    boolean offer(String frame) {
        if (state == ConnectionState.DISCONNECTED) {
            return true;
        }
        if (pending.incrementAndGet() > maxPendingFrames) {
            pending.decrementAndGet();
            return false;
        }
        outbound.offer(frame);
        return true;
    }

    /**
     * 调度排空任务；线程池拒绝时帧保留在队列中，下一次调度重试
     */
    void scheduleDrain() {
        if (outbound.isEmpty() || !draining.compareAndSet(false, true)) {
            return;
        }
        try {
            deliveryExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("推送线程池拒绝任务|Hub_delivery_rejected,connectionId={},pending={}", id, pending.get());
        }
    }

    private void drain() {
        try {
            String frame;
            while ((frame = outbound.poll()) != null) {
                pending.decrementAndGet();
                if (!transport.isOpen()) {
                    discardPending();
                    return;
                }
                transport.send(frame);
            }
        } catch (IOException e) {
            // 写失败的连接由传输层关闭回调触发 disconnect
            log.warn("推送帧发送失败|Hub_frame_send_fail,connectionId={},error={}", id, e.getMessage());
            discardPending();
        } finally {
            draining.set(false);
        }
        // 排空期间新入队的帧
        if (!outbound.isEmpty() && state != ConnectionState.DISCONNECTED) {
            scheduleDrain();
        }
    }

    private void discardPending() {
        while (outbound.poll() != null) {
            pending.decrementAndGet();
        }
    }
}
