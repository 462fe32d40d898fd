package com.hao.feedhub.realtime;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 跨进程推送信封
 *
 * room 为 null 表示全局广播；excludeConnectionId 用于“除发送者外”的房间推送。
 * origin 为发布节点 ID，订阅方忽略自己发布的信封。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HubEnvelope {

    private String origin;

    private String room;

    private String event;

    private Map<String, Object> data;

    private String excludeConnectionId;
}
