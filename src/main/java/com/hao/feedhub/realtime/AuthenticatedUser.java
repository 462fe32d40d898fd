package com.hao.feedhub.realtime;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 鉴权通过的连接用户
 */
@Getter
@ToString
@AllArgsConstructor
public class AuthenticatedUser {

    private final String userId;

    private final String userName;
}
