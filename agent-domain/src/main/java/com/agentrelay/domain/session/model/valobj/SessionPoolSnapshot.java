package com.agentrelay.domain.session.model.valobj;

/**
 * 会话池某一时刻的统计。
 *
 * @param size 条目总数
 * @param available 空闲条目数
 * @param inUse 被请求持有的条目数
 * @param pending 正在创建的条目数
 */
public record SessionPoolSnapshot(int size, int available, int inUse, int pending) {
}
