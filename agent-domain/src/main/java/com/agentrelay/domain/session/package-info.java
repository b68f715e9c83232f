/**
 * Session 领域 - Agent 会话池
 *
 * <p>职责：管理昂贵、有状态的 Agent 会话句柄在并发请求间的复用</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>句柄：与 Agent 运行时中一个会话的长连接，会话上下文保存在句柄内</li>
 *   <li>会话池：按 key 索引的句柄集合，空闲句柄可被任意请求借用</li>
 *   <li>重新索引：收到运行时下发的权威会话 ID 后，将条目从占位 key 移到权威 key</li>
 * </ul>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>{@link com.agentrelay.domain.session.model.entity.PooledSessionEntity}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>{@link com.agentrelay.domain.session.service.AgentSessionPool} - 借用、归还、重新索引、空闲淘汰、补足容量</li>
 * </ul>
 */
package com.agentrelay.domain.session;
