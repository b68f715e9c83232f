package com.agentrelay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 会话池配置属性，配置前缀为 session.pool。
 *
 * @author agentrelay
 * @since 2026-10-19
 */
@Data
@ConfigurationProperties(prefix = "session.pool", ignoreInvalidFields = true)
public class SessionPoolProperties {

    /** 空闲会话目标数量，默认3 */
    private Integer targetSize = 3;

    /** 空闲淘汰阈值（毫秒），默认25分钟 */
    private Long idleTimeoutMs = 25L * 60L * 1000L;

    /** 启动后首次预热的延迟（毫秒），默认2秒 */
    private Long prewarmDelayMs = 2000L;

    /** 维护任务周期（毫秒），默认5分钟 */
    private Long cleanupIntervalMs = 5L * 60L * 1000L;

    /** 状态日志周期（毫秒），默认1分钟 */
    private Long keepaliveIntervalMs = 60L * 1000L;

    /** 会话总数上限，0 表示不限制 */
    private Integer maxSize = 0;

}
