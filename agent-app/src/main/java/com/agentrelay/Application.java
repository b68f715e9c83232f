package com.agentrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Agent 会话中继服务启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到各子模块中的组件。
 * </p>
 *
 * @author agentrelay
 * @since 2026-10-19
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
