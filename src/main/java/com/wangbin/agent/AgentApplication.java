package com.wangbin.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentApplication {

    public static void main(String[] args) {
        try {
            SpringApplication.run(AgentApplication.class, args);
        } catch (Exception e) {
            System.err.println("=== 启动失败: " + e.getMessage() + " ===");
            System.exit(1);
        }
    }
}
