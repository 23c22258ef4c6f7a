package com.abandonflow.analyzer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    /** 时间戳合理性窗口以此时钟的“当前时间”为基准，测试中可替换为固定时钟 */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
