package com.deepansh.memory;

import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.llm.LlmProviderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
@EnableConfigurationProperties({MemoryProperties.class, LlmProviderProperties.class})
public class MemoryEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(MemoryEngineApplication.class, args);
    }
}
