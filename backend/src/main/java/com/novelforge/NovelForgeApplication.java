package com.novelforge;

import org.mybatis.spring.annotation.MapperScan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 长篇小说记忆与一致性服务主应用类
 *
 * @author NovelForge
 * @version 1.0.0
 */
@SpringBootApplication
@MapperScan("com.novelforge.repository")
@EnableAsync
@EnableScheduling
public class NovelForgeApplication {

    private static final Logger logger = LoggerFactory.getLogger(NovelForgeApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(NovelForgeApplication.class, args);
        logger.info("🚀 NovelForge记忆服务启动成功");
        logger.info("📚 访问地址: http://localhost:8080/api");
    }
}
