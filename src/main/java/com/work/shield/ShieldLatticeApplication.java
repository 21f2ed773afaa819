package com.work.shield;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口，运行后即可通过 REST 接口提交证明任务或运行拓扑。
 */
@SpringBootApplication
@EnableScheduling
public class ShieldLatticeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShieldLatticeApplication.class, args);
    }
}
