package com.rummikub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 拉密规则引擎服务主入口
 */
@SpringBootApplication
public class RummikubApplication {
    public static void main(String[] args) {
        SpringApplication.run(RummikubApplication.class, args);
    }
}
