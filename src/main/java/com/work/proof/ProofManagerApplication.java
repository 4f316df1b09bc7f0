package com.work.proof;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口，运行后即可通过 REST 接口驱动证明请求的完整生命周期。
 */
@SpringBootApplication
public class ProofManagerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProofManagerApplication.class, args);
    }
}
