package com.furniro.store;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Furniro 스토어 애플리케이션 메인 클래스
 */
@SpringBootApplication
public class FurniroStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(FurniroStoreApplication.class, args);
    }

}
