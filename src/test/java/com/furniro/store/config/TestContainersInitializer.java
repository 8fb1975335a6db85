package com.furniro.store.config;

import org.springframework.boot.test.util.TestPropertyValues;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.lifecycle.Startables;

/**
 * TestContainers MySQL 컨테이너를 시작하고 연결 정보를 Spring 환경에 주입합니다.
 *
 * 컨테이너는 JVM당 한 번만 시작되며 모든 통합 테스트가 공유합니다.
 */
public class TestContainersInitializer implements ApplicationContextInitializer<ConfigurableApplicationContext> {

    private static final MySQLContainer<?> MYSQL_CONTAINER = new MySQLContainer<>("mysql:8.0.35")
            .withDatabaseName("furniro_test")
            .withUsername("root")
            .withPassword("root")
            .withCommand(
                "--character-set-server=utf8mb4",
                "--collation-server=utf8mb4_unicode_ci",
                "--default-storage-engine=InnoDB"
            );

    @Override
    public void initialize(ConfigurableApplicationContext applicationContext) {
        if (!MYSQL_CONTAINER.isRunning()) {
            Startables.deepStart(MYSQL_CONTAINER).join();
        }

        TestPropertyValues.of(
                "spring.datasource.url=" + MYSQL_CONTAINER.getJdbcUrl(),
                "spring.datasource.username=" + MYSQL_CONTAINER.getUsername(),
                "spring.datasource.password=" + MYSQL_CONTAINER.getPassword(),
                "spring.datasource.driver-class-name=" + MYSQL_CONTAINER.getDriverClassName(),
                "spring.jpa.hibernate.ddl-auto=create-drop"
        ).applyTo(applicationContext.getEnvironment());
    }
}
