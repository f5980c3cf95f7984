package com.marketfeed.testsupport.containers;

import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@Testcontainers(disabledWithoutDocker = true)
public abstract class RedisContainerBaseIT {
  private static final int REDIS_PORT = 6379;

  @Container
  @ServiceConnection(name = "redis")
  protected static final GenericContainer<?> redis =
      new GenericContainer<>(DockerImageName.parse("redis:7.4-alpine")).withExposedPorts(REDIS_PORT);

  protected static String redisHost() {
    return redis.getHost();
  }

  protected static int redisPort() {
    return redis.getMappedPort(REDIS_PORT);
  }
}
