package com.acme.delivery.processor.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Getter;
import lombok.Setter;

/** Connection pool settings bound from {@code datasources.default.*}. */
@Getter
@Setter
@ConfigurationProperties("datasources.default")
public class DataSourceProperties {
  private String url = "jdbc:h2:mem:delivery;DB_CLOSE_DELAY=-1";
  private String username = "sa";
  private String password = "";
  private int maximumPoolSize = 10;
  private int minimumIdle = 1;
  private long connectionTimeoutMillis = 30_000;
}
