/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.autoconfigure;

import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.jooq.SQLDialect;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties("pipelens.storage.jdbc")
public class PipelensJdbcStorageProperties {
  private String url = "jdbc:sqlite:pipelens.db";
  private String username;
  private String password;
  private int maxActive = 10;

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  public String getUsername() {
    return username;
  }

  public void setUsername(String username) {
    this.username = "".equals(username) ? null : username;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = "".equals(password) ? null : password;
  }

  public int getMaxActive() {
    return maxActive;
  }

  public void setMaxActive(int maxActive) {
    this.maxActive = maxActive;
  }

  /** Picks the SQL dialect from the JDBC URL's subprotocol. */
  public SQLDialect dialect() {
    if (url.startsWith("jdbc:postgresql:")) return SQLDialect.POSTGRES;
    if (url.startsWith("jdbc:mysql:") || url.startsWith("jdbc:mariadb:")) return SQLDialect.MYSQL;
    if (url.startsWith("jdbc:sqlite:")) return SQLDialect.SQLITE;
    throw new IllegalArgumentException("unsupported pipelens.storage.jdbc.url: " + url);
  }

  public DataSource toDataSource() {
    HikariDataSource result = new HikariDataSource();
    result.setJdbcUrl(url);
    result.setMaximumPoolSize(maxActive);
    result.setUsername(username);
    result.setPassword(password);
    result.setPoolName("pipelens-jdbc");
    return result;
  }
}
