/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.adventureworks.etl.warehouse;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection and load settings for the target warehouse.
 *
 * <p>YAML configuration example:
 * <pre>{@code
 * warehouse:
 *   engine: redshift
 *   host: analytics.abc123.us-east-1.redshift.amazonaws.com
 *   port: 5439
 *   database: adventureworks
 *   user: etl_loader
 *   iamRole: arn:aws:iam::123456789012:role/RedshiftCopy
 * }</pre>
 *
 * <p>When no password is configured, the {@code WAREHOUSE_PASSWORD}
 * environment variable is used.
 */
public class WarehouseConfig {

  /** Environment variable consulted when no password is configured. */
  public static final String PASSWORD_ENV = "WAREHOUSE_PASSWORD";

  private final String engine;
  private final @Nullable String host;
  private final @Nullable Integer port;
  private final @Nullable String database;
  private final @Nullable String user;
  private final @Nullable String password;
  private final @Nullable String iamRole;
  private final @Nullable String path;

  private WarehouseConfig(Builder builder) {
    this.engine = builder.engine;
    this.host = builder.host;
    this.port = builder.port;
    this.database = builder.database;
    this.user = builder.user;
    this.password = builder.password;
    this.iamRole = builder.iamRole;
    this.path = builder.path;
  }

  public String getEngine() {
    return engine;
  }

  public @Nullable String getHost() {
    return host;
  }

  public @Nullable Integer getPort() {
    return port;
  }

  public @Nullable String getDatabase() {
    return database;
  }

  public @Nullable String getUser() {
    return user;
  }

  public @Nullable String getPassword() {
    return password;
  }

  public @Nullable String getIamRole() {
    return iamRole;
  }

  /** Database file path for embedded engines. */
  public @Nullable String getPath() {
    return path;
  }

  /**
   * Returns the non-null settings as a string map, the form dialects use to
   * build JDBC URLs. The password is not included.
   */
  public Map<String, String> toConnectionMap() {
    Map<String, String> map = new LinkedHashMap<String, String>();
    putIfPresent(map, "host", host);
    putIfPresent(map, "port", port != null ? port.toString() : null);
    putIfPresent(map, "database", database);
    putIfPresent(map, "path", path);
    return map;
  }

  private static void putIfPresent(Map<String, String> map, String key, @Nullable String value) {
    if (value != null) {
      map.put(key, value);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a configuration from a YAML/JSON map.
   *
   * @param map Configuration map
   * @return WarehouseConfig instance
   * @throws IllegalArgumentException if the port is not a number
   */
  public static WarehouseConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();

    Object engineObj = map.get("engine");
    if (engineObj instanceof String) {
      builder.engine((String) engineObj);
    }

    Object portObj = map.get("port");
    if (portObj instanceof Number) {
      builder.port(((Number) portObj).intValue());
    } else if (portObj instanceof String) {
      try {
        builder.port(Integer.parseInt((String) portObj));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid warehouse port: " + portObj, e);
      }
    }

    builder.host(stringValue(map, "host"));
    builder.database(stringValue(map, "database"));
    builder.user(stringValue(map, "user"));
    builder.password(stringValue(map, "password"));
    builder.iamRole(stringValue(map, "iamRole"));
    builder.path(stringValue(map, "path"));

    return builder.build();
  }

  private static @Nullable String stringValue(Map<String, Object> map, String key) {
    Object value = map.get(key);
    return value != null ? value.toString() : null;
  }

  @Override public String toString() {
    return "WarehouseConfig{engine='" + engine + "', host='" + host + "', port=" + port
        + ", database='" + database + "', user='" + user + "', path='" + path + "'}";
  }

  /**
   * Builder for WarehouseConfig.
   */
  public static class Builder {
    private String engine = WarehouseDialectFactory.ENGINE_REDSHIFT;
    private @Nullable String host;
    private @Nullable Integer port;
    private @Nullable String database;
    private @Nullable String user;
    private @Nullable String password;
    private @Nullable String iamRole;
    private @Nullable String path;

    public Builder engine(String engine) {
      this.engine = engine;
      return this;
    }

    public Builder host(@Nullable String host) {
      this.host = host;
      return this;
    }

    public Builder port(@Nullable Integer port) {
      this.port = port;
      return this;
    }

    public Builder database(@Nullable String database) {
      this.database = database;
      return this;
    }

    public Builder user(@Nullable String user) {
      this.user = user;
      return this;
    }

    public Builder password(@Nullable String password) {
      this.password = password;
      return this;
    }

    public Builder iamRole(@Nullable String iamRole) {
      this.iamRole = iamRole;
      return this;
    }

    public Builder path(@Nullable String path) {
      this.path = path;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @throws IllegalArgumentException if the engine is not supported
     */
    public WarehouseConfig build() {
      if (engine == null || !WarehouseDialectFactory.isSupported(engine)) {
        throw new IllegalArgumentException("Unsupported warehouse engine: " + engine);
      }
      if (password == null) {
        password = System.getenv(PASSWORD_ENV);
      }
      return new WarehouseConfig(this);
    }
  }
}
