package com.verlumen.strategylab.registry;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class RegistryConfig {
  public static RegistryConfig create(String jdbcUrl, String user, String password) {
    return new AutoValue_RegistryConfig(jdbcUrl, user, password);
  }

  /** File-backed H2 database at the given path, without extension. */
  public static RegistryConfig forFile(String path) {
    return create("jdbc:h2:file:" + path, "sa", "");
  }

  /** Private in-memory database that lives as long as the JVM. */
  public static RegistryConfig inMemory(String name) {
    return create("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1", "sa", "");
  }

  public abstract String jdbcUrl();

  public abstract String user();

  public abstract String password();
}
