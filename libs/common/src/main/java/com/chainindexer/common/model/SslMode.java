package com.chainindexer.common.model;

/** TLS mode requested for a destination database connection. */
public enum SslMode {
  DISABLE("disable"),
  ALLOW("allow"),
  PREFER("prefer"),
  REQUIRE("require");

  private final String value;

  SslMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** allow/prefer/require all negotiate TLS; only disable connects in plain text. */
  public boolean usesSsl() {
    return this != DISABLE;
  }

  public static SslMode fromValue(String value) {
    if (value == null || value.isBlank()) {
      return DISABLE;
    }
    for (SslMode mode : values()) {
      if (mode.value.equalsIgnoreCase(value.trim())) {
        return mode;
      }
    }
    throw new IllegalArgumentException("unknown ssl mode: " + value);
  }
}
