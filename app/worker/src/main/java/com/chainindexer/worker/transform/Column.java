package com.chainindexer.worker.transform;

public record Column(String name, ColumnType type) {

  public String placeholder() {
    return type.placeholder(name);
  }
}
