/*
 * どこで: Ingest アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: webhook 受信/購読同期/ジョブ API をまとめて起動するため
 */
package com.chainindexer.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class IngestApplication {

  public static void main(String[] args) {
    SpringApplication.run(IngestApplication.class, args);
  }
}
