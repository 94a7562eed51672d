/*
 * どこで: Worker アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン、スケジュールの有効化を行う
 * なぜ: キュー claim と滞留回収を同一プロセスで定期実行するため
 */
package com.chainindexer.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class WorkerApplication {

  public static void main(String[] args) {
    SpringApplication.run(WorkerApplication.class, args);
  }
}
