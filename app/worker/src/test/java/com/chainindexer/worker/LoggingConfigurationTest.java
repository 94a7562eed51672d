/*
 * どこで: Worker のログ設定テスト
 * 何を: JSON ログ設定とキューアイテム MDC フィールド定義の存在を検証する
 * なぜ: 設定変更で item_id/job_id によるログ追跡が欠落する回帰を防ぐため
 */
package com.chainindexer.worker;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  @Test
  void logbackConfigurationContainsJsonAndQueueItemFields() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();

    final String configText =
        new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

    assertThat(configText).contains("LoggingEventCompositeJsonEncoder");
    assertThat(configText).contains("\"item_id\":\"%X{item_id:-}\"");
    assertThat(configText).contains("\"job_id\":\"%X{job_id:-}\"");
  }
}
