/*
 * どこで: Worker アプリのスモークテスト
 * 何を: Spring コンテキストの起動と停止処理の登録を確認する
 * なぜ: 主要な構成が破壊されていないことを担保するため
 */
package com.chainindexer.worker;

import static org.assertj.core.api.Assertions.assertThat;

import com.chainindexer.worker.service.QueueClaimWorker;
import com.chainindexer.worker.service.WorkerShutdown;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class WorkerApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private ApplicationContext context;

  @Test
  void contextLoadsWithClaimingDisabled() {
    assertThat(context.getBeansOfType(QueueClaimWorker.class)).isEmpty();
    assertThat(context.getBean(WorkerShutdown.class).isRunning()).isTrue();
  }
}
