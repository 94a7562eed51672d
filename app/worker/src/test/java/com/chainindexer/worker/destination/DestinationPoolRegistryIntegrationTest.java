/*
 * どこで: Worker 書き込み先接続の結合テスト
 * 何を: 実 Postgres に対するプール生成/再利用/解放を検証する
 * なぜ: 認証情報ごとのプールが 1 つだけ作られ、停止時に閉じられることを担保するため
 */
package com.chainindexer.worker.destination;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chainindexer.common.model.CredentialRecord;
import com.chainindexer.worker.AbstractPostgresContainerTest;
import com.chainindexer.worker.config.DestinationPoolProperties;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

class DestinationPoolRegistryIntegrationTest extends AbstractPostgresContainerTest {

  @BeforeAll
  static void startContainer() {
    if (!POSTGRES.isRunning()) {
      POSTGRES.start();
    }
  }

  @Test
  void createsValidatedPoolOncePerCredentialAndClosesOnShutdown() {
    final DestinationPoolRegistry registry =
        new DestinationPoolRegistry(
            TestCredentials.CIPHER,
            new DestinationPoolProperties(
                2, Duration.ofSeconds(30), Duration.ofSeconds(5), Duration.ofSeconds(5)));
    final CredentialRecord credential =
        TestCredentials.credential(
            POSTGRES.getHost(),
            POSTGRES.getMappedPort(5432),
            POSTGRES.getDatabaseName(),
            POSTGRES.getUsername(),
            POSTGRES.getPassword());

    final List<DataSource> resolved =
        IntStream.range(0, 8)
            .mapToObj(i -> CompletableFuture.supplyAsync(() -> registry.dataSourceFor(credential)))
            .toList()
            .stream()
            .map(CompletableFuture::join)
            .toList();

    assertThat(resolved).allSatisfy(dataSource -> assertThat(dataSource).isSameAs(resolved.get(0)));
    assertThat(registry.cachedPoolCount()).isEqualTo(1);
    assertThat(new JdbcTemplate(resolved.get(0)).queryForObject("SELECT 1", Integer.class))
        .isEqualTo(1);

    registry.closeAll(Duration.ofSeconds(5));

    assertThat(registry.cachedPoolCount()).isZero();
    assertThat(((HikariDataSource) resolved.get(0)).isClosed()).isTrue();
  }

  @Test
  void evictClosesPoolAndNextLookupCreatesFreshOne() {
    final DestinationPoolRegistry registry =
        new DestinationPoolRegistry(
            TestCredentials.CIPHER,
            new DestinationPoolProperties(
                2, Duration.ofSeconds(30), Duration.ofSeconds(5), Duration.ofSeconds(5)));
    final CredentialRecord credential =
        TestCredentials.credential(
            POSTGRES.getHost(),
            POSTGRES.getMappedPort(5432),
            POSTGRES.getDatabaseName(),
            POSTGRES.getUsername(),
            POSTGRES.getPassword());
    final DataSource first = registry.dataSourceFor(credential);

    assertThat(registry.evict(credential.credentialId())).isTrue();

    assertThat(((HikariDataSource) first).isClosed()).isTrue();
    assertThat(registry.cachedPoolCount()).isZero();
    final DataSource second = registry.dataSourceFor(credential);
    assertThat(second).isNotSameAs(first);
    registry.closeAll(Duration.ofSeconds(5));
  }

  @Test
  void wrongPasswordIsNotCached() {
    final DestinationPoolRegistry registry =
        new DestinationPoolRegistry(
            TestCredentials.CIPHER,
            new DestinationPoolProperties(
                2, Duration.ofSeconds(30), Duration.ofSeconds(2), Duration.ofSeconds(5)));
    final CredentialRecord credential =
        TestCredentials.credential(
            POSTGRES.getHost(),
            POSTGRES.getMappedPort(5432),
            POSTGRES.getDatabaseName(),
            POSTGRES.getUsername(),
            "wrong-password");

    assertThatThrownBy(() -> registry.dataSourceFor(credential))
        .isInstanceOf(DestinationUnavailableException.class);
    assertThat(registry.cachedPoolCount()).isZero();
  }
}
