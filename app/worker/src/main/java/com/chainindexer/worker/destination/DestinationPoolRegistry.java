/*
 * どこで: Worker 書き込み先接続
 * 何を: 認証情報 ID ごとの HikariCP プールを遅延生成し、検証済みのものだけをキャッシュする
 * なぜ: 利用者 DB への接続を再利用しつつ、到達できない接続先を次回再試行できるようにするため
 */
package com.chainindexer.worker.destination;

import com.chainindexer.common.crypto.CredentialCipher;
import com.chainindexer.common.destination.DestinationConnectionSettings;
import com.chainindexer.common.model.CredentialRecord;
import com.chainindexer.worker.config.DestinationPoolProperties;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Striped;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DestinationPoolRegistry {

  private static final Logger logger = LoggerFactory.getLogger(DestinationPoolRegistry.class);
  private static final int LOCK_STRIPES = 64;

  private final CredentialCipher credentialCipher;
  private final DestinationPoolProperties properties;

  private final Map<UUID, HikariDataSource> pools = new ConcurrentHashMap<>();
  private final Striped<Lock> creationLocks = Striped.lock(LOCK_STRIPES);

  /**
   * Returns the cached pool for {@code credential}, creating and validating one on first use.
   *
   * @throws com.chainindexer.common.crypto.CredentialCipherException when the stored password
   *     cannot be decrypted
   * @throws DestinationUnavailableException when the destination cannot be reached or rejects the
   *     validation query
   */
  public DataSource dataSourceFor(CredentialRecord credential) {
    final HikariDataSource cached = pools.get(credential.credentialId());
    if (cached != null) {
      return cached;
    }
    final Lock lock = creationLocks.get(credential.credentialId());
    lock.lock();
    try {
      final HikariDataSource existing = pools.get(credential.credentialId());
      if (existing != null) {
        return existing;
      }
      final String password = credentialCipher.decrypt(credential.encryptedPassword());
      final HikariDataSource created =
          createValidated(DestinationConnectionSettings.of(credential, password), credential);
      pools.put(credential.credentialId(), created);
      logger.info(
          "destination pool created credentialId={} host={} dbName={}",
          credential.credentialId(),
          credential.host(),
          credential.dbName());
      return created;
    } finally {
      lock.unlock();
    }
  }

  /** Closes and forgets the pool of a credential that no longer exists. */
  public boolean evict(UUID credentialId) {
    final Lock lock = creationLocks.get(credentialId);
    lock.lock();
    try {
      final HikariDataSource removed = pools.remove(credentialId);
      if (removed == null) {
        return false;
      }
      removed.close();
      logger.info("destination pool evicted credentialId={}", credentialId);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Closes every cached pool in parallel, waiting at most {@code grace}. */
  public void closeAll(Duration grace) {
    final List<CompletableFuture<Void>> closing = new ArrayList<>();
    for (Map.Entry<UUID, HikariDataSource> entry : pools.entrySet()) {
      closing.add(
          CompletableFuture.runAsync(
              () -> {
                entry.getValue().close();
                logger.info("destination pool closed credentialId={}", entry.getKey());
              }));
    }
    pools.clear();
    try {
      CompletableFuture.allOf(closing.toArray(CompletableFuture[]::new))
          .get(grace.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      logger.warn("destination pools did not close within grace={}", grace);
    } catch (ExecutionException ex) {
      logger.warn("destination pool close failed", ex.getCause());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("interrupted while closing destination pools");
    }
  }

  @VisibleForTesting
  int cachedPoolCount() {
    return pools.size();
  }

  private HikariDataSource createValidated(
      DestinationConnectionSettings settings, CredentialRecord credential) {
    final HikariConfig config = new HikariConfig();
    config.setPoolName("destination-" + credential.credentialId());
    config.setJdbcUrl(settings.jdbcUrl());
    config.setUsername(settings.username());
    config.setPassword(settings.password());
    config.setDataSourceProperties(settings.driverProperties());
    config.setMaximumPoolSize(properties.maximumPoolSize());
    config.setMinimumIdle(0);
    config.setIdleTimeout(properties.idleTimeout().toMillis());
    config.setConnectionTimeout(properties.connectionTimeout().toMillis());
    // 起動時の接続確認は下の SELECT 1 で行うため、プール生成自体は失敗させない
    config.setInitializationFailTimeout(-1);

    final HikariDataSource dataSource = new HikariDataSource(config);
    try (Connection connection = dataSource.getConnection();
        Statement statement = connection.createStatement()) {
      statement.setQueryTimeout((int) Math.max(1, properties.connectionTimeout().toSeconds()));
      statement.execute("SELECT 1");
      return dataSource;
    } catch (SQLException ex) {
      dataSource.close();
      logger.warn(
          "destination validation failed; pool discarded credentialId={} url={} sqlState={}",
          credential.credentialId(),
          settings.jdbcUrl(),
          ex.getSQLState());
      throw new DestinationUnavailableException(
          "destination connection failed for credential " + credential.credentialId(), ex);
    }
  }
}
