/*
 * どこで: Enhanced webhook イベントモデル
 * 何を: イベント内の既知サブ構造を閉じた variant として表現する
 * なぜ: 形状ごとの関与アカウント抽出を型で分け、未知の形状を安全に無視するため
 */
package com.chainindexer.common.event;

import java.util.List;
import java.util.Set;

public sealed interface EventComponent
    permits EventComponent.TokenTransfer,
        EventComponent.NativeTransfer,
        EventComponent.NftEvent,
        EventComponent.AccountKeyList,
        EventComponent.AccountDataRecord,
        EventComponent.RuleAccount {

  /** Adds every account identifier carried by this component to {@code sink}. */
  void collectAccounts(Set<String> sink);

  record TokenTransfer(String fromUserAccount, String toUserAccount, String mint)
      implements EventComponent {
    @Override
    public void collectAccounts(Set<String> sink) {
      addIfPresent(sink, fromUserAccount);
      addIfPresent(sink, toUserAccount);
      addIfPresent(sink, mint);
    }
  }

  record NativeTransfer(String fromUserAccount, String toUserAccount) implements EventComponent {
    @Override
    public void collectAccounts(Set<String> sink) {
      addIfPresent(sink, fromUserAccount);
      addIfPresent(sink, toUserAccount);
    }
  }

  record NftEvent(String buyer, String seller, List<String> mints) implements EventComponent {
    public NftEvent {
      mints = List.copyOf(mints);
    }

    @Override
    public void collectAccounts(Set<String> sink) {
      addIfPresent(sink, buyer);
      addIfPresent(sink, seller);
      mints.forEach(mint -> addIfPresent(sink, mint));
    }
  }

  record AccountKeyList(List<String> keys) implements EventComponent {
    public AccountKeyList {
      keys = List.copyOf(keys);
    }

    @Override
    public void collectAccounts(Set<String> sink) {
      keys.forEach(key -> addIfPresent(sink, key));
    }
  }

  record AccountDataRecord(String account) implements EventComponent {
    @Override
    public void collectAccounts(Set<String> sink) {
      addIfPresent(sink, account);
    }
  }

  /** Single account reported by rule-based sources. */
  record RuleAccount(String account) implements EventComponent {
    @Override
    public void collectAccounts(Set<String> sink) {
      addIfPresent(sink, account);
    }
  }

  private static void addIfPresent(Set<String> sink, String value) {
    if (value != null && !value.isEmpty()) {
      sink.add(value);
    }
  }
}
