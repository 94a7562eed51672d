/*
 * どこで: Enhanced webhook イベントモデル
 * 何を: 生イベント JSON を既知サブ構造の一覧へ分解し、関与アカウント集合を求める
 * なぜ: Gateway のマッチングと worker の変換で同じ抽出規則を使うため
 */
package com.chainindexer.common.event;

import static com.chainindexer.common.event.JsonFields.array;
import static com.chainindexer.common.event.JsonFields.at;
import static com.chainindexer.common.event.JsonFields.text;

import com.chainindexer.common.event.EventComponent.AccountDataRecord;
import com.chainindexer.common.event.EventComponent.AccountKeyList;
import com.chainindexer.common.event.EventComponent.NativeTransfer;
import com.chainindexer.common.event.EventComponent.NftEvent;
import com.chainindexer.common.event.EventComponent.RuleAccount;
import com.chainindexer.common.event.EventComponent.TokenTransfer;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One event of an enhanced webhook batch, parsed into the structures that can name accounts.
 *
 * <p>Parsing never fails: absent or mistyped structures simply contribute no component.
 */
public record EnhancedEvent(JsonNode raw, String signature, List<EventComponent> components) {

  static final String RULE_SOURCE = "PROGRAM_RULE";

  public EnhancedEvent {
    components = List.copyOf(components);
  }

  public static EnhancedEvent parse(JsonNode raw) {
    final List<EventComponent> components = new ArrayList<>();
    for (JsonNode transfer : array(raw, "tokenTransfers")) {
      components.add(
          new TokenTransfer(
              text(transfer, "fromUserAccount"),
              text(transfer, "toUserAccount"),
              text(transfer, "mint")));
    }
    for (JsonNode transfer : array(raw, "nativeTransfers")) {
      components.add(
          new NativeTransfer(text(transfer, "fromUserAccount"), text(transfer, "toUserAccount")));
    }
    final JsonNode nft = at(raw, "events", "nft");
    if (nft.isObject()) {
      final List<String> mints = new ArrayList<>();
      for (JsonNode token : array(nft, "nfts")) {
        final String mint = text(token, "mint");
        if (mint != null) {
          mints.add(mint);
        }
      }
      components.add(new NftEvent(text(nft, "buyer"), text(nft, "seller"), mints));
    }
    final List<String> accountKeys = accountKeys(raw);
    if (!accountKeys.isEmpty()) {
      components.add(new AccountKeyList(accountKeys));
    }
    for (JsonNode accountData : array(raw, "accountData")) {
      components.add(new AccountDataRecord(text(accountData, "account")));
    }
    if (RULE_SOURCE.equals(text(raw, "source"))) {
      final String account = text(raw, "account");
      if (account != null) {
        components.add(new RuleAccount(account));
      }
    }
    return new EnhancedEvent(raw, text(raw, "signature"), components);
  }

  /** Every account identifier named anywhere in the known structures of this event. */
  public Set<String> involvedAccounts() {
    final Set<String> accounts = new LinkedHashSet<>();
    components.forEach(component -> component.collectAccounts(accounts));
    return Collections.unmodifiableSet(accounts);
  }

  /**
   * Accounts touched by the transaction itself: account data records when present, otherwise the
   * message account keys.
   */
  public List<String> transactionAccounts() {
    final List<String> fromAccountData = new ArrayList<>();
    final List<String> fromKeys = new ArrayList<>();
    for (EventComponent component : components) {
      if (component instanceof AccountDataRecord record && record.account() != null) {
        fromAccountData.add(record.account());
      } else if (component instanceof AccountKeyList keyList) {
        fromKeys.addAll(keyList.keys());
      }
    }
    return fromAccountData.isEmpty() ? fromKeys : fromAccountData;
  }

  public List<TokenTransfer> tokenTransfers() {
    return ofType(TokenTransfer.class);
  }

  public List<NftEvent> nftEvents() {
    return ofType(NftEvent.class);
  }

  private <T extends EventComponent> List<T> ofType(Class<T> type) {
    final List<T> matches = new ArrayList<>();
    for (EventComponent component : components) {
      if (type.isInstance(component)) {
        matches.add(type.cast(component));
      }
    }
    return matches;
  }

  // accountKeys は文字列または {pubkey} オブジェクトの配列
  private static List<String> accountKeys(JsonNode raw) {
    final List<String> keys = new ArrayList<>();
    for (JsonNode key : array(raw, "transaction", "message", "accountKeys")) {
      if (key.isTextual() && !key.asText().isEmpty()) {
        keys.add(key.asText());
      } else {
        final String pubkey = text(key, "pubkey");
        if (pubkey != null) {
          keys.add(pubkey);
        }
      }
    }
    return keys;
  }
}
