/*
 * どこで: Ingest 設定
 * 何を: 共通の時刻注入とプラットフォーム DB 永続化層を取り込む
 * なぜ: Web スライステストでリポジトリを読み込まず、アプリ起動時だけ有効にするため
 */
package com.chainindexer.ingest.config;

import com.chainindexer.common.config.IndexerCommonConfig;
import com.chainindexer.common.config.TimeConfig;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import({TimeConfig.class, IndexerCommonConfig.class})
public class PlatformConfig {}
