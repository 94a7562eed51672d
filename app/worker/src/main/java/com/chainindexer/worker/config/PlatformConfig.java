package com.chainindexer.worker.config;

import com.chainindexer.common.config.IndexerCommonConfig;
import com.chainindexer.common.config.TimeConfig;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/** Shared clock, platform repositories and credential cipher. */
@Configuration
@Import({TimeConfig.class, IndexerCommonConfig.class})
public class PlatformConfig {}
