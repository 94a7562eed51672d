package com.chainindexer.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.UUID;

/** A matched (job, event) pair waiting to be inserted into the queue. */
public record QueueItemDraft(UUID jobId, JsonNode payload) {}
