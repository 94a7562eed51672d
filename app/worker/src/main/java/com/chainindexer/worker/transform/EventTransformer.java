package com.chainindexer.worker.transform;

import com.chainindexer.common.model.JobRecord;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** Turns one raw event into zero or more rows for a job's destination table; never throws. */
public interface EventTransformer<R extends DestinationRow> {

  List<R> transform(JsonNode payload, JobRecord job);
}
