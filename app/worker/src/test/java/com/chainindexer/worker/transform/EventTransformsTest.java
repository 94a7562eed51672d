package com.chainindexer.worker.transform;

import static org.assertj.core.api.Assertions.assertThat;

import com.chainindexer.common.model.JobCategory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class EventTransformsTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final EventTransforms transforms =
      new EventTransforms(new MintActivityTransformer(), new ProgramInteractionTransformer());

  @Test
  void dispatchesOnJobCategory() throws Exception {
    final JsonNode payload =
        objectMapper.readTree(
            """
            {
              "signature": "sig-1",
              "timestamp": 1700000000,
              "accountData": [{"account": "Shared111"}],
              "instructions": [{"programId": "Shared111"}]
            }
            """);

    final List<? extends DestinationRow> mintRows =
        transforms.transform(TestJobs.job(JobCategory.MINT_ACTIVITY, "Shared111"), payload);
    final List<? extends DestinationRow> programRows =
        transforms.transform(TestJobs.job(JobCategory.PROGRAM_INTERACTIONS, "Shared111"), payload);

    assertThat(mintRows).singleElement().isInstanceOf(MintActivityRow.class);
    assertThat(programRows).singleElement().isInstanceOf(ProgramInteractionRow.class);
    assertThat(programRows.get(0).conflictColumns())
        .containsExactly("tx_signature", "instruction_index", "inner_instruction_index");
  }
}
