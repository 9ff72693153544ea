package eu.virtualparadox.knowledge.ingest.pipeline;

import java.time.Instant;

/**
 * What one pipeline stage did for a job. Kept on the job record for inspection.
 *
 * @param stage       stage name, see {@link Processor#name()}
 * @param attempts    number of runs including the successful one
 * @param startedAt   start of the first attempt
 * @param finishedAt  end of the last attempt
 * @param outputCount number of items produced
 * @param detail      free-form detail such as the model version
 */
public record StageProvenance(String stage,
                              int attempts,
                              Instant startedAt,
                              Instant finishedAt,
                              int outputCount,
                              String detail) {
}
