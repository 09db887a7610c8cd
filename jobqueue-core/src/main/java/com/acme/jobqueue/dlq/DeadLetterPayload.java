package com.acme.jobqueue.dlq;

import com.acme.jobqueue.job.JobOptions;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Data of a dead-lettered job: where the job came from and what it carried.
 *
 * @param originalQueue queue the job is replayed into
 * @param originalJobName job name to replay under
 * @param originalJobId id of the failed job, or null
 * @param originalData the failed job's data, passed through untouched
 * @param originalOptions the failed job's options, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeadLetterPayload(
    @JsonProperty("originalQueue") String originalQueue,
    @JsonProperty("originalJobName") String originalJobName,
    @JsonProperty("originalJobId") String originalJobId,
    @JsonProperty("originalData") JsonNode originalData,
    @JsonProperty("originalOptions") JobOptions originalOptions) {}
