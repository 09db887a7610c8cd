package com.acme.jobqueue.redis;

import com.acme.jobqueue.job.JobOptions;
import com.fasterxml.jackson.databind.JsonNode;

/** JSON record kept in the jobs hash. */
record StoredJob(String id, String name, JsonNode data, JobOptions opts, long timestamp) {}
