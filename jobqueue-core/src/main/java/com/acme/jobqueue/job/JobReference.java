package com.acme.jobqueue.job;

/** Identifies one job inside one queue. */
public record JobReference(String queueName, String jobId) {}
