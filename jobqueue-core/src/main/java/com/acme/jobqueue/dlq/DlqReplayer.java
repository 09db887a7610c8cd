package com.acme.jobqueue.dlq;

import com.acme.jobqueue.job.JobOptions;
import com.acme.jobqueue.job.JobState;
import com.acme.jobqueue.job.QueuedJob;
import com.acme.jobqueue.queue.QueueHandle;
import com.acme.jobqueue.queue.QueueHandleFactory;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves dead-lettered jobs back to the queues they came from.
 *
 * <p>Dead-letter queues are drained one at a time, in the given order, and each fetches at most
 * {@code batchSize} not-yet-picked-up jobs. Jobs are replayed one at a time: the original job is
 * re-added to its original queue under a fresh id and removed from the dead-letter queue only
 * after the add succeeded. Delivery is at-least-once: a crash between add and remove replays the
 * job again on the next run.
 *
 * <p>Jobs whose data lacks {@code originalQueue} or {@code originalJobName} are left in place and
 * not counted. The first backend error ends the run; nothing replayed before it is rolled back.
 * Target queue handles opened during a run are closed when it ends, on every path.
 */
public class DlqReplayer {
  private static final Logger LOG = LoggerFactory.getLogger(DlqReplayer.class);

  private final QueueHandleFactory handles;
  private final int batchSize;
  private final ReplayJobIds replayIds;
  private final Executor closeExecutor;

  public DlqReplayer(QueueHandleFactory handles, int batchSize) {
    this(handles, batchSize, new ReplayJobIds(), ForkJoinPool.commonPool());
  }

  public DlqReplayer(
      QueueHandleFactory handles, int batchSize, ReplayJobIds replayIds, Executor closeExecutor) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be at least 1: " + batchSize);
    }
    this.handles = handles;
    this.batchSize = batchSize;
    this.replayIds = replayIds;
    this.closeExecutor = closeExecutor;
  }

  public ReplayResult replay(List<String> dlqNames) {
    Progress progress = new Progress();
    ReplayResult result;

    try (TargetQueues targets = new TargetQueues(handles, closeExecutor)) {
      try {
        for (String dlqName : dlqNames) {
          progress.dlqName = dlqName;
          drain(dlqName, targets, progress);
        }
        result = new ReplayResult.Completed(progress.replayed, dlqNames);
      } catch (RuntimeException e) {
        targets.failedWith(e);
        result = new ReplayResult.Failed(e, progress.dlqName, progress.replayed);
      }
    }

    // callers report the failure themselves
    if (result instanceof ReplayResult.Failed failed) {
      LOG.debug(
          "DLQ replay aborted in {} after {} replayed job(s): {}",
          failed.dlqName(),
          failed.replayed(),
          failed.message(),
          failed.cause());
    } else {
      LOG.info("DLQ replay complete: {} job(s) replayed from {}", result.replayed(), dlqNames);
    }
    return result;
  }

  private void drain(String dlqName, TargetQueues targets, Progress progress) {
    try (QueueHandle dlq = handles.open(dlqName)) {
      List<QueuedJob> jobs = dlq.fetch(JobState.REPLAYABLE, 0, batchSize);
      LOG.debug("Fetched {} job(s) from {} (batch size {})", jobs.size(), dlqName, batchSize);

      int replayedHere = 0;
      for (QueuedJob job : jobs) {
        PayloadParseResult parsed = DeadLetterPayloads.parse(job.data());
        if (parsed instanceof PayloadParseResult.Malformed malformed) {
          LOG.debug("Skipping dead-letter job {} in {}: {}", job.id(), dlqName, malformed.reason());
        } else if (parsed instanceof PayloadParseResult.Valid valid) {
          replayOne(dlq, job, valid.payload(), targets);
          progress.replayed++;
          replayedHere++;
        }
      }
      LOG.info("Replayed {} of {} fetched job(s) from {}", replayedHere, jobs.size(), dlqName);
    }
  }

  private void replayOne(
      QueueHandle dlq, QueuedJob job, DeadLetterPayload payload, TargetQueues targets) {
    QueueHandle target = targets.get(payload.originalQueue());
    JobOptions base =
        payload.originalOptions() != null ? payload.originalOptions() : JobOptions.empty();
    JobOptions options = base.withJobId(replayIds.next(payload.originalJobId()));

    target.enqueue(payload.originalJobName(), payload.originalData(), options);
    dlq.remove(job);
    LOG.debug(
        "Replayed dead-letter job {} from {} to {} as {}",
        job.id(),
        dlq.getName(),
        target.getName(),
        options.getJobId());
  }

  private static final class Progress {
    private String dlqName;
    private int replayed;
  }
}
