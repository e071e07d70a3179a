package com.quantori.eqp.core.progress;

import akka.Done;
import akka.actor.typed.ActorRef;
import akka.actor.typed.ActorSystem;
import akka.actor.typed.Props;
import akka.stream.OverflowStrategy;
import akka.stream.javadsl.Keep;
import akka.stream.javadsl.Source;
import akka.stream.javadsl.SourceQueueWithComplete;
import com.quantori.eqp.api.ProgressListener;
import com.quantori.eqp.api.model.Phase;
import com.quantori.eqp.api.model.ProgressUpdate;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded channel between pipeline stages and a {@link ProgressListener}.
 *
 * <p>Offering never blocks. When the listener falls behind by more than the buffer size, the oldest
 * pending updates are dropped. Updates that are delivered arrive in offer order.
 */
@Slf4j
public class ProgressChannel {
  private final SourceQueueWithComplete<ProgressUpdate> queue;
  private final CompletableFuture<Done> drained;

  private ProgressChannel(SourceQueueWithComplete<ProgressUpdate> queue, CompletableFuture<Done> drained) {
    this.queue = queue;
    this.drained = drained;
  }

  public static ProgressChannel open(ActorSystem<?> system, ProgressListener listener, int bufferSize) {
    CompletableFuture<Done> drained = new CompletableFuture<>();
    ActorRef<ProgressSinkActor.Command> sinkActor = system.systemActorOf(
        ProgressSinkActor.create(listener, drained), "progress-" + UUID.randomUUID(), Props.empty());
    SourceQueueWithComplete<ProgressUpdate> queue = Source.<ProgressUpdate>queue(bufferSize, OverflowStrategy.dropHead())
        .toMat(ProgressSinkActor.getSink(sinkActor), Keep.left())
        .run(system);
    return new ProgressChannel(queue, drained);
  }

  public void offer(ProgressUpdate update) {
    queue.offer(update);
  }

  public void offer(Phase phase, int completed, Integer total, String currentItem) {
    offer(new ProgressUpdate(phase, completed, total, currentItem));
  }

  public void offer(Phase phase, int completed, Integer total, String currentItem, RemainingTime remainingTime) {
    offer(new ProgressUpdate(phase, completed, total, currentItem, remainingTime.estimateSeconds(completed, total)));
  }

  /**
   * Closes the channel. The returned stage completes once every buffered update has been handed to
   * the listener.
   */
  public CompletionStage<Done> complete() {
    queue.complete();
    return drained;
  }
}
