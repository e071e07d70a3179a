package com.quantori.eqp.core.progress;

import akka.Done;
import akka.NotUsed;
import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import akka.actor.typed.javadsl.ReceiveBuilder;
import akka.stream.javadsl.Sink;
import akka.stream.typed.javadsl.ActorSink;
import com.quantori.eqp.api.ProgressListener;
import com.quantori.eqp.api.model.ProgressUpdate;
import java.util.concurrent.CompletableFuture;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Delivers progress updates to a listener one at a time. Acknowledges each update only after the
 * listener returned, so the upstream queue buffers while the listener is busy.
 */
@Slf4j
class ProgressSinkActor extends AbstractBehavior<ProgressSinkActor.Command> {
  private final ProgressListener listener;
  private final CompletableFuture<Done> drained;
  private int delivered;

  private ProgressSinkActor(ActorContext<Command> context, ProgressListener listener,
                            CompletableFuture<Done> drained) {
    super(context);
    this.listener = listener;
    this.drained = drained;
  }

  static Behavior<Command> create(ProgressListener listener, CompletableFuture<Done> drained) {
    return Behaviors.setup(ctx -> new ProgressSinkActor(ctx, listener, drained));
  }

  static Sink<ProgressUpdate, NotUsed> getSink(ActorRef<Command> actorRef) {
    return ActorSink.actorRefWithBackpressure(
        actorRef,
        ProgressSinkActor.Item::new,
        ProgressSinkActor.StreamInitialized::new,
        Ack.INSTANCE,
        new ProgressSinkActor.StreamCompleted(),
        ProgressSinkActor.StreamFailure::new
    );
  }

  @Override
  public Receive<Command> createReceive() {
    ReceiveBuilder<Command> builder = newReceiveBuilder();
    builder.onMessage(StreamInitialized.class, this::onInitFlow);
    builder.onMessage(Item.class, this::onItem);
    builder.onMessage(StreamCompleted.class, this::onComplete);
    builder.onMessage(StreamFailure.class, this::onFailure);
    return builder.build();
  }

  private Behavior<Command> onInitFlow(StreamInitialized cmd) {
    cmd.replyTo.tell(Ack.INSTANCE);
    return this;
  }

  private Behavior<Command> onItem(Item item) {
    try {
      listener.onProgress(item.update);
    } catch (RuntimeException e) {
      log.warn("Progress listener failed on {}", item.update, e);
    }
    delivered++;
    item.replyTo.tell(Ack.INSTANCE);
    return this;
  }

  private Behavior<Command> onComplete(StreamCompleted cmd) {
    log.debug("Progress stream completed, {} update(s) delivered", delivered);
    drained.complete(Done.getInstance());
    return Behaviors.stopped();
  }

  private Behavior<Command> onFailure(StreamFailure failed) {
    log.error("Progress stream failed", failed.cause);
    drained.complete(Done.getInstance());
    return Behaviors.stopped();
  }

  enum Ack {
    INSTANCE
  }

  interface Command {
  }

  @Value
  static class StreamInitialized implements Command {
    ActorRef<Ack> replyTo;
  }

  @Value
  static class Item implements Command {
    ActorRef<Ack> replyTo;
    ProgressUpdate update;
  }

  static class StreamCompleted implements Command {
  }

  @Value
  static class StreamFailure implements Command {
    Throwable cause;
  }
}
