package com.quantori.csp.core.pipeline;

import akka.Done;
import akka.NotUsed;
import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.Behaviors;
import akka.japi.Pair;
import akka.stream.ActorAttributes;
import akka.stream.OverflowStrategy;
import akka.stream.Supervision;
import akka.stream.javadsl.Keep;
import akka.stream.javadsl.Sink;
import akka.stream.javadsl.Source;
import com.quantori.csp.api.BalanceVerificationException;
import com.quantori.csp.api.model.Reaction;
import com.quantori.csp.api.model.document.ReactionDocument;
import com.quantori.csp.api.service.ItemWriter;
import com.quantori.csp.api.util.ReactionDocuments;
import com.quantori.csp.core.balance.BalanceResult;
import com.quantori.csp.core.configuration.BalancingProperties;
import com.quantori.csp.core.service.ReactionService;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Balances a stream of independent reactions and hands the resulting documents to an
 * {@link ItemWriter}. Reactions are processed concurrently with the configured parallelism, so
 * documents may be written out of source order. A source must not emit the same reaction instance
 * twice, since it would then be balanced by two workers at once; {@link ReactionSource#of} drops
 * such repeats.
 *
 * <p>A reaction failing with a {@link com.quantori.csp.api.ChemistryException} is counted as an
 * error and skipped. A {@link BalanceVerificationException} stops the stream and fails the
 * returned stage.
 */
@Slf4j
public class BalancingPipeline implements AutoCloseable {

  private final ActorSystem<?> actorSystem;
  private final ReactionService service;
  private final BalancingProperties properties;
  private final boolean ownsActorSystem;

  public BalancingPipeline(ActorSystem<?> actorSystem, ReactionService service, BalancingProperties properties) {
    this(actorSystem, service, properties, false);
  }

  public BalancingPipeline(ReactionService service, BalancingProperties properties) {
    this(ActorSystem.create(Behaviors.empty(), properties.getSystemName()), service, properties, true);
  }

  private BalancingPipeline(ActorSystem<?> actorSystem, ReactionService service, BalancingProperties properties,
                            boolean ownsActorSystem) {
    this.actorSystem = actorSystem;
    this.service = service;
    this.properties = properties;
    this.ownsActorSystem = ownsActorSystem;
  }

  public CompletionStage<PipelineStatistics> process(ReactionSource reactionSource, ItemWriter<ReactionDocument> writer) {
    final var countOfSuccessfullyProcessed = new AtomicInteger();
    final var countOfErrors = new AtomicInteger();
    final var countOfAmbiguous = new AtomicInteger();

    Source<Reaction, NotUsed> source = createStreamSource(reactionSource, countOfErrors);
    Source<ReactionDocument, NotUsed> balanced = addBalancingStep(
        source.zipWithIndex(), countOfSuccessfullyProcessed, countOfErrors, countOfAmbiguous);

    final Sink<ReactionDocument, CompletionStage<Done>> sink =
        Sink.foreach(
            document -> {
              try {
                writer.write(document);
                countOfSuccessfullyProcessed.incrementAndGet();
              } catch (RuntimeException e) {
                log.error(e.getMessage(), e);
                countOfErrors.incrementAndGet();
                throw e;
              }
            });
    return balanced
        .toMat(sink, Keep.right())
        .withAttributes(ActorAttributes.withSupervisionStrategy(decider()))
        .run(actorSystem)
        .thenApply(
            done -> {
              writer.flush();
              var statistics = new PipelineStatistics(
                  countOfSuccessfullyProcessed.get(), countOfErrors.get(), countOfAmbiguous.get());
              log.info("Balancing pipeline finished: {}", statistics);
              return statistics;
            });
  }

  private akka.japi.function.Function<Throwable, Supervision.Directive> decider() {
    return exc -> {
      if (rootCause(exc) instanceof BalanceVerificationException) {
        log.error(exc.getMessage(), exc);
        return (Supervision.Directive) Supervision.stop();
      }
      log.warn(exc.getMessage());
      return (Supervision.Directive) Supervision.resume();
    };
  }

  private Source<ReactionDocument, NotUsed> addBalancingStep(
      Source<Pair<Reaction, Long>, NotUsed> source,
      AtomicInteger countOfSuccessfullyProcessed,
      AtomicInteger countOfErrors,
      AtomicInteger countOfAmbiguous) {
    Function<Pair<Reaction, Long>, ReactionDocument> step =
        item -> {
          try {
            BalanceResult result = service.process(item.first());
            if (result.ambiguous()) {
              countOfAmbiguous.incrementAndGet();
            }
            return ReactionDocuments.toDocument(item.first());
          } catch (RuntimeException e) {
            countOfErrors.incrementAndGet();
            throw new CountableError(item.second(), countOfSuccessfullyProcessed.get(), e);
          }
        };

    Source<ReactionDocument, NotUsed> balanced;
    if (properties.getParallelism() <= 1) {
      // Async boundary splits reading from the source and balancing to different threads.
      balanced = source.async().map(step::apply);
    } else {
      balanced = source.mapAsyncUnordered(
          properties.getParallelism(),
          item -> CompletableFuture.supplyAsync(() -> step.apply(item), actorSystem.executionContext()));
    }

    if (properties.getBufferSize() > 0) {
      balanced = balanced.buffer(properties.getBufferSize(), OverflowStrategy.backpressure());
    }
    return balanced;
  }

  private Source<Reaction, NotUsed> createStreamSource(ReactionSource reactionSource, AtomicInteger countOfErrors) {
    return Source.fromIterator(
            () -> {
              try {
                return reactionSource.createIterator();
              } catch (RuntimeException e) {
                log.error(e.getMessage(), e);
                countOfErrors.incrementAndGet();
                throw e;
              }
            })
        .withAttributes(ActorAttributes.withSupervisionStrategy(Supervision.getStoppingDecider()));
  }

  private static Throwable rootCause(Throwable exc) {
    Throwable cause = exc;
    while ((cause instanceof CompletionException || cause instanceof CountableError) && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }

  @Override
  public void close() {
    if (ownsActorSystem) {
      actorSystem.terminate();
    }
  }
}
