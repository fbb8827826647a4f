package com.quantori.csp.core.pipeline;

import static com.quantori.csp.api.Expressions.combine;
import static com.quantori.csp.api.Expressions.element;
import static com.quantori.csp.api.Expressions.join;
import static com.quantori.csp.api.Expressions.react;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.when;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import com.quantori.csp.api.BalanceVerificationException;
import com.quantori.csp.api.model.ElementSymbol;
import com.quantori.csp.api.model.Reaction;
import com.quantori.csp.api.model.ReactionType;
import com.quantori.csp.api.model.document.ReactionDocument;
import com.quantori.csp.api.service.ItemWriter;
import com.quantori.csp.core.SampleReactions;
import com.quantori.csp.core.configuration.BalancingProperties;
import com.quantori.csp.core.service.ReactionService;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.hamcrest.CoreMatchers;
import org.hamcrest.MatcherAssert;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

class BalancingPipelineTest {
  static final ActorTestKit testKit = ActorTestKit.create();

  private ItemWriter<ReactionDocument> writer;

  @AfterAll
  public static void teardown() {
    testKit.shutdownTestKit();
  }

  @SuppressWarnings("unchecked")
  @BeforeEach
  void setUp() {
    writer = Mockito.mock(ItemWriter.class);
  }

  private static BalancingPipeline pipeline(int parallelism) {
    var properties = BalancingProperties.builder().parallelism(parallelism).bufferSize(4).build();
    return new BalancingPipeline(testKit.system(), new ReactionService(), properties);
  }

  @Test
  void balanceOneReaction() throws Exception {
    var source = ReactionSource.of(List.of(SampleReactions.ethaneCombustion()));

    var stat = pipeline(1).process(source, writer).toCompletableFuture().get();

    assertEquals(1, stat.getCountOfSuccessfullyProcessed());
    assertEquals(0, stat.getCountOfErrors());
    ArgumentCaptor<ReactionDocument> captor = ArgumentCaptor.forClass(ReactionDocument.class);
    Mockito.verify(writer).write(captor.capture());
    Mockito.verify(writer).flush();
    assertEquals("2 C2H6 + 7 O2 -> 4 CO2 + 6 H2O", captor.getValue().equation());
    assertEquals(ReactionType.COMBUSTION, captor.getValue().type());
    assertTrue(captor.getValue().balanced());
  }

  @Test
  void balanceManyReactionsInParallel() throws Exception {
    List<Reaction> reactions = IntStream.range(0, 50)
        .mapToObj(i -> i % 2 == 0 ? SampleReactions.waterSynthesis() : SampleReactions.chlorateDecomposition())
        .collect(Collectors.toList());

    var stat = pipeline(4).process(ReactionSource.of(reactions), writer).toCompletableFuture().get();

    assertEquals(50, stat.getCountOfSuccessfullyProcessed());
    assertEquals(0, stat.getCountOfErrors());
    Mockito.verify(writer, times(50)).write(any());
    reactions.forEach(reaction -> assertTrue(reaction.isBalanced()));
  }

  @Test
  void skipReactionsThatCannotBeBalanced() throws Exception {
    Reaction impossible = react(join(element(ElementSymbol.Na)), join(element(ElementSymbol.Cl)));
    var source = ReactionSource.of(
        List.of(SampleReactions.waterSynthesis(), impossible, SampleReactions.ironOxidation()));

    var stat = pipeline(2).process(source, writer).toCompletableFuture().get();

    assertEquals(2, stat.getCountOfSuccessfullyProcessed());
    assertEquals(1, stat.getCountOfErrors());
    assertTrue(stat.isFailed());
    Mockito.verify(writer, times(2)).write(any());
    assertTrue(impossible.getReactionType().isEmpty());
  }

  @Test
  void countAmbiguousReactions() throws Exception {
    var peroxide = combine(element(ElementSymbol.H, 2), element(ElementSymbol.O, 2));
    Reaction ambiguous = react(join(SampleReactions.HYDROGEN, SampleReactions.OXYGEN),
        join(SampleReactions.WATER, peroxide));

    var stat = pipeline(1).process(ReactionSource.of(List.of(ambiguous)), writer).toCompletableFuture().get();

    assertEquals(1, stat.getCountOfAmbiguous());
    assertEquals(1, stat.getCountOfSuccessfullyProcessed());
  }

  @Test
  void verificationFailureStopsTheStream() {
    var service = Mockito.mock(ReactionService.class);
    when(service.process(any())).thenThrow(new BalanceVerificationException("broken"));
    var properties = BalancingProperties.builder().parallelism(1).build();
    var pipeline = new BalancingPipeline(testKit.system(), service, properties);
    var source = ReactionSource.of(List.of(SampleReactions.waterSynthesis(), SampleReactions.ironOxidation()));

    var exception = assertThrows(ExecutionException.class,
        () -> pipeline.process(source, writer).toCompletableFuture().get());

    assertInstanceOf(CountableError.class, exception.getCause());
    MatcherAssert.assertThat(exception.getCause().getCause(),
        CoreMatchers.instanceOf(BalanceVerificationException.class));
    Mockito.verify(writer, Mockito.never()).write(any());
    Mockito.verify(service, times(1)).process(any());
  }

  @Test
  void sourceErrorFailsThePipeline() {
    ReactionSource source = () -> {
      throw new IllegalStateException("source is gone");
    };

    var exception = assertThrows(ExecutionException.class,
        () -> pipeline(1).process(source, writer).toCompletableFuture().get());

    assertInstanceOf(IllegalStateException.class, exception.getCause());
  }

  @Test
  void repeatedInstanceIsBalancedOnce() throws Exception {
    Reaction reaction = SampleReactions.ethaneCombustion();
    var source = ReactionSource.of(List.of(reaction, SampleReactions.waterSynthesis(), reaction));

    var stat = pipeline(4).process(source, writer).toCompletableFuture().get();

    assertEquals(2, stat.getCountOfSuccessfullyProcessed());
    assertEquals(0, stat.getCountOfErrors());
    Mockito.verify(writer, times(2)).write(any());
    assertEquals(List.of(2L, 7L, 4L, 6L), reaction.coefficients());
  }
}
