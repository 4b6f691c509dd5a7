/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import pipelens.storage.InMemoryStorage;
import pipelens.storage.StepConsumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineTest {
  @Mock StepConsumer consumer;

  @Test void build_autoSaveWithoutConsumerFailsImmediately() {
    assertThatThrownBy(() -> Pipeline.newBuilder("etl")
      .autoSave(Pipeline.AutoSave.ON_FINISH)
      .build())
      .isInstanceOf(ConfigurationException.class)
      .hasMessageContaining("consumer");

    assertThatThrownBy(() -> Pipeline.newBuilder("etl")
      .autoSave(Pipeline.AutoSave.REAL_TIME)
      .build())
      .isInstanceOf(ConfigurationException.class);
  }

  @Test void build_generatesRunId() {
    Pipeline first = Pipeline.newBuilder("etl").build();
    Pipeline second = Pipeline.newBuilder("etl").build();

    assertThat(first.runId()).isNotEmpty().isNotEqualTo(second.runId());
    assertThat(Pipeline.newBuilder("etl").runId("r1").build().runId()).isEqualTo("r1");
  }

  @Test void off_neverPersists() throws Exception {
    Pipeline pipeline = Pipeline.newBuilder("etl").consumer(consumer).build();

    pipeline.run(root -> root.step("a", s -> 1));

    verifyNoInteractions(consumer);
  }

  @Test void onFinish_finishRunOnceWithCompleted() throws Exception {
    when(consumer.finishRun(any(), any())).thenReturn(Call.create(null));
    Pipeline pipeline = Pipeline.newBuilder("etl")
      .runId("r1")
      .autoSave(Pipeline.AutoSave.ON_FINISH)
      .consumer(consumer)
      .build();

    pipeline.run(root -> {
      root.step("a", s -> 1);
      root.step("b", s -> 2);
      return null;
    });

    verify(consumer, times(1)).finishRun(
      argThat(meta -> meta.runId().equals("r1") && meta.steps().size() == 3),
      eq(RunStatus.COMPLETED));
    verify(consumer, times(0)).initiateRun(any());
    verify(consumer, times(0)).finishStep(any(), any());
  }

  @Test void onFinish_failedWhenChildErrorPropagates() throws Exception {
    InMemoryStorage storage = InMemoryStorage.newBuilder().build();
    Pipeline pipeline = Pipeline.newBuilder("etl")
      .runId("r1")
      .autoSave(Pipeline.AutoSave.ON_FINISH)
      .consumer(storage.stepConsumer())
      .build();

    assertThatThrownBy(() -> pipeline.run(root -> root.step("child", s -> {
      throw new IllegalStateException("boom");
    }))).hasMessage("boom");

    RunMeta run = storage.stepStore().getRunData("r1").execute().meta();
    assertThat(run.status()).isEqualTo(RunStatus.FAILED);
    assertThat(storage.stepStore().listRunSteps("r1").execute())
      .filteredOn(s -> s.key().equals("etl.child"))
      .extracting(StepMeta::error).containsExactly("boom");
  }

  @Test void realTime_ordersCallsAroundEachStep() throws Exception {
    when(consumer.initiateRun(any())).thenReturn(Call.create(null));
    when(consumer.initiateStep(any(), any())).thenReturn(Call.create(null));
    when(consumer.finishStep(any(), any())).thenReturn(Call.create(null));
    when(consumer.finishRun(any(), any())).thenReturn(Call.create(null));
    Pipeline pipeline = Pipeline.newBuilder("etl")
      .runId("r1")
      .autoSave(Pipeline.AutoSave.REAL_TIME)
      .consumer(consumer)
      .build();

    pipeline.run(root -> root.step("a", s -> 1));

    InOrder inOrder = inOrder(consumer);
    inOrder.verify(consumer).initiateRun(argThat(meta -> meta.status() == RunStatus.RUNNING));
    inOrder.verify(consumer).initiateStep(eq("r1"), argThat(s -> s.key().equals("etl")));
    inOrder.verify(consumer).initiateStep(eq("r1"), argThat(s -> s.key().equals("etl.a")));
    inOrder.verify(consumer).finishStep(eq("r1"),
      argThat(s -> s.key().equals("etl.a") && s.time().isFinished()));
    inOrder.verify(consumer).finishStep(eq("r1"), argThat(s -> s.key().equals("etl")));
    inOrder.verify(consumer).finishRun(any(), eq(RunStatus.COMPLETED));
    inOrder.verifyNoMoreInteractions();
  }

  @Test void realTime_persistenceFailureDoesntReachTrackedCode() throws Exception {
    when(consumer.initiateRun(any())).thenReturn(failingCall());
    when(consumer.initiateStep(any(), any())).thenThrow(new IllegalStateException("closed"));
    when(consumer.finishStep(any(), any())).thenReturn(failingCall());
    when(consumer.finishRun(any(), any())).thenReturn(failingCall());
    Pipeline pipeline = Pipeline.newBuilder("etl")
      .autoSave(Pipeline.AutoSave.REAL_TIME)
      .consumer(consumer)
      .build();

    assertThat(pipeline.<String>run(root -> root.step("a", s -> "ok"))).isEqualTo("ok");

    verify(consumer).finishRun(any(), eq(RunStatus.COMPLETED));
  }

  @Test void realTime_storageSeesOneRecordPerStep() throws Exception {
    InMemoryStorage storage = InMemoryStorage.newBuilder().build();
    Pipeline pipeline = Pipeline.newBuilder("etl")
      .runId("r1")
      .autoSave(Pipeline.AutoSave.REAL_TIME)
      .consumer(storage.stepConsumer())
      .build();

    pipeline.run(root -> {
      root.step("a", s -> 1);
      root.step("b", s -> 2);
      return null;
    });

    List<StepMeta> steps = storage.stepStore().listRunSteps("r1").execute();
    assertThat(steps).extracting(StepMeta::key).containsExactly("etl", "etl.a", "etl.b");
    assertThat(steps).allSatisfy(s -> assertThat(s.time().isFinished()).isTrue());
    assertThat(storage.stepStore().getRunData("r1").execute().meta().status())
      .isEqualTo(RunStatus.COMPLETED);
  }

  @Test void outputPipelineMeta_isFlattenedRun() throws Exception {
    Pipeline pipeline = Pipeline.newBuilder("etl").runId("r1").build();
    pipeline.run(root -> {
      root.record("source", "s3");
      return root.step("a", s -> 1);
    });

    PipelineMeta meta = pipeline.outputPipelineMeta();
    assertThat(meta.runId()).isEqualTo("r1");
    assertThat(meta.logVersion()).isEqualTo(PipelineMeta.LOG_VERSION);
    assertThat(meta.name()).isEqualTo("etl");
    assertThat(meta.records()).containsKey("source");
    assertThat(meta.steps()).isEqualTo(pipeline.flatten());
    assertThat(meta.status()).isEqualTo(RunStatus.COMPLETED);
  }

  static Call<Void> failingCall() {
    return new Call.Base<Void>() {
      @Override protected Void doExecute() throws IOException {
        throw new IOException("disk full");
      }

      @Override public Call<Void> clone() {
        return failingCall();
      }
    };
  }
}
