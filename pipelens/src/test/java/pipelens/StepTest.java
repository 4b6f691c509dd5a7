/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class StepTest {
  Step root = Step.newRoot("parent");
  ExecutorService executor = Executors.newFixedThreadPool(4);

  @AfterEach void shutdown() {
    executor.shutdownNow();
  }

  @Test void sequentialChildren_treeAndFlattenInCreationOrder() throws Exception {
    root.run(parent -> {
      parent.step("child1", s -> "result1");
      parent.step("child2", s -> "result2");
      return null;
    });

    StepNode tree = root.toTree();
    assertThat(tree.substeps())
      .extracting(n -> n.meta().name(), n -> n.meta().result())
      .containsExactly(
        tuple("child1", TextNode.valueOf("result1")),
        tuple("child2", TextNode.valueOf("result2")));

    assertThat(root.flatten())
      .extracting(StepMeta::key)
      .containsExactly("parent", "parent.child1", "parent.child2");
  }

  @Test void flatten_sizeIsOnePlusChildren() throws Exception {
    root.run(parent -> {
      parent.step("a", a -> a.step("a1", s -> 1) + a.step("a2", s -> 2));
      parent.step("b", s -> 3);
      return null;
    });

    List<StepMeta> flattened = root.flatten();
    int expected = 1;
    for (Step child : root.children()) expected += child.flatten().size();
    assertThat(flattened).hasSize(expected).hasSize(5);
    assertThat(flattened.get(0).key()).isEqualTo(root.key());
    assertThat(flattened).extracting(StepMeta::key)
      .containsExactly("parent", "parent.a", "parent.a.a1", "parent.a.a2", "parent.b");
  }

  @Test void keys_replaceDotsInNames() throws Exception {
    Step root = Step.newRoot("my.pipeline");
    root.run(r -> r.step("v1.2", s -> null));

    assertThat(root.key()).isEqualTo("my_pipeline");
    assertThat(root.children().get(0).key()).isEqualTo("my_pipeline.v1_2");
    assertThat(root.children().get(0).name()).isEqualTo("v1.2");
  }

  @Test void keys_duplicateSiblingsGetDeterministicSuffix() throws Exception {
    root.run(parent -> {
      parent.step("fetch", s -> null);
      parent.step("fetch", s -> null);
      parent.step("fetch", s -> null);
      return null;
    });

    assertThat(root.children()).extracting(Step::key)
      .containsExactly("parent.fetch", "parent.fetch___1", "parent.fetch___2");
  }

  @Test void keys_suffixSkipsExplicitlyNamedSibling() throws Exception {
    root.run(parent -> {
      parent.step("fetch___1", s -> null);
      parent.step("fetch", s -> null);
      parent.step("fetch", s -> null);
      return null;
    });

    assertThat(root.children()).extracting(Step::key).doesNotHaveDuplicates()
      .containsExactly("parent.fetch___1", "parent.fetch", "parent.fetch___2");
  }

  @Test void error_storedOnStepAndRethrown() throws Exception {
    IllegalStateException boom = new IllegalStateException("boom");

    assertThatThrownBy(() -> root.run(parent -> parent.step("child", s -> {
      throw boom;
    }))).isSameAs(boom);

    assertThat(root.error()).isEqualTo("boom");
    assertThat(root.children().get(0).error()).isEqualTo("boom");
    assertThat(root.children().get(0).time().isFinished()).isTrue();
  }

  @Test void error_checkedExceptionRethrownUnchanged() throws Exception {
    Exception checked = new Exception("checked");

    assertThatThrownBy(() -> root.step("child", s -> {
      throw checked;
    })).isSameAs(checked);
  }

  @Test void error_fallsBackToTypeWhenMessageMissing() throws Exception {
    assertThatThrownBy(() -> root.step("child", s -> {
      throw new NullPointerException();
    })).isInstanceOf(NullPointerException.class);

    assertThat(root.children().get(0).error()).isEqualTo("java.lang.NullPointerException");
  }

  @Test void events_orderForSuccessAndError() throws Exception {
    List<String> events = new CopyOnWriteArrayList<>();
    for (StepEvent.Kind kind : StepEvent.Kind.values()) {
      root.on(kind, e -> events.add(e.kind().value() + ":" + e.step().key()));
    }

    try {
      root.run(parent -> {
        parent.step("ok", s -> {
          s.record("count", 3);
          return "done";
        });
        return parent.step("bad", s -> {
          throw new IllegalArgumentException("no");
        });
      });
    } catch (IllegalArgumentException expected) {
    }

    assertThat(events).containsExactly(
      "step-start:parent",
      "step-start:parent.ok",
      "step-record:parent.ok",
      "step-success:parent.ok",
      "step-complete:parent.ok",
      "step-start:parent.bad",
      "step-error:parent.bad",
      "step-complete:parent.bad",
      "step-error:parent",
      "step-complete:parent");
  }

  @Test void events_completeCarriesFinishedTime() throws Exception {
    List<TimeMeta> times = new ArrayList<>();
    root.on(StepEvent.Kind.STEP_START, e -> times.add(e.step().time()));
    root.on(StepEvent.Kind.STEP_COMPLETE, e -> times.add(e.step().time()));

    root.run(parent -> null);

    assertThat(times.get(0).endTs()).isNull();
    assertThat(times.get(0).timeUsageMs()).isNull();
    assertThat(times.get(1).endTs()).isGreaterThanOrEqualTo(times.get(1).startTs());
    assertThat(times.get(1).timeUsageMs())
      .isEqualTo(times.get(1).endTs() - times.get(1).startTs());
  }

  @Test void events_listenerFailureDoesntReachStep() throws Exception {
    root.on(StepEvent.Kind.STEP_START, e -> {
      throw new IllegalStateException("listener bug");
    });

    assertThat(root.<Integer>run(parent -> parent.step("child", s -> 42))).isEqualTo(42);
  }

  @Test void record_keepsInsertionOrderAndEmitsValue() throws Exception {
    List<StepEvent> records = new ArrayList<>();
    root.on(StepEvent.Kind.STEP_RECORD, records::add);

    root.run(parent -> {
      parent.record("z", 1);
      parent.record("a", "two");
      parent.record("z", 3);
      return null;
    });

    assertThat(root.records()).containsExactly(
      org.assertj.core.api.Assertions.entry("z", IntNode.valueOf(3)),
      org.assertj.core.api.Assertions.entry("a", TextNode.valueOf("two")));
    assertThat(records).extracting(StepEvent::recordKey).containsExactly("z", "a", "z");
  }

  @Test void snapshotsMidRun_reportRunningSteps() throws Exception {
    root.run(parent -> parent.step("child", child -> {
      List<StepMeta> flattened = root.flatten();
      assertThat(flattened).hasSize(2);
      assertThat(flattened).allSatisfy(s -> assertThat(s.time().endTs()).isNull());
      return null;
    }));

    assertThat(root.flatten()).allSatisfy(s -> assertThat(s.time().isFinished()).isTrue());
  }

  @Test void run_onlyOnce() throws Exception {
    root.run(parent -> null);

    assertThatThrownBy(() -> root.run(parent -> null))
      .isInstanceOf(IllegalStateException.class);
  }

  @Test void stepAsync_concurrentSiblingsKeyedInCreationOrder() throws Exception {
    CountDownLatch bothStarted = new CountDownLatch(2);
    root.run(parent -> {
      CompletableFuture<String> a = parent.stepAsync("work", s -> {
        bothStarted.countDown();
        bothStarted.await(5, TimeUnit.SECONDS);
        return "a";
      }, executor);
      CompletableFuture<String> b = parent.stepAsync("work", s -> {
        bothStarted.countDown();
        bothStarted.await(5, TimeUnit.SECONDS);
        return "b";
      }, executor);
      return a.get(5, TimeUnit.SECONDS) + b.get(5, TimeUnit.SECONDS);
    });

    assertThat(root.result()).isEqualTo(TextNode.valueOf("ab"));
    assertThat(root.children()).extracting(Step::key)
      .containsExactly("parent.work", "parent.work___1");
    assertThat(root.children()).extracting(Step::result)
      .containsExactly(TextNode.valueOf("a"), TextNode.valueOf("b"));
  }

  @Test void stepAsync_failureCompletesFutureExceptionally() throws Exception {
    CompletableFuture<Object> failed = root.stepAsync("bad", s -> {
      throw new IllegalStateException("async boom");
    }, executor);

    assertThatThrownBy(() -> failed.get(5, TimeUnit.SECONDS))
      .hasCauseInstanceOf(IllegalStateException.class)
      .hasRootCauseMessage("async boom");
    assertThat(root.children().get(0).error()).isEqualTo("async boom");
  }

  @Test void record_droppedOnceFinished() throws Exception {
    List<StepEvent> records = new ArrayList<>();
    root.on(StepEvent.Kind.STEP_RECORD, records::add);
    CompletableFuture<Object> done = root.stepAsync("child", s -> {
      s.record("rows", 1);
      return null;
    }, executor);
    done.get(5, TimeUnit.SECONDS);
    Step child = root.children().get(0);

    child.record("rows", 2);
    child.record("late", true);

    assertThat(child.records()).containsOnlyKeys("rows").containsEntry("rows", IntNode.valueOf(1));
    assertThat(child.meta().records()).isEqualTo(child.records());
    assertThat(records).extracting(StepEvent::recordKey).containsExactly("rows");
  }

  @Test void record_concurrentWritersAllVisible() throws Exception {
    root.run(parent -> {
      List<CompletableFuture<Void>> futures = new ArrayList<>();
      for (int i = 0; i < 50; i++) {
        int n = i;
        futures.add(CompletableFuture.runAsync(() -> parent.record("k" + n, n), executor));
      }
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
      return null;
    });

    assertThat(root.records()).hasSize(50);
  }
}
