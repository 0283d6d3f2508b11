package com.onthegomap.toastiler.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.onthegomap.toastiler.stats.Stats;
import com.onthegomap.toastiler.util.LogStage;
import com.onthegomap.toastiler.util.ToastilerException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class WorkerTest {

  @Test
  @Timeout(10)
  void testExceptionHandled() {
    AtomicInteger started = new AtomicInteger();
    var worker = new Worker("prefix", Stats.inMemory(), 4, () -> {
      if (started.incrementAndGet() == 1) {
        throw new IllegalStateException("expected");
      } else {
        Thread.sleep(500);
      }
    });
    var exception = assertThrows(IllegalStateException.class, worker::await);
    assertEquals("expected", exception.getMessage());
  }

  @Test
  @Timeout(10)
  void testCheckedExceptionWrapped() {
    var worker = new Worker("prefix", Stats.inMemory(), 1, () -> {
      throw new Exception("checked");
    });
    var exception = assertThrows(ToastilerException.class, worker::await);
    assertEquals("checked", exception.getCause().getMessage());
  }

  @Test
  @Timeout(10)
  void testRunsInAllThreads() {
    AtomicInteger ran = new AtomicInteger();
    new Worker("prefix", Stats.inMemory(), 3, ran::incrementAndGet).await();
    assertEquals(3, ran.get());
  }

  @Test
  @Timeout(10)
  void testThreadsLogUnderParentStage() {
    var stats = Stats.inMemory();
    Set<String> stages = ConcurrentHashMap.newKeySet();
    Set<String> names = ConcurrentHashMap.newKeySet();
    var stage = stats.startStage("pyramid");
    try {
      new Worker("pyramid_sample", stats, 2, () -> {
        stages.add(LogStage.get());
        names.add(Thread.currentThread().getName());
      }).await();
    } finally {
      stage.stop();
    }
    assertEquals(Set.of("pyramid:sample"), stages);
    assertEquals(Set.of("pyramid_sample-0", "pyramid_sample-1"), names);
    assertEquals(2, stats.timers().all().get("pyramid").workers().size());
  }
}
