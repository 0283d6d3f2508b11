package com.onthegomap.toastiler.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.onthegomap.toastiler.geo.TilePos;
import com.onthegomap.toastiler.stats.Stats;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class WorkQueueTest {

  @Test
  @Timeout(10)
  void testDrainsAfterClose() {
    var queue = new WorkQueue<TilePos>("tiles", 4, Stats.inMemory());
    var writer = queue.writer();
    writer.accept(TilePos.ROOT);
    writer.accept(new TilePos(1, 1, 0));
    assertEquals(2, queue.getPending());
    queue.close();

    var reader = queue.reader();
    assertEquals(TilePos.ROOT, reader.get());
    assertEquals(new TilePos(1, 1, 0), reader.get());
    assertNull(reader.get());
    assertEquals(0, queue.getPending());
  }

  @Test
  @Timeout(10)
  void testWriterBlocksUntilReaderCatchesUp() {
    var queue = new WorkQueue<TilePos>("tiles", 1, Stats.inMemory());
    List<TilePos> tiles = TilePos.ROOT.children();
    var producer = CompletableFuture.runAsync(() -> {
      var writer = queue.writer();
      tiles.forEach(writer);
      queue.close();
    });

    List<TilePos> read = new ArrayList<>();
    for (TilePos tile : queue.reader()) {
      read.add(tile);
    }
    producer.join();
    assertEquals(tiles, read);
    assertEquals(1, queue.getCapacity());
  }

  @Test
  void testRejectsEmptyCapacity() {
    var stats = Stats.inMemory();
    assertThrows(IllegalArgumentException.class, () -> new WorkQueue<TilePos>("tiles", 0, stats));
  }
}
