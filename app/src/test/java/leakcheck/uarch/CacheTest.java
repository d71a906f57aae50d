package leakcheck.uarch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class CacheTest {

  @Test
  void secondAccessToALineHits() {
    Cache cache = new Cache(new CacheConfig(6, 0, 2));
    CacheAccess first = cache.read(0x40);
    CacheAccess second = cache.read(0x7F);

    assertFalse(first.hit(), "Cold line misses");
    assertTrue(second.hit(), "0x7F shares the 64-byte line of 0x40");
    assertEquals(1L, second.line(), "Line index is the address without offset bits");
  }

  @Test
  void leastRecentlyUsedLineIsEvicted() {
    Cache cache = new Cache(new CacheConfig(6, 0, 2));
    cache.read(0x000);
    cache.read(0x040);
    cache.read(0x000);
    CacheAccess third = cache.read(0x080);

    assertEquals(1L, third.evictedLine().orElseThrow(), "Line 1 was used least recently");
    assertTrue(cache.contains(0x000), "Recently touched line stays");
    assertFalse(cache.contains(0x040), "Evicted line is gone");
    assertEquals(List.of(0L, 2L), List.copyOf(cache.cachedLines()), "Lines in index order");
  }

  @Test
  void setsAreIndependent() {
    Cache cache = new Cache(new CacheConfig(6, 1, 1));
    cache.read(0x000);
    CacheAccess otherSet = cache.read(0x040);
    CacheAccess sameSet = cache.read(0x080);

    assertTrue(otherSet.evictedLine().isEmpty(), "Odd lines map to the other set");
    assertEquals(0L, sameSet.evictedLine().orElseThrow(), "Line 2 replaces line 0 in set 0");
  }

  @Test
  void writesAllocateTheirLine() {
    Cache cache = new Cache(new CacheConfig(6, 0, 4));
    CacheAccess write = cache.write(0x100);

    assertFalse(write.hit(), "First write misses");
    assertTrue(cache.read(0x108).hit(), "A later read of the same line hits");
    cache.flush();
    assertTrue(cache.cachedLines().isEmpty(), "Flush empties every set");
  }

  @Test
  void primingFillsEverySetWithLinesOutsideTheProgram() {
    Cache cache = new Cache(new CacheConfig(6, 1, 2));
    cache.prime(16);

    assertEquals(
        Set.of(0x3FCL, 0x3FDL, 0x3FEL, 0x3FFL),
        cache.cachedLines(),
        "Two ways in each of the two sets, taken from the top of the address space");
    assertFalse(cache.contains(0x0), "Low addresses stay uncached");
    CacheAccess access = cache.read(0x0);
    assertEquals(
        0x3FCL, access.evictedLine().orElseThrow(), "The LRU primed line of set 0 goes first");
  }

  @Test
  void copiesCompareByContents() {
    Cache cache = new Cache(new CacheConfig(6, 0, 4));
    cache.read(0x40);
    Cache copy = cache.copy();
    assertEquals(cache, copy, "A copy has the same lines");

    copy.read(0x80);
    assertNotEquals(cache, copy, "Copies evolve independently");
  }

  @Test
  void geometryIsChecked() {
    assertThrows(
        IllegalArgumentException.class, () -> new CacheConfig(6, 0, 0), "Zero ways rejected");
    assertEquals(8L, new CacheConfig(6, 2, 2).capacity(), "4 sets of 2 ways");
  }
}
