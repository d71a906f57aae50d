package leakcheck.uarch;

import java.util.OptionalLong;

/**
 * Outcome of one cache access.
 *
 * @param hit whether the line was already cached
 * @param line the accessed line
 * @param evictedLine the line displaced to make room, if any
 */
public record CacheAccess(boolean hit, long line, OptionalLong evictedLine) {}
