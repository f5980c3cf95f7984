package com.marketfeed.stream.connection;

import java.lang.management.ManagementFactory;

@FunctionalInterface
public interface MemoryProbe {
  long usedHeapBytes();

  static MemoryProbe jvmHeap() {
    return () -> ManagementFactory.getMemoryMXBean().getHeapMemoryUsage().getUsed();
  }
}
