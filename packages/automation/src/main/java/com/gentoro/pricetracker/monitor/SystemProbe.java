package com.gentoro.pricetracker.monitor;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/** Reads raw resource usage. Replaceable so monitors can be exercised with fixed readings. */
public interface SystemProbe {

  MetricsSample sample(Instant now) throws IOException;

  /** Probe backed by the JVM runtime, the platform MXBeans and the file store of {@code disk}. */
  static SystemProbe jvm(Path disk) {
    return now -> {
      Runtime rt = Runtime.getRuntime();
      long used = rt.totalMemory() - rt.freeMemory();
      long max = rt.maxMemory() == Long.MAX_VALUE ? rt.totalMemory() : rt.maxMemory();

      FileStore store = Files.getFileStore(disk);
      long total = store.getTotalSpace();
      long free = store.getUsableSpace();

      double load = ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage();
      int cpus = Runtime.getRuntime().availableProcessors();
      double cpuPercent = load < 0 ? -1 : Math.min(100.0, load / cpus * 100.0);

      return new MetricsSample(
          now,
          max > 0 ? used * 100.0 / max : 0.0,
          used / 1024.0 / 1024.0,
          total > 0 ? (total - free) * 100.0 / total : 0.0,
          free / 1024.0 / 1024.0 / 1024.0,
          cpuPercent,
          ManagementFactory.getThreadMXBean().getThreadCount());
    };
  }
}
