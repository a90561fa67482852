package nl.adgroot.submittals.convert;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/** Thread-safe progress of a conversion batch, formatted for the log. */
public class ConversionProgress {
  private final int total;
  private final AtomicInteger done = new AtomicInteger();
  private final AtomicInteger failed = new AtomicInteger();
  private final Instant startAll;

  private final LongAdder sumMillis = new LongAdder();

  public ConversionProgress(int total) {
    this(total, Instant.now());
  }

  ConversionProgress(int total, Instant startAll) {
    this.total = total;
    this.startAll = startAll;
  }

  public void finishDocument(long millis, boolean success) {
    done.incrementAndGet();
    if (!success) failed.incrementAndGet();
    sumMillis.add(millis);
  }

  public int done() {
    return done.get();
  }

  public int failed() {
    return failed.get();
  }

  public String formatStatus(long lastMillis) {
    return formatStatus(lastMillis, Instant.now());
  }

  String formatStatus(long lastMillis, Instant now) {
    int d = done.get();
    int remaining = total - d;

    Duration elapsed = Duration.between(startAll, now);
    double elapsedSec = Math.max(0.001, elapsed.toMillis() / 1000.0);

    double throughput = d / elapsedSec; // documents/sec
    long etaSec = (throughput <= 0) ? 0 : (long) Math.ceil(remaining / throughput);

    double pct = total == 0 ? 100.0 : (d * 100.0) / total;
    long avgMillis = d == 0 ? 0 : sumMillis.sum() / d;

    return String.format(
        "Converted %d/%d (%.2f%%) | failed=%d | last=%s | avg=%s | elapsed=%s | ETA=%s",
        d, total, pct, failed.get(),
        fmtDuration(Duration.ofMillis(lastMillis)),
        fmtDuration(Duration.ofMillis(avgMillis)),
        fmtDuration(elapsed),
        fmtDuration(Duration.ofSeconds(etaSec))
    );
  }

  static String fmtDuration(Duration d) {
    long s = d.getSeconds();
    long h = s / 3600;
    long m = (s % 3600) / 60;
    long sec = s % 60;
    if (h > 0) return String.format("%dh %02dm %02ds", h, m, sec);
    if (m > 0) return String.format("%dm %02ds", m, sec);
    return String.format("%ds", sec);
  }
}
