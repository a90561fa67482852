package nl.adgroot.submittals;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import nl.adgroot.submittals.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AppExecutors implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(AppExecutors.class);

  private final ExecutorService cpuPool;
  private final ExecutorService conversionPool;

  private AppExecutors(ExecutorService cpuPool, ExecutorService conversionPool) {
    this.cpuPool = cpuPool;
    this.conversionPool = conversionPool;
  }

  public static AppExecutors create(AppConfig cfg) {
    int cpuThreads = Math.max(1, cfg.extraction.threads);
    int conversionThreads = Math.max(1, cfg.conversion.concurrency);

    ExecutorService cpuPool = Executors.newFixedThreadPool(cpuThreads, named("extract-worker-"));

    // pool size is the bound on simultaneous conversion requests
    ExecutorService conversionPool = Executors.newFixedThreadPool(conversionThreads, named("convert-worker-"));

    return new AppExecutors(cpuPool, conversionPool);
  }

  private static ThreadFactory named(String prefix) {
    return new ThreadFactory() {
      private final AtomicInteger n = new AtomicInteger(1);

      @Override
      public Thread newThread(Runnable r) {
        Thread t = new Thread(r, prefix + n.getAndIncrement());
        t.setDaemon(false);
        return t;
      }
    };
  }

  public ExecutorService cpuPool() {
    return cpuPool;
  }

  public ExecutorService conversionPool() {
    return conversionPool;
  }

  @Override
  public void close() throws InterruptedException {
    // stop accepting new tasks
    cpuPool.shutdown();
    conversionPool.shutdown();

    await(cpuPool, "cpuPool");
    await(conversionPool, "conversionPool");
  }

  private static void await(ExecutorService es, String name) throws InterruptedException {
    if (!es.awaitTermination(1, TimeUnit.MINUTES)) {
      es.shutdownNow();
      if (!es.awaitTermination(30, TimeUnit.SECONDS)) {
        log.error("Executor did not terminate: {}", name);
      }
    }
  }
}
