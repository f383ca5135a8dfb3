package pipeline;

import hw.BatteryMonitor;
import hw.MemoryGuard;
import hw.DisplayService;
import io.ImageLoader;
import util.PixelBuffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Dimension;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Protects many files at once. Each file is an independent job with its own
 * buffer and generator, so the worker pool never shares mutable state between
 * jobs and every output equals a standalone run with the same settings.
 * <p>
 * Worker count follows the power policy and is capped by the memory guard;
 * {@code -Dprotect.threads=N} overrides both.
 */
public class PipelineOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final BatteryMonitor.PowerState power;
    private final MemoryGuard memory;
    private final int cores;

    public PipelineOrchestrator(BatteryMonitor.PowerState power, MemoryGuard memory) {
        this(power, memory, Runtime.getRuntime().availableProcessors());
    }

    PipelineOrchestrator(BatteryMonitor.PowerState power, MemoryGuard memory, int cores) {
        this.power = power;
        this.memory = memory;
        this.cores = Math.max(1, cores);
    }

    // ---- policy helpers ----
    int threadsFromPolicy() {
        if (power.onAC() || power.batteryPercent() >= 80)
            return Math.min(cores * 2, cores + 4);
        if (power.batteryPercent() >= 40)
            return cores;
        return Math.max(1, cores / 2);
    }

    int workerCount(long jobBytes, int jobs) {
        String forced = System.getProperty("protect.threads");
        if (forced != null) {
            try {
                return Math.max(1, Integer.parseInt(forced.trim()));
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring protect.threads='{}': not an integer", forced);
            }
        }
        int byPower = threadsFromPolicy();
        int byMemory = memory.maxConcurrent(jobBytes);
        return Math.max(1, Math.min(Math.min(byPower, byMemory), jobs));
    }

    public BatchResult protectAll(List<BatchJob> jobs, ProtectionSettings settings) throws InterruptedException {
        if (jobs.isEmpty())
            return new BatchResult(List.of(), Map.of());
        long t0 = System.nanoTime();

        long jobBytes = largestJobBytes(jobs);
        int threads = workerCount(jobBytes, jobs.size());
        LOG.info("Batch: {} file(s), {} worker(s) (onAC={}, battery={}%, job~{} KB)",
                jobs.size(), threads, power.onAC(), power.batteryPercent(), jobBytes / 1024);

        ArrayBlockingQueue<Runnable> queue = new ArrayBlockingQueue<>(Math.max(2, threads));
        ThreadPoolExecutor exec = new ThreadPoolExecutor(
                threads, threads, 60, TimeUnit.SECONDS, queue,
                new ThreadPoolExecutor.CallerRunsPolicy());

        Path[] written = new Path[jobs.size()];
        String[] errors = clashingOutputs(jobs);
        CountDownLatch latch = new CountDownLatch(jobs.size());
        AtomicInteger failed = new AtomicInteger();

        try {
            for (int i = 0; i < jobs.size(); i++) {
                final int n = i;
                final BatchJob job = jobs.get(i);
                if (errors[n] != null) {
                    failed.incrementAndGet();
                    LOG.warn("Skipping {}: {}", job.input(), errors[n]);
                    latch.countDown();
                    continue;
                }
                exec.execute(() -> {
                    try {
                        written[n] = runJob(job, settings);
                    } catch (IOException | RuntimeException e) {
                        errors[n] = e.getMessage() != null ? e.getMessage() : e.toString();
                        failed.incrementAndGet();
                        LOG.warn("Failed to protect {}: {}", job.input(), errors[n]);
                    } finally {
                        latch.countDown();
                    }
                });
            }

            latch.await();

            long totalMs = Math.round((System.nanoTime() - t0) / 1e6);
            LOG.info("Stats: threads={} files={} failed={} total={} ms",
                    exec.getCorePoolSize(), jobs.size(), failed.get(), totalMs);
        } finally {
            exec.shutdown();
            if (!exec.awaitTermination(30, TimeUnit.SECONDS))
                exec.shutdownNow();
        }

        List<Path> ok = new ArrayList<>();
        Map<Path, String> failures = new LinkedHashMap<>();
        for (int i = 0; i < jobs.size(); i++) {
            if (written[i] != null)
                ok.add(written[i]);
            else
                failures.put(jobs.get(i).input(), errors[i] != null ? errors[i] : "not processed");
        }
        return new BatchResult(ok, failures);
    }

    /**
     * Jobs writing to an output already claimed by an earlier job get an error
     * message at their index; the first claimant still runs.
     */
    static String[] clashingOutputs(List<BatchJob> jobs) {
        String[] errors = new String[jobs.size()];
        Map<Path, Path> claimed = new HashMap<>();
        for (int i = 0; i < jobs.size(); i++) {
            BatchJob job = jobs.get(i);
            Path out = job.output().toAbsolutePath().normalize();
            Path owner = claimed.putIfAbsent(out, job.input());
            if (owner != null)
                errors[i] = "output " + out + " is already written by " + owner;
        }
        return errors;
    }

    private static Path runJob(BatchJob job, ProtectionSettings settings) throws IOException {
        PixelBuffer original = ImageLoader.load(job.input());
        PixelBuffer protectedImage = settings.applyTo(original);
        return DisplayService.save(protectedImage, job.output());
    }

    private static long largestJobBytes(List<BatchJob> jobs) {
        long max = 0;
        for (BatchJob job : jobs) {
            try {
                Dimension d = ImageLoader.probe(job.input());
                if (d != null)
                    max = Math.max(max, MemoryGuard.estimateJobBytes(d.width, d.height));
            } catch (IOException e) {
                // the job itself will fail and report it
                LOG.debug("Could not probe {}: {}", job.input(), e.getMessage());
            }
        }
        return max;
    }
}
