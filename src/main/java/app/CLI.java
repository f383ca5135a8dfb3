package app;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import hw.BatteryMonitor;
import hw.DisplayService;
import hw.MemoryGuard;
import io.ImageLoader;
import pipeline.BatchJob;
import pipeline.BatchResult;
import pipeline.PipelineOrchestrator;
import pipeline.ProtectionMode;
import pipeline.ProtectionSettings;
import post.PostShell;
import util.InvalidInputException;
import util.PixelBuffer;
import watermark.Overlay;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Command line entry for the image protection pipeline.
 * Example:
 * # single image, repeatable run
 * mvn -q exec:java -Dexec.args="--input=photo.png --mode=strong --strength=30 --seed=42"
 *
 * # several images into one folder, text watermark
 * mvn -q exec:java -Dexec.args="--input=a.png,b.jpg --output=out --mode=aipoison --text=mine"
 *
 * # battery policy can be forced for the batch worker pool:
 * -DforceOnAC=false -DforceBatteryLevel=35
 */
public final class CLI {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_READ = 2;
    static final int EXIT_WRITE = 3;

    // -------------------- Args --------------------
    static final class Args {
        @Parameter(names = "--input", description = "Input image path(s), repeat or comma separate", required = true)
        List<String> inputs = new ArrayList<>();

        @Parameter(names = "--output", description = "Output file (one input) or directory (several inputs)")
        String output;

        @Parameter(names = "--mode", description = "soft | balanced | strong | aipoison (or 0..3)")
        String mode = "balanced";

        @Parameter(names = "--strength", description = "Strength [0..50]")
        int strength = ProtectionSettings.DEFAULT_STRENGTH;

        @Parameter(names = "--seed", description = "Seed; omit for a random one (printed so the run can be repeated)")
        Long seed;

        @Parameter(names = "--watermark", description = "Watermark image burned into the output")
        String watermark;

        @Parameter(names = "--wm-x", description = "Watermark left edge in image pixels")
        int wmX = 0;

        @Parameter(names = "--wm-y", description = "Watermark top edge in image pixels")
        int wmY = 0;

        @Parameter(names = "--wm-scale", description = "Watermark scale factor")
        double wmScale = 1.0;

        @Parameter(names = "--opacity", description = "Watermark opacity [0..1]")
        double opacity = ProtectionSettings.DEFAULT_OPACITY;

        @Parameter(names = "--text", description = "Tiled circular text watermark")
        String text;

        @Parameter(names = "--shell", description = "Open the post-processing shell (single input only)")
        boolean shell = false;

        @Parameter(names = "--open", description = "Open the written image with the desktop viewer")
        boolean open = false;

        @Parameter(names = { "-h", "--help" }, help = true, description = "Show help")
        boolean help = false;
    }

    private CLI() {
    }

    public static void main(String[] argv) {
        int code = run(argv, System.out, System.err);
        if (code != EXIT_OK)
            System.exit(code);
    }

    static int run(String[] argv, PrintStream out, PrintStream err) {
        Args args = new Args();
        JCommander jc = JCommander.newBuilder().addObject(args).programName("image-protect").build();
        try {
            jc.parse(argv);
        } catch (ParameterException pe) {
            err.println(pe.getMessage());
            StringBuilder usage = new StringBuilder();
            jc.getUsageFormatter().usage(usage);
            err.println(usage);
            return EXIT_USAGE;
        }
        if (args.help) {
            StringBuilder usage = new StringBuilder();
            jc.getUsageFormatter().usage(usage);
            out.println(usage);
            return EXIT_OK;
        }

        long seed = args.seed != null ? args.seed : ThreadLocalRandom.current().nextInt(10_000);
        ProtectionSettings settings;
        try {
            settings = new ProtectionSettings(ProtectionMode.parse(args.mode), args.strength, seed,
                    null, args.text, args.opacity);
        } catch (InvalidInputException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        List<Path> inputs = new ArrayList<>();
        for (String s : args.inputs)
            inputs.add(Paths.get(s));
        if (args.shell && inputs.size() > 1) {
            err.println("--shell needs exactly one --input");
            return EXIT_USAGE;
        }

        // Banner
        out.println("== Image Protect ==");
        out.println("Input: " + (inputs.size() == 1 ? inputs.get(0) : inputs.size() + " files"));
        out.println("Mode: " + settings.mode().label() + "  Strength: " + settings.strength() + "  Seed: " + seed);

        if (args.watermark != null) {
            try {
                PixelBuffer wm = ImageLoader.load(Paths.get(args.watermark));
                settings = settings.withOverlay(new Overlay(wm, args.wmX, args.wmY, args.wmScale));
                settings.overlay().placement(); // validates the scale up front
            } catch (IOException e) {
                err.println(e.getMessage());
                return EXIT_READ;
            } catch (InvalidInputException e) {
                err.println(e.getMessage());
                return EXIT_USAGE;
            }
        }

        return inputs.size() == 1
                ? single(inputs.get(0), args, settings, out, err)
                : batch(inputs, args, settings, out, err);
    }

    private static int single(Path inPath, Args args, ProtectionSettings settings, PrintStream out,
            PrintStream err) {
        PixelBuffer original;
        try {
            original = ImageLoader.load(inPath);
        } catch (IOException e) {
            err.println(e.getMessage());
            return EXIT_READ;
        }

        long t0 = System.nanoTime();
        PixelBuffer processed = settings.applyTo(original);
        long totalMs = Math.round((System.nanoTime() - t0) / 1e6);

        Path target = args.output != null ? Paths.get(args.output) : defaultOutput(inPath, null);
        Path written;
        try {
            written = args.open ? DisplayService.saveAndOpen(processed, target) : DisplayService.save(processed, target);
        } catch (IOException e) {
            err.println("Failed to write output: " + e.getMessage());
            return EXIT_WRITE;
        }
        out.println("Total processing: " + totalMs + " ms");
        out.println("Written to: " + written);

        if (args.shell) {
            Path dir = written.getParent() != null ? written.getParent() : Paths.get(".");
            BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new PostShell(original, settings, dir, stdin, out).run();
        }
        return EXIT_OK;
    }

    private static int batch(List<Path> inputs, Args args, ProtectionSettings settings, PrintStream out,
            PrintStream err) {
        Path dir = args.output != null ? Paths.get(args.output) : null;
        if (dir != null && Files.exists(dir) && !Files.isDirectory(dir)) {
            err.println("--output must be a directory when several inputs are given: " + dir);
            return EXIT_USAGE;
        }
        List<BatchJob> jobs = new ArrayList<>();
        for (Path in : inputs)
            jobs.add(new BatchJob(in, defaultOutput(in, dir)));

        PipelineOrchestrator orchestrator = new PipelineOrchestrator(
                BatteryMonitor.current(), new MemoryGuard(0.6 /* 60% of free heap */, 256 * 1024));
        BatchResult result;
        try {
            result = orchestrator.protectAll(jobs, settings);
        } catch (InterruptedException e) {
            err.println("Processing interrupted: " + e.getMessage());
            Thread.currentThread().interrupt();
            return EXIT_WRITE;
        }

        for (Path p : result.written())
            out.println("Written to: " + p);
        for (Map.Entry<Path, String> f : result.failures().entrySet())
            err.println("Failed: " + f.getKey() + " (" + f.getValue() + ")");
        return result.isSuccess() ? EXIT_OK : EXIT_WRITE;
    }

    /** {@code <name>_protected.png} next to the input, or inside {@code dir} when given. */
    static Path defaultOutput(Path input, Path dir) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String file = stem + "_protected.png";
        if (dir != null)
            return dir.resolve(file);
        return input.getParent() != null ? input.getParent().resolve(file) : Paths.get(file);
    }
}
