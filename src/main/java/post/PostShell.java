package post;

import hw.DisplayService;
import io.ImageLoader;
import pipeline.ProtectionMode;
import pipeline.ProtectionSettings;
import util.InvalidInputException;
import util.PixelBuffer;
import watermark.Overlay;
import watermark.ViewMapping;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;

/**
 * Interactive shell for tuning a protection after the first run. Every
 * settings change re-protects from the untouched original, so results never
 * stack on top of each other.
 */
public class PostShell {
    private final PixelBuffer original;
    private final Path outputDir;
    private final BufferedReader in;
    private final PrintStream out;

    private ProtectionSettings settings;
    private PixelBuffer image;
    private Path lastPath;

    public PostShell(PixelBuffer original, ProtectionSettings settings, Path outputDir,
            BufferedReader in, PrintStream out) {
        this.original = original;
        this.settings = settings;
        this.outputDir = outputDir;
        this.in = in;
        this.out = out;
        this.image = settings.applyTo(original);
    }

    public void run() {
        out.println("\nPost-processing shell. Commands:");
        out.println("  mode <soft|balanced|strong|aipoison>");
        out.println("  strength <0..50>");
        out.println("  seed <long>");
        out.println("  protect                           re-run with current settings");
        out.println("  watermark <path>                  load watermark image");
        out.println("  place <x> <y> [scale]             image coordinates");
        out.println("  placeview <vx> <vy> <viewW> <viewH> [scale]  preview coordinates");
        out.println("  opacity <0..1>");
        out.println("  text <words...>                   tiled text watermark (empty clears)");
        out.println("  show");
        out.println("  save <name.png|name.jpg>");
        out.println("  quit\n");

        try {
            while (true) {
                out.print("post> ");
                out.flush();
                String line = in.readLine();
                if (line == null)
                    break;
                if (!execute(line))
                    break;
            }
        } catch (IOException e) {
            out.println("Shell I/O error: " + e.getMessage());
        }
    }

    /** Runs one command line; returns false when the shell should exit. */
    public boolean execute(String line) {
        line = line.trim();
        if (line.isEmpty())
            return true;

        String[] parts = line.split("\\s+");
        String cmd = parts[0].toLowerCase(Locale.ROOT);
        String[] args = (parts.length > 1) ? Arrays.copyOfRange(parts, 1, parts.length) : new String[0];

        try {
            switch (cmd) {
                case "quit", "exit" -> {
                    return false;
                }
                case "mode" -> update(settings.withMode(ProtectionMode.parse(arg(args, 0, "mode"))));
                case "strength" -> update(settings.withStrength(Integer.parseInt(arg(args, 0, "strength"))));
                case "seed" -> update(settings.withSeed(Long.parseLong(arg(args, 0, "seed"))));
                case "protect" -> update(settings);
                case "opacity" -> update(settings.withOpacity(Double.parseDouble(arg(args, 0, "opacity"))));
                case "text" -> update(settings.withText(args.length == 0 ? null : String.join(" ", args)));
                case "watermark" -> {
                    PixelBuffer wm = ImageLoader.load(Path.of(arg(args, 0, "watermark")));
                    update(settings.withOverlay(new Overlay(wm, 0, 0, 1.0)));
                }
                case "place" -> {
                    Overlay o = requireOverlay();
                    int x = Integer.parseInt(arg(args, 0, "place"));
                    int y = Integer.parseInt(arg(args, 1, "place"));
                    double scale = args.length > 2 ? Double.parseDouble(args[2]) : o.scale();
                    update(settings.withOverlay(o.movedTo(x, y, scale)));
                }
                case "placeview" -> {
                    Overlay o = requireOverlay();
                    double vx = Double.parseDouble(arg(args, 0, "placeview"));
                    double vy = Double.parseDouble(arg(args, 1, "placeview"));
                    double vw = Double.parseDouble(arg(args, 2, "placeview"));
                    double vh = Double.parseDouble(arg(args, 3, "placeview"));
                    double scale = args.length > 4 ? Double.parseDouble(args[4]) : o.scale();
                    ViewMapping view = ViewMapping.uniformFit(vw, vh, original.width(), original.height());
                    int x = (int) Math.floor(view.imageX(vx));
                    int y = (int) Math.floor(view.imageY(vy));
                    update(settings.withOverlay(o.movedTo(x, y, scale)));
                }
                case "show" -> out.println(settings.describe());
                case "save" -> {
                    String name = (args.length > 0) ? args[0] : "protected.png";
                    lastPath = DisplayService.save(image, outputDir.resolve(name));
                    out.println("Saved: " + lastPath);
                }
                default -> out.println("Unknown command: " + cmd);
            }
        } catch (InvalidInputException | NumberFormatException e) {
            out.println("Error: " + e.getMessage());
        } catch (IOException e) {
            out.println("I/O error: " + e.getMessage());
        }
        return true;
    }

    private void update(ProtectionSettings next) {
        image = next.applyTo(original);
        settings = next;
        out.println("Updated preview. " + settings.describe());
    }

    private Overlay requireOverlay() {
        if (settings.overlay() == null)
            throw new InvalidInputException("no watermark loaded (use: watermark <path>)");
        return settings.overlay();
    }

    private static String arg(String[] args, int i, String cmd) {
        if (args.length <= i)
            throw new InvalidInputException("missing argument for '" + cmd + "'");
        return args[i];
    }

    public ProtectionSettings settings() {
        return settings;
    }

    public PixelBuffer image() {
        return image;
    }

    public Path lastPath() {
        return lastPath;
    }
}
