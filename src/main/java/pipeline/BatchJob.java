package pipeline;

import java.nio.file.Path;

public record BatchJob(Path input, Path output) {
}
