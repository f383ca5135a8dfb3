package pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Outcome of a batch: written outputs in job order, and failed inputs with their reasons. */
public record BatchResult(List<Path> written, Map<Path, String> failures) {

    public BatchResult {
        written = List.copyOf(written);
        failures = Map.copyOf(failures);
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }
}
