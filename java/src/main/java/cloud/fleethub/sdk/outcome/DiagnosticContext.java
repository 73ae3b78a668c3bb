package cloud.fleethub.sdk.outcome;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Remembers the detail of the most recent failure so callers holding only a generic error can still recover
 * the richer reason. Cleared at the start of each call; overwritten on every failed attempt.
 */
public final class DiagnosticContext {

    private final AtomicReference<Diagnostic> last = new AtomicReference<>();

    public void record(Diagnostic diagnostic) {
        if (diagnostic != null) {
            last.set(diagnostic);
        }
    }

    public void clear() {
        last.set(null);
    }

    public Optional<Diagnostic> lastFailure() {
        return Optional.ofNullable(last.get());
    }
}
