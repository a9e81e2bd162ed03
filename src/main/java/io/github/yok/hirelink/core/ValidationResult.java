package io.github.yok.hirelink.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of {@link BatchValidator#validate}: either a {@link ValidatedBatch} or the list of
 * violations.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ValidationResult {

    // Validated batch, or null when violations exist
    private final ValidatedBatch batch;

    // Violation messages in input order
    private final ImmutableList<String> violations;

    /**
     * Creates a successful result.
     *
     * @param batch validated batch
     * @return result without violations
     */
    public static ValidationResult ok(ValidatedBatch batch) {
        return new ValidationResult(batch, ImmutableList.of());
    }

    /**
     * Creates a failed result.
     *
     * @param violations violation messages; must not be empty
     * @return result without batch
     */
    public static ValidationResult failed(List<String> violations) {
        return new ValidationResult(null, ImmutableList.copyOf(violations));
    }

    /**
     * Returns whether the batch may be written.
     *
     * @return {@code true} when there are no violations
     */
    public boolean isValid() {
        return violations.isEmpty();
    }
}
