package org.javai.result.boundary;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link FailureReporter} that delegates to several reporters.
 *
 * <p>Every reporter receives every report. A reporter that throws is logged and skipped,
 * so the remaining reporters still run and the boundary still returns its failure.
 */
public final class CompositeFailureReporter implements FailureReporter {

    private static final Logger LOG = LoggerFactory.getLogger(CompositeFailureReporter.class);

    private final List<FailureReporter> reporters;

    private CompositeFailureReporter(List<FailureReporter> reporters) {
        this.reporters = List.copyOf(reporters);
    }

    public static CompositeFailureReporter of(FailureReporter... reporters) {
        Objects.requireNonNull(reporters, "reporters must not be null");
        return new CompositeFailureReporter(Arrays.asList(reporters));
    }

    @Override
    public void report(String operation, Exception exception) {
        for (FailureReporter reporter : reporters) {
            try {
                reporter.report(operation, exception);
            } catch (RuntimeException e) {
                LOG.warn("Reporter {} failed while reporting operation [{}]",
                        reporter.getClass().getName(), operation, e);
            }
        }
    }
}
