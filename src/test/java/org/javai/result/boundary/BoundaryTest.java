package org.javai.result.boundary;

import org.javai.result.Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BoundaryTest {

    private Boundary boundary;
    private List<String> reportedOperations;
    private List<Exception> reportedExceptions;

    @BeforeEach
    void setUp() {
        reportedOperations = new ArrayList<>();
        reportedExceptions = new ArrayList<>();
        boundary = Boundary.withReporter((operation, exception) -> {
            reportedOperations.add(operation);
            reportedExceptions.add(exception);
        });
    }

    @Test
    void call_success_returnsSuccess() {
        Result<String, Exception> result = boundary.call("TestOp", () -> "success");

        assertThat(result).isEqualTo(Result.success("success"));
        assertThat(reportedOperations).isEmpty();
    }

    @Test
    void call_nullValue_returnsSuccessOfNull() {
        Result<String, Exception> result = boundary.call("TestOp", () -> null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.unwrap()).isNull();
    }

    @Test
    void call_checkedException_returnsFailureAndReports() {
        IOException io = new IOException("disk error");

        Result<String, Exception> result = boundary.call("TestOp", () -> {
            throw io;
        });

        assertThat(result).isEqualTo(Result.failure(io));
        assertThat(reportedOperations).containsExactly("TestOp");
        assertThat(reportedExceptions).containsExactly(io);
    }

    @Test
    void call_withErrorMapper_mapsException() {
        Result<String, String> result = boundary.call(
                "Http.get",
                () -> {
                    throw new SocketTimeoutException("read timed out");
                },
                e -> e.getClass().getSimpleName() + ": " + e.getMessage());

        assertThat(result).isEqualTo(Result.failure("SocketTimeoutException: read timed out"));
        assertThat(reportedExceptions).singleElement().isInstanceOf(SocketTimeoutException.class);
    }

    @Test
    void call_withErrorMapper_successSkipsMapper() {
        Result<Integer, String> result = boundary.call("Compute", () -> 42, e -> {
            throw new AssertionError("mapper must not run");
        });

        assertThat(result).isEqualTo(Result.success(42));
    }

    @Test
    void call_runtimeException_propagates() {
        assertThatThrownBy(() -> boundary.call("TestOp", () -> {
            throw new IllegalStateException("defect");
        }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("defect");

        assertThat(reportedOperations).isEmpty();
    }

    @Test
    void call_error_propagates() {
        assertThatThrownBy(() -> boundary.call("TestOp", () -> {
            throw new StackOverflowError();
        }))
                .isInstanceOf(StackOverflowError.class);

        assertThat(reportedOperations).isEmpty();
    }

    @Test
    void call_interrupted_restoresInterruptFlag() {
        try {
            Result<String, Exception> result = boundary.call("Sleep", () -> {
                throw new InterruptedException("stop");
            });

            assertThat(result.isFailureAnd(e -> e instanceof InterruptedException)).isTrue();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void silent_capturesWithoutReporting() {
        Result<String, Exception> result = Boundary.silent().call("TestOp", () -> {
            throw new IOException("quiet");
        });

        assertThat(result.isFailure()).isTrue();
        assertThat(result.unwrapError()).hasMessage("quiet");
    }

    @Test
    void call_resultComposesWithCombinators() {
        int length = boundary.call("Read", () -> "payload")
                .map(String::length)
                .unwrapOr(-1);
        int fallback = boundary.call("Read", () -> {
                    if (length > 0) {
                        throw new IOException("gone");
                    }
                    return "never";
                })
                .map(String::length)
                .unwrapOr(-1);

        assertThat(length).isEqualTo(7);
        assertThat(fallback).isEqualTo(-1);
    }

    @Test
    void constructor_rejectsNullReporter() {
        assertThatThrownBy(() -> new Boundary(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("reporter");
    }

    @Test
    void call_logsCapturedFailureAtDebug() {
        CapturingAppender appender = CapturingAppender.attachTo(Boundary.class.getName());
        try {
            Boundary.silent().call("Disk.read", () -> {
                throw new IOException("bad sector");
            });

            assertThat(appender.messages()).hasSize(1);
            assertThat(appender.messages().get(0))
                    .contains("Disk.read")
                    .contains("java.io.IOException");
            assertThat(appender.events().get(0).getThrown()).hasMessage("bad sector");
        } finally {
            appender.detach();
        }
    }
}
