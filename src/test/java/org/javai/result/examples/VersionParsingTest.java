package org.javai.result.examples;

import org.javai.result.Result;
import org.javai.result.UnwrapOnFailureException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Demonstrates consuming a parser that reports an invalid input as a failure value
 * instead of throwing.
 */
public class VersionParsingTest {

    @Test
    void knownNumbers_parseToVersions() {
        assertThat(Version.parse(1)).isEqualTo(Result.success(Version.VERSION_1));
        assertThat(Version.parse(2)).isEqualTo(Result.success(Version.VERSION_2));
    }

    @Test
    void unknownNumber_isFailure() {
        Result<Version, String> version = Version.parse(3);

        assertThat(version.isFailure()).isTrue();
        assertThat(version.unwrapError()).isEqualTo("invalid version");
    }

    @Test
    void unknownNumber_fallsBackWithUnwrapOr() {
        assertThat(Version.parse(3).unwrapOr(Version.VERSION_1)).isEqualTo(Version.VERSION_1);
    }

    @Test
    void unknownNumber_mapOrElse_invokesOnlyErrorHandler() {
        List<String> printed = new ArrayList<>();

        Version.parse(3).mapOrElse(
                err -> printed.add("error parsing header: " + err),
                v -> printed.add("working with version: " + v));

        assertThat(printed).containsExactly("error parsing header: invalid version");
    }

    @Test
    void knownNumber_mapOrElse_invokesOnlySuccessHandler() {
        List<String> printed = new ArrayList<>();

        Version.parse(1).mapOrElse(
                err -> printed.add("error parsing header: " + err),
                v -> printed.add("working with version: " + v));

        assertThat(printed).containsExactly("working with version: VERSION_1");
    }

    @Test
    void checkThenUnwrap_takesTheMatchingBranch() {
        Result<Version, String> version = Version.parse(3);

        String message = version.isSuccess()
                ? "working with version: " + version.unwrap()
                : "error parsing header: " + version.unwrapError();

        assertThat(message).isEqualTo("error parsing header: invalid version");
    }

    @Test
    void unwrapWithoutCheck_throws() {
        assertThatThrownBy(() -> Version.parse(0).unwrap())
                .isInstanceOf(UnwrapOnFailureException.class)
                .hasMessageEndingWith("invalid version");
    }

    @Test
    void unwrappedValues_combine() {
        int a = Result.<Integer, String>success(1).unwrap();
        int b = Result.<Integer, String>success(2).unwrap();

        assertThat(a + b).isEqualTo(3);
    }

    @Test
    void parsedNumbers_chainIntoUpgradePath() {
        Result<Version, String> upgraded = Version.parse(1)
                .andThen(v -> Version.parse(v.ordinal() + 2));

        assertThat(upgraded).isEqualTo(Result.success(Version.VERSION_2));
        assertThat(Version.parse(2).andThen(v -> Version.parse(v.ordinal() + 2)))
                .isEqualTo(Result.failure("invalid version"));
    }
}
