package org.pragmatica.config;

import org.junit.jupiter.api.Test;
import org.pragmatica.config.ReadError.AndErrors;
import org.pragmatica.config.ReadError.OrErrors;
import org.pragmatica.config.tree.Step;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReadErrorTest {
    private static final ReadError MISSING_A = ReadError.missingValue(List.of(Step.key("a")));
    private static final ReadError MISSING_B = ReadError.missingValue(List.of(Step.key("b")));
    private static final ReadError INVALID_C = ReadError.conversionError(List.of(Step.key("c"), Step.index(2)), "x", "int", "");

    @Test
    void and_flattensNestedGroups() {
        var error = ReadError.and(ReadError.and(MISSING_A, MISSING_B), INVALID_C);

        assertThat(error).isEqualTo(new AndErrors(List.of(MISSING_A, MISSING_B, INVALID_C)));
    }

    @Test
    void or_keepsAndGroupsIntact() {
        var error = ReadError.or(ReadError.and(MISSING_A, MISSING_B), INVALID_C);

        assertThat(error).isInstanceOf(OrErrors.class);
        assertThat(((OrErrors) error).errors()).hasSize(2);
        assertThat(error.size()).isEqualTo(3);
    }

    @Test
    void isMissingOnly_isTrue_whenEveryLeafIsMissing() {
        assertThat(ReadError.and(MISSING_A, MISSING_B)
                            .isMissingOnly()).isTrue();
        assertThat(ReadError.and(MISSING_A, INVALID_C)
                            .isMissingOnly()).isFalse();
    }

    @Test
    void isRecoverable_isFalse_whenSourceErrorReachable() {
        var sourceError = ReadError.sourceError("Unable to read file");

        assertThat(ReadError.or(MISSING_A, sourceError)
                            .isRecoverable()).isFalse();
        assertThat(ReadError.or(MISSING_A, INVALID_C)
                            .isRecoverable()).isTrue();
    }

    @Test
    void message_rendersPath() {
        assertThat(MISSING_A.message()).isEqualTo("Missing value at a");
        assertThat(INVALID_C.message()).isEqualTo("Invalid value 'x' at c[2], expected int");
        assertThat(ReadError.and(MISSING_A, MISSING_B)
                            .message()).isEqualTo("All of: [Missing value at a; Missing value at b]");
    }
}
