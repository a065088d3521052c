package com.docrender.core.operation;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.error.ValidationException;
import com.docrender.core.model.TableContent;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link LimitOperation}.
 */
class LimitOperationTest extends OperationTestBase {

    @ParameterizedTest
    @CsvSource({"0, 0", "1, 1", "3, 3", "5, 5", "10, 5"})
    void apply_keepsMinOfCountAndSize(int count, int expected) {
        TableContent result = (TableContent) new LimitOperation(count).apply(sales(), CancellationToken.none());

        assertThat(result.rows()).hasSize(expected);
        assertThat(result.rows()).isEqualTo(sales().rows().subList(0, expected));
    }

    @Test
    void validate_withNegativeCount_throwsValidationException() {
        assertThatThrownBy(() -> new LimitOperation(-1).validate())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("non-negative");
    }

    @Test
    void validate_withZero_passes() {
        assertThatCode(() -> new LimitOperation(0).validate()).doesNotThrowAnyException();
    }
}
