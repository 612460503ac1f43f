package org.nmlkit.index;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.api.NamelistException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for {@link IndexBound} parsing and sizing.
 */
@Tag("unit")
class IndexBoundTest {

    @Test
    void parsesAllForms() throws NamelistException {
        assertThat(IndexBound.parse(":")).isEqualTo(IndexBound.implicit());
        assertThat(IndexBound.parse("5")).isEqualTo(IndexBound.single(5));
        assertThat(IndexBound.parse("1:10")).isEqualTo(IndexBound.range(1, 10));
        assertThat(IndexBound.parse(" 1 : 10 : 2 ")).isEqualTo(IndexBound.range(1, 10, 2));
        assertThat(IndexBound.parse("3:")).isEqualTo(new IndexBound(3, null, null));
        assertThat(IndexBound.parse(":4")).isEqualTo(new IndexBound(null, 4, null));
    }

    @Test
    void rejectsMalformedSpecifications() {
        assertThatThrownBy(() -> IndexBound.parse("1:10:0"))
                .isInstanceOf(NamelistException.class)
                .extracting(e -> ((NamelistException) e).getCode())
                .isEqualTo(NamelistErrorCode.INVALID_INDEX);
        assertThatThrownBy(() -> IndexBound.parse("1:2:3:4")).isInstanceOf(NamelistException.class);
        assertThatThrownBy(() -> IndexBound.parse("a:b")).isInstanceOf(NamelistException.class);
    }

    @Test
    void computesSizes() {
        assertThat(IndexBound.range(1, 10, 2).size(1, 1)).isEqualTo(5);
        assertThat(IndexBound.range(10, 1, -3).size(1, 1)).isEqualTo(4);
        assertThat(IndexBound.range(5, 1).size(1, 1)).isZero();
        assertThat(IndexBound.implicit().size(1, 4)).isEqualTo(4);
        assertThat(IndexBound.implicit().effectiveStart(0)).isZero();
        assertThat(IndexBound.implicit().effectiveStride()).isEqualTo(1);
    }
}
