package com.structds.core.signature;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TypeExpressionsTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '`', value = {
        "`Dict[ str ,int ]`             | `Dict[str, int]`",
        "`int|None`                     | `int | None`",
        "`Callable[[int],  str]`        | `Callable[[int], str]`",
        "`typing.List[ int ]`           | `typing.List[int]`",
        "`Optional[ 'Foo' ]`            | `Optional['Foo']`",
        "`Literal['a  b']`              | `Literal['a  b']`",
        "`str`                          | `str`"
    })
    void normalize_collapsesLayout(String expression, String expected) {
        assertThat(TypeExpressions.normalize(expression)).isEqualTo(expected);
    }

    @Test
    void normalize_multiLineWithComment_dropsComment() {
        assertThat(TypeExpressions.normalize("Dict[\n    str,  # key\n    int,\n]"))
            .isEqualTo("Dict[str, int,]");
    }

    @Test
    void normalize_null_returnsNull() {
        assertThat(TypeExpressions.normalize(null)).isNull();
    }
}
