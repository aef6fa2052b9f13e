package io.github.ledgersync.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class PagingTokensTest {

    @Test
    void decimalTokensCompareNumerically() {
        assertThat(PagingTokens.isNewer("100", "99")).isTrue();
        assertThat(PagingTokens.isNewer("99", "100")).isFalse();
        assertThat(PagingTokens.compare("123456789012345678901", "123456789012345678900")).isPositive();
        assertThat(PagingTokens.compare("42", "42")).isZero();
    }

    @Test
    void otherTokensCompareLexicographically() {
        assertThat(PagingTokens.isNewer("b", "a")).isTrue();
        assertThat(PagingTokens.isNewer("100-2", "100-10")).isTrue();
    }

    @Test
    void nullSortsBeforeEveryToken() {
        assertThat(PagingTokens.isNewer("1", null)).isTrue();
        assertThat(PagingTokens.isNewer(null, "1")).isFalse();
        assertThat(PagingTokens.compare(null, null)).isZero();
    }

    @Test
    void newestPicksHighestToken() {
        assertThat(PagingTokens.newest(List.of("9", "12", "10"), Function.identity())).isEqualTo("12");
        assertThat(PagingTokens.newest(List.<String>of(), Function.identity())).isNull();
    }
}
