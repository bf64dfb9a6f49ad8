package com.baufi.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultTest {

    private static Result<Integer, String> half(int value) {
        return value % 2 == 0 ? Result.success(value / 2) : Result.failure("odd");
    }

    @Nested
    @DisplayName("accessors")
    class Accessors {
        @Test
        void successExposesValue() {
            Result<Integer, String> result = Result.success(4);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.isFailure()).isFalse();
            assertThat(result.getValue()).isEqualTo(4);
            assertThatThrownBy(result::getError).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void failureExposesError() {
            Result<Integer, String> result = Result.failure("broken");
            assertThat(result.isFailure()).isTrue();
            assertThat(result.getError()).isEqualTo("broken");
            assertThatThrownBy(result::getValue).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(result::orElseThrow)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("broken");
        }

        @Test
        void failureRequiresError() {
            assertThatThrownBy(() -> Result.failure(null)).isInstanceOf(NullPointerException.class);
        }

        @Test
        void getOrElseAndOptional() {
            assertThat(Result.<Integer, String>success(1).getOrElse(9)).isEqualTo(1);
            assertThat(Result.<Integer, String>failure("x").getOrElse(9)).isEqualTo(9);
            assertThat(Result.<Integer, String>failure("x").toOptional()).isEmpty();
            assertThat(Result.<Void, String>success(null).toOptional()).isEmpty();
        }
    }

    @Nested
    @DisplayName("combinators")
    class Combinators {
        @Test
        @DisplayName("map and mapError touch only their own side")
        void mapAndMapError() {
            assertThat(Result.<Integer, String>success(2).map(v -> v * 10).getValue()).isEqualTo(20);
            assertThat(Result.<Integer, String>failure("e").map(v -> v * 10).getError()).isEqualTo("e");
            assertThat(Result.<Integer, String>failure("e").mapError(String::length).getError()).isEqualTo(1);
            assertThat(Result.<Integer, String>success(2).mapError(String::length).getValue()).isEqualTo(2);
        }

        @Test
        @DisplayName("flatMap short-circuits on the first failure")
        void flatMapShortCircuits() {
            assertThat(half(8).flatMap(ResultTest::half).getValue()).isEqualTo(2);
            assertThat(half(6).flatMap(ResultTest::half).getError()).isEqualTo("odd");
            assertThat(half(3).flatMap(ResultTest::half).getError()).isEqualTo("odd");
        }

        @Test
        @DisplayName("monad laws hold for flatMap")
        void monadLaws() {
            Function<Integer, Result<Integer, String>> f = ResultTest::half;
            Function<Integer, Result<Integer, String>> g = v -> Result.success(v + 1);
            for (int value : new int[]{0, 3, 8, 12}) {
                assertThat(Result.<Integer, String>success(value).flatMap(f)).isEqualTo(f.apply(value));
                Result<Integer, String> m = half(value);
                assertThat(m.flatMap(Result::success)).isEqualTo(m);
                assertThat(m.flatMap(f).flatMap(g)).isEqualTo(m.flatMap(v -> f.apply(v).flatMap(g)));
            }
        }

        @Test
        void foldPicksBranch() {
            assertThat(half(4).<String>fold(v -> "ok " + v, e -> "err " + e)).isEqualTo("ok 2");
            assertThat(half(5).<String>fold(v -> "ok " + v, e -> "err " + e)).isEqualTo("err odd");
        }
    }
}
