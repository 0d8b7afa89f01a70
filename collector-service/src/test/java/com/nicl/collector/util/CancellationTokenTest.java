package com.nicl.collector.util;

import com.nicl.collector.exception.CollectionCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationTokenTest {

    @Test
    @DisplayName("취소된 토큰은 확인 시 예외를 던진다")
    void throwsOnceCancelled() {
        CancellationToken token = CancellationToken.create();
        assertThatCode(token::throwIfCancelled).doesNotThrowAnyException();

        token.cancel();

        assertThat(token.isCancelled()).isTrue();
        assertThatThrownBy(token::throwIfCancelled)
                .isInstanceOf(CollectionCancelledException.class);
    }

    @Test
    @DisplayName("NONE 토큰은 취소할 수 없다")
    void noneCannotBeCancelled() {
        assertThatThrownBy(CancellationToken.NONE::cancel)
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(CancellationToken.orNone(null)).isSameAs(CancellationToken.NONE);
    }
}
