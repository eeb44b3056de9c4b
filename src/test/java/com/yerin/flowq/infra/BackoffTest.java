package com.yerin.flowq.infra;

import com.yerin.flowq.domain.JobOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("백오프 계산 테스트")
public class BackoffTest {

    @Test
    @DisplayName("지수 백오프는 실패할 때마다 두 배")
    void exponential_doubles() {
        long base = Duration.ofMinutes(8).toMillis();

        assertThat(Backoff.exponential(1, base)).isEqualTo(Duration.ofMinutes(8));
        assertThat(Backoff.exponential(2, base)).isEqualTo(Duration.ofMinutes(16));
        assertThat(Backoff.exponential(3, base)).isEqualTo(Duration.ofMinutes(32));
        assertThat(Backoff.exponential(4, base)).isEqualTo(Duration.ofMinutes(64));
    }

    @Test
    @DisplayName("fixed 는 고정값, 옵션이 없으면 0")
    void fixed_and_missing() {
        assertThat(Backoff.of(new JobOptions.BackoffOptions("fixed", 1000), 4)).isEqualTo(Duration.ofSeconds(1));
        assertThat(Backoff.of(null, 4)).isEqualTo(Duration.ZERO);
        assertThat(Backoff.of(new JobOptions.BackoffOptions(JobOptions.EXPONENTIAL, 1000), 3))
                .isEqualTo(Duration.ofSeconds(4));
    }
}
