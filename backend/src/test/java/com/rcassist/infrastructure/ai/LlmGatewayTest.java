package com.rcassist.infrastructure.ai;

import com.rcassist.domain.analysis.model.ErrorKind;
import com.rcassist.domain.analysis.model.InvocationOptions;
import com.rcassist.domain.analysis.model.ProviderName;
import com.rcassist.domain.analysis.model.RawModelReply;
import com.rcassist.infrastructure.concurrent.MdcPropagatingExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LlmGatewayTest {

    private static final ProviderName A = ProviderName.of("a");
    private static final ProviderName B = ProviderName.of("b");
    private static final ProviderName C = ProviderName.of("c");
    private static final InvocationOptions OPTIONS = new InvocationOptions(Duration.ofSeconds(5), 1000, 0.3);

    @Mock
    private LlmProvider providerA;
    @Mock
    private LlmProvider providerB;
    @Mock
    private LlmProvider providerC;

    private ExecutorService executor;
    private LlmGateway gateway;

    @BeforeEach
    void setUp() {
        when(providerA.name()).thenReturn(A);
        when(providerB.name()).thenReturn(B);
        when(providerC.name()).thenReturn(C);
        executor = Executors.newCachedThreadPool();
        gateway = new LlmGateway(List.of(providerA, providerB, providerC), executor, Duration.ZERO);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ProviderCallException authError(ProviderName name) {
        return new ProviderCallException(ErrorKind.PROVIDER_AUTH_ERROR, false, name + ": invalid key (HTTP 401)");
    }

    private static ProviderCallException transientError(ProviderName name) {
        return new ProviderCallException(ErrorKind.PROVIDER_UNAVAILABLE, true, name + ": connection reset");
    }

    @Nested
    @DisplayName("Fallback order")
    class Fallback {

        @Test
        @DisplayName("A auth-fails, B succeeds → B's reply, C never attempted")
        void second_provider_wins() {
            when(providerA.complete(anyString(), any())).thenThrow(authError(A));
            when(providerB.complete(anyString(), any())).thenReturn("analysis from B");

            RawModelReply reply = gateway.invoke("prompt", List.of(A, B, C), OPTIONS);

            assertThat(reply.succeeded()).isTrue();
            assertThat(reply.provider()).isEqualTo(B);
            assertThat(reply.text()).isEqualTo("analysis from B");
            assertThat(reply.error()).isEmpty();
            verify(providerA, times(1)).complete(anyString(), any());
            verify(providerC, never()).complete(anyString(), any());
        }

        @Test
        @DisplayName("first success short-circuits")
        void first_wins() {
            when(providerA.complete(anyString(), any())).thenReturn("ok");

            RawModelReply reply = gateway.invoke("prompt", List.of(A, B), OPTIONS);

            assertThat(reply.provider()).isEqualTo(A);
            verify(providerB, never()).complete(anyString(), any());
        }

        @Test
        @DisplayName("preference order wins over registration order")
        void preference_order() {
            when(providerC.complete(anyString(), any())).thenReturn("from C");

            RawModelReply reply = gateway.invoke("prompt", List.of(C, A), OPTIONS);

            assertThat(reply.provider()).isEqualTo(C);
            verify(providerA, never()).complete(anyString(), any());
        }

        @Test
        @DisplayName("all fail → failure of the last attempt")
        void all_fail_returns_last() {
            when(providerA.complete(anyString(), any())).thenThrow(authError(A));
            when(providerB.complete(anyString(), any())).thenThrow(
                    new ProviderCallException(ErrorKind.PROVIDER_QUOTA_ERROR, false, "b: quota exhausted (HTTP 429)"));

            RawModelReply reply = gateway.invoke("prompt", List.of(A, B), OPTIONS);

            assertThat(reply.succeeded()).isFalse();
            assertThat(reply.provider()).isEqualTo(B);
            assertThat(reply.error()).contains(ErrorKind.PROVIDER_QUOTA_ERROR);
            assertThat(reply.detail()).isEqualTo("b: quota exhausted (HTTP 429)");
            assertThat(reply.text()).isEmpty();
        }

        @Test
        @DisplayName("unconfigured provider name → configuration error attempt, then next provider")
        void unknown_provider_skipped() {
            when(providerA.complete(anyString(), any())).thenReturn("ok");

            RawModelReply reply = gateway.invoke("prompt", List.of(ProviderName.of("missing"), A), OPTIONS);

            assertThat(reply.provider()).isEqualTo(A);
            assertThat(reply.succeeded()).isTrue();
        }

        @Test
        @DisplayName("only an unconfigured provider → configuration error")
        void only_unknown_provider() {
            RawModelReply reply = gateway.invoke("prompt", List.of(ProviderName.of("missing")), OPTIONS);

            assertThat(reply.error()).contains(ErrorKind.CONFIGURATION_ERROR);
        }

        @Test
        @DisplayName("empty preference is rejected")
        void empty_preference() {
            assertThatThrownBy(() -> gateway.invoke("prompt", List.of(), OPTIONS))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Retry")
    class Retry {

        @Test
        @DisplayName("transient failure is retried once and can succeed")
        void transient_retried_once() {
            when(providerA.complete(anyString(), any()))
                    .thenThrow(transientError(A))
                    .thenReturn("second time lucky");

            RawModelReply reply = gateway.invoke("prompt", List.of(A, B), OPTIONS);

            assertThat(reply.succeeded()).isTrue();
            assertThat(reply.provider()).isEqualTo(A);
            verify(providerA, times(2)).complete(anyString(), any());
            verify(providerB, never()).complete(anyString(), any());
        }

        @Test
        @DisplayName("second transient failure → provider unavailable, no third call")
        void transient_twice() {
            when(providerA.complete(anyString(), any())).thenThrow(transientError(A));

            RawModelReply reply = gateway.invoke("prompt", List.of(A), OPTIONS);

            assertThat(reply.error()).contains(ErrorKind.PROVIDER_UNAVAILABLE);
            verify(providerA, times(2)).complete(anyString(), any());
        }

        @Test
        @DisplayName("authentication failure is never retried")
        void auth_not_retried() {
            when(providerA.complete(anyString(), any())).thenThrow(authError(A));

            RawModelReply reply = gateway.invoke("prompt", List.of(A), OPTIONS);

            assertThat(reply.error()).contains(ErrorKind.PROVIDER_AUTH_ERROR);
            verify(providerA, times(1)).complete(anyString(), any());
        }

        @Test
        @DisplayName("unclassified runtime failure from a provider is classified, not thrown")
        void raw_exception_classified() {
            when(providerA.complete(anyString(), any())).thenThrow(new IllegalStateException("boom"));

            RawModelReply reply = gateway.invoke("prompt", List.of(A), OPTIONS);

            assertThat(reply.error()).contains(ErrorKind.PROVIDER_UNAVAILABLE);
            assertThat(reply.detail()).contains("boom");
        }
    }

    @Nested
    @DisplayName("Timeout")
    class Timeout {

        @Test
        @DisplayName("[A, B] both time out → failure carrying B's detail")
        void both_time_out() {
            InvocationOptions shortTimeout = new InvocationOptions(Duration.ofMillis(100), 1000, 0.3);
            when(providerA.complete(anyString(), any())).thenAnswer(invocation -> {
                Thread.sleep(2_000);
                return "too late";
            });
            when(providerB.complete(anyString(), any())).thenAnswer(invocation -> {
                Thread.sleep(2_000);
                return "too late";
            });

            RawModelReply reply = gateway.invoke("prompt", List.of(A, B), shortTimeout);

            assertThat(reply.succeeded()).isFalse();
            assertThat(reply.provider()).isEqualTo(B);
            assertThat(reply.error()).contains(ErrorKind.PROVIDER_TIMEOUT);
            assertThat(reply.detail()).startsWith("b: no reply within 100ms");
            // timeouts are not transient, so each provider is called exactly once
            verify(providerA, times(1)).complete(anyString(), any());
            verify(providerB, times(1)).complete(anyString(), any());
        }

        @Test
        @DisplayName("concurrent runs on the shared executor each get their own full timeout")
        void concurrent_invocations() throws Exception {
            InvocationOptions options = new InvocationOptions(Duration.ofMillis(1_000), 1000, 0.3);
            when(providerA.complete(anyString(), any())).thenAnswer(invocation -> {
                Thread.sleep(300);
                return "analysis";
            });
            ExecutorService callers = Executors.newFixedThreadPool(6);
            try (MdcPropagatingExecutor shared = new MdcPropagatingExecutor("llm")) {
                LlmGateway sharedGateway = new LlmGateway(List.of(providerA), shared, Duration.ZERO);
                List<Future<RawModelReply>> replies = new ArrayList<>();
                for (int i = 0; i < 6; i++) {
                    replies.add(callers.submit(() -> sharedGateway.invoke("prompt", List.of(A), options)));
                }

                for (Future<RawModelReply> reply : replies) {
                    assertThat(reply.get(5, TimeUnit.SECONDS).succeeded()).isTrue();
                }
            } finally {
                callers.shutdownNow();
            }
        }

        @Test
        @DisplayName("a timed-out call is interrupted")
        void timed_out_call_is_interrupted() throws Exception {
            CountDownLatch interrupted = new CountDownLatch(1);
            when(providerA.complete(anyString(), any())).thenAnswer(invocation -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
                return "too late";
            });

            RawModelReply reply = gateway.invoke("prompt", List.of(A),
                    new InvocationOptions(Duration.ofMillis(100), 1000, 0.3));

            assertThat(reply.error()).contains(ErrorKind.PROVIDER_TIMEOUT);
            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
        }
    }
}
