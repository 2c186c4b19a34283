package quest.gekko.pulse.service.scoring;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.pulse.config.PulseProperties;
import quest.gekko.pulse.exception.ScoringFailureException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpTransformerClientTest {

    private static PulseProperties.Transformer props(String endpoint, Duration timeout) {
        return new PulseProperties.Transformer(endpoint, "sst2", "token", 512, timeout, 3, Duration.ofMillis(1));
    }

    @Test
    void parsesLabelDistributions() {
        WebClient http = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body("[[{\"label\":\"POSITIVE\",\"score\":0.98},{\"label\":\"NEGATIVE\",\"score\":0.02}]]")
                        .build()))
                .build();
        HttpTransformerClient client = new HttpTransformerClient(http, props("http://inference.test/sst2", Duration.ofSeconds(5)));

        List<List<LabelScore>> result = client.classify(List.of("great show"));

        assertThat(result).hasSize(1);
        assertThat(result.get(0)).containsExactly(new LabelScore("POSITIVE", 0.98), new LabelScore("NEGATIVE", 0.02));
    }

    @Test
    void serverErrorsAreRetriedThenReported() {
        AtomicInteger calls = new AtomicInteger();
        WebClient http = WebClient.builder()
                .exchangeFunction(request -> {
                    calls.incrementAndGet();
                    return Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build());
                })
                .build();
        HttpTransformerClient client = new HttpTransformerClient(http, props("http://inference.test/sst2", Duration.ofSeconds(5)));

        assertThatThrownBy(() -> client.classify(List.of("x")))
                .isInstanceOfSatisfying(ScoringFailureException.class, e -> {
                    assertThat(e.isTimeout()).isFalse();
                    assertThat(e.getMessage()).contains("503");
                });
        assertThat(calls).hasValue(3);
    }

    @Test
    void slowAnswerIsReportedAsTimeout() {
        WebClient http = WebClient.builder()
                .exchangeFunction(request -> Mono.never())
                .build();
        HttpTransformerClient client = new HttpTransformerClient(http, props("http://inference.test/sst2", Duration.ofMillis(50)));

        assertThatThrownBy(() -> client.classify(List.of("x")))
                .isInstanceOfSatisfying(ScoringFailureException.class, e -> {
                    assertThat(e.isTimeout()).isTrue();
                    assertThat(e.getErrorCode()).isEqualTo("ERR-SCR-002");
                });
    }

    @Test
    void missingEndpointFailsWithoutACall() {
        WebClient http = WebClient.builder()
                .exchangeFunction(request -> {
                    throw new AssertionError("no request expected");
                })
                .build();
        HttpTransformerClient client = new HttpTransformerClient(http, props("", Duration.ofSeconds(1)));

        assertThatThrownBy(() -> client.classify(List.of("x")))
                .isInstanceOf(ScoringFailureException.class)
                .hasMessageContaining("not configured");
    }
}
