package quest.gekko.pulse.service.scoring;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import quest.gekko.pulse.config.PulseProperties;
import quest.gekko.pulse.exception.ScoringFailureException;
import reactor.core.Exceptions;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Calls a Hugging Face style inference endpoint ({@code POST {"inputs": [...]}}) that serves
 * the configured model. Decoding is pinned ({@code do_sample=false}) so repeated calls agree.
 * Connection errors and 5xx answers (503 while the model is still loading) are retried;
 * timeouts are not, the caller decides what a timeout means.
 */
@Slf4j
public class HttpTransformerClient implements TransformerClient {
    private static final ParameterizedTypeReference<List<List<LabelScore>>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient http;
    private final PulseProperties.Transformer props;
    private final RetryTemplate retry;

    public HttpTransformerClient(WebClient http, PulseProperties.Transformer props) {
        this.http = http;
        this.props = props;
        this.retry = RetryTemplate.builder()
                .maxAttempts(Math.max(1, props.maxAttempts()))
                .fixedBackoff(Math.max(1L, props.backoff().toMillis()))
                .retryOn(WebClientRequestException.class)
                .retryOn(WebClientResponseException.InternalServerError.class)
                .retryOn(WebClientResponseException.BadGateway.class)
                .retryOn(WebClientResponseException.ServiceUnavailable.class)
                .retryOn(WebClientResponseException.GatewayTimeout.class)
                .build();
    }

    @Override
    public String modelName() {
        return props.modelName();
    }

    @Override
    public List<List<LabelScore>> classify(List<String> texts) {
        if (props.endpoint() == null || props.endpoint().isBlank()) {
            throw new ScoringFailureException("Transformer endpoint not configured for model " + props.modelName());
        }
        try {
            return retry.execute(ctx -> {
                if (ctx.getRetryCount() > 0) {
                    log.warn("Retrying inference call for {} texts (attempt {})", texts.size(), ctx.getRetryCount() + 1);
                }
                return post(texts);
            });
        } catch (WebClientResponseException e) {
            throw new ScoringFailureException("Inference endpoint answered " + e.getStatusCode().value()
                    + " for model " + props.modelName(), e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new ScoringFailureException("Inference call timed out after " + props.timeout(), cause, true);
            }
            throw new ScoringFailureException("Inference call failed: " + e.getMessage(), e);
        }
    }

    private List<List<LabelScore>> post(List<String> texts) {
        return http.post()
                .uri(props.endpoint())
                .headers(h -> {
                    if (props.apiToken() != null && !props.apiToken().isBlank()) {
                        h.setBearerAuth(props.apiToken());
                    }
                })
                .bodyValue(Map.of(
                        "inputs", texts,
                        "parameters", Map.of("truncation", true, "do_sample", false, "top_k", 3),
                        "options", Map.of("wait_for_model", true, "use_cache", true)))
                .retrieve()
                .bodyToMono(RESPONSE_TYPE)
                .timeout(props.timeout())
                .block();
    }
}
