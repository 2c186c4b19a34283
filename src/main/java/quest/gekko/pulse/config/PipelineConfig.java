package quest.gekko.pulse.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.pulse.domain.SentimentModel;
import quest.gekko.pulse.repository.ContentItemRepository;
import quest.gekko.pulse.repository.DailyAggregateRepository;
import quest.gekko.pulse.repository.SentimentScoreRepository;
import quest.gekko.pulse.repository.SurveyResponseRepository;
import quest.gekko.pulse.service.ingest.ContentNormalizer;
import quest.gekko.pulse.service.ingest.TitleRegistry;
import quest.gekko.pulse.service.scoring.HttpTransformerClient;
import quest.gekko.pulse.service.scoring.LexiconScorer;
import quest.gekko.pulse.service.scoring.SentimentLexicon;
import quest.gekko.pulse.service.scoring.SentimentScorer;
import quest.gekko.pulse.service.scoring.TransformerClient;
import quest.gekko.pulse.service.scoring.TransformerScorer;
import quest.gekko.pulse.service.store.InMemoryPipelineStore;
import quest.gekko.pulse.service.store.JpaPipelineStore;
import quest.gekko.pulse.service.store.PipelineStore;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Fails startup on an invalid configuration. */
    @Bean
    public PipelineSettings pipelineSettings(PulseProperties.Pipeline props) {
        return PipelineSettings.from(props);
    }

    @Bean
    public TitleRegistry titleRegistry(PipelineSettings settings) {
        return new TitleRegistry(settings.getTitles());
    }

    @Bean
    public ContentNormalizer contentNormalizer(TitleRegistry titles) {
        return new ContentNormalizer(titles);
    }

    @Bean
    public SentimentLexicon sentimentLexicon() {
        return SentimentLexicon.fromClasspath(SentimentLexicon.DEFAULT_RESOURCE);
    }

    @Bean
    public LexiconScorer lexiconScorer(SentimentLexicon lexicon) {
        return new LexiconScorer(lexicon);
    }

    @Bean
    public WebClient inferenceWebClient(WebClient.Builder builder) {
        return builder.codecs(c -> c.defaultCodecs().maxInMemorySize(4 * 1024 * 1024)).build();
    }

    @Bean
    public TransformerClient transformerClient(WebClient inferenceWebClient, PulseProperties.Pipeline props) {
        return new HttpTransformerClient(inferenceWebClient, props.transformer());
    }

    @Bean
    public TransformerScorer transformerScorer(TransformerClient client, PulseProperties.Pipeline props) {
        return new TransformerScorer(client, props.transformer().maxTokens());
    }

    @Bean
    public Map<SentimentModel, SentimentScorer> scorersByModel(List<SentimentScorer> scorers) {
        return scorers.stream()
                .collect(Collectors.toMap(SentimentScorer::model, Function.identity()));
    }

    @Bean
    public ThreadPoolTaskExecutor lexiconExecutor(PipelineSettings settings) {
        return executor("lexicon-", settings.getLexiconWorkers());
    }

    @Bean
    public ThreadPoolTaskExecutor transformerExecutor(PipelineSettings settings) {
        return executor("transformer-", settings.getTransformerWorkers());
    }

    @Bean
    public ThreadPoolTaskExecutor aggregationExecutor(PipelineSettings settings) {
        return executor("aggregate-", settings.getLexiconWorkers());
    }

    @Bean
    @ConditionalOnProperty(name = "pulse.store", havingValue = "jpa", matchIfMissing = true)
    public PipelineStore jpaPipelineStore(ContentItemRepository items,
                                          SentimentScoreRepository scores,
                                          SurveyResponseRepository responses,
                                          DailyAggregateRepository aggregates) {
        return new JpaPipelineStore(items, scores, responses, aggregates);
    }

    @Bean
    @ConditionalOnProperty(name = "pulse.store", havingValue = "memory")
    public PipelineStore inMemoryPipelineStore() {
        return new InMemoryPipelineStore();
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
