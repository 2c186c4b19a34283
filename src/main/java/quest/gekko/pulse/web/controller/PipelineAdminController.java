package quest.gekko.pulse.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.pulse.domain.SentimentModel;
import quest.gekko.pulse.service.pipeline.PipelineService;
import quest.gekko.pulse.service.pipeline.RunSummary;
import quest.gekko.pulse.web.dto.RawContentDTO;
import quest.gekko.pulse.web.dto.ScoreRequest;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/admin/pipeline")
@RequiredArgsConstructor
public class PipelineAdminController {
    private final PipelineService pipeline;

    /** Runs the collectors, or ingests the posted records when a body is given. */
    @PostMapping("/run")
    public RunSummary run(@RequestBody(required = false) List<RawContentDTO> records) {
        if (records == null) {
            log.info("Admin triggered collector run");
            return pipeline.runCollectors();
        }
        log.info("Admin posted {} raw records", records.size());
        return pipeline.run(records.stream().map(RawContentDTO::toRawContent).toList());
    }

    @PostMapping("/score")
    public RunSummary score(@RequestBody ScoreRequest request) {
        return pipeline.score(request.from(), request.to(), request.titleIds(), model(request.model()));
    }

    @PostMapping("/score/pending")
    public RunSummary scorePending(@RequestParam(required = false) String model,
                                   @RequestParam(defaultValue = "1000") int limit) {
        return pipeline.scorePending(model(model), limit);
    }

    @PostMapping("/rescore")
    public RunSummary rescore(@RequestBody ScoreRequest request) {
        log.info("Admin triggered rescore {} .. {} for {}", request.from(), request.to(), request.titleIds());
        return pipeline.rescore(request.from(), request.to(), request.titleIds(), model(request.model()));
    }

    @PostMapping("/aggregate")
    public RunSummary aggregate(@RequestBody ScoreRequest request) {
        return pipeline.aggregate(request.from(), request.to(), request.titleIds(), request.sources());
    }

    private static SentimentModel model(String name) {
        return name == null || name.isBlank() ? null : SentimentModel.parse(name);
    }
}
