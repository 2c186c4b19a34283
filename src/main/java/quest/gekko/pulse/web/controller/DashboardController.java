package quest.gekko.pulse.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.pulse.domain.DailyAggregate;
import quest.gekko.pulse.domain.Sources;
import quest.gekko.pulse.domain.Title;
import quest.gekko.pulse.service.comparison.AlignmentReport;
import quest.gekko.pulse.service.comparison.AlignmentService;
import quest.gekko.pulse.service.query.DashboardQueryService;
import quest.gekko.pulse.service.query.TitleSummary;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DashboardController {
    private final DashboardQueryService queries;
    private final AlignmentService alignment;

    @GetMapping("/titles")
    public List<Title> titles() {
        return queries.titles();
    }

    @GetMapping("/titles/{titleId}/summary")
    public TitleSummary summary(@PathVariable String titleId, @RequestParam(defaultValue = "7") int days) {
        return queries.summary(titleId, days);
    }

    @GetMapping("/aggregates")
    public List<DailyAggregate> aggregates(@RequestParam String titleId,
                                           @RequestParam(defaultValue = Sources.SOCIAL) String source,
                                           @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                           @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return queries.aggregates(titleId, source, from, to);
    }

    @GetMapping("/alignment")
    public AlignmentReport alignment(@RequestParam String titleId,
                                     @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                     @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return alignment.compare(titleId, from, to);
    }
}
