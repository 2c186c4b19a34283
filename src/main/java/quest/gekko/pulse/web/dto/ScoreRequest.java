package quest.gekko.pulse.web.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * Body of the admin score, rescore and aggregate calls. Empty {@code titleIds} means every
 * tracked title; a null {@code model} means the configured one.
 */
public record ScoreRequest(LocalDate from, LocalDate to, List<String> titleIds, String model, List<String> sources) {
}
