package org.nowstart.beacon.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.beacon.data.dto.SignalBatchResult;
import org.nowstart.beacon.data.type.EvaluationMode;
import org.nowstart.beacon.service.SignalBatchService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "beacon.signal.scheduler", name = "enabled", havingValue = "true")
public class SignalScheduler {

    private final SignalBatchService signalBatchService;

    @Scheduled(fixedDelayString = "${beacon.signal.scheduler.intrabar-interval:60s}")
    public void runIntrabar() {
        run(EvaluationMode.INTRABAR);
    }

    @Scheduled(cron = "${beacon.signal.scheduler.close-cron:0 0 * * * *}")
    public void runClose() {
        run(EvaluationMode.CLOSE);
    }

    void run(EvaluationMode mode) {
        try {
            SignalBatchResult result = signalBatchService.evaluate(mode, null);
            log.info(
                    "Signal scheduler tick finished. mode={}, signals={}, errors={}",
                    mode,
                    result.signals().size(),
                    result.errors().size()
            );
        } catch (Exception e) {
            log.error("Signal scheduler tick failed. mode={}", mode, e);
        }
    }
}
