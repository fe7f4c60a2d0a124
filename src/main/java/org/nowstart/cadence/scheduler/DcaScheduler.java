package org.nowstart.cadence.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.service.DcaWorkflowService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class DcaScheduler {

    private final DcaWorkflowService dcaWorkflowService;

    @Scheduled(cron = "${cadence.schedule.cron:0 5 9 * * *}", zone = "${cadence.schedule.zone:America/Los_Angeles}")
    public void run() {
        try {
            dcaWorkflowService.runOnce();
        } catch (RuntimeException e) {
            log.error("Scheduled DCA run failed; next trigger will retry.", e);
        }
    }
}
