package io.github.drompincen.scriptops.gateway.job;

import io.github.drompincen.scriptops.runtime.execution.HungExecutionReaper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class HungExecutionSweepJob {

    private static final Logger log = LoggerFactory.getLogger(HungExecutionSweepJob.class);

    private final HungExecutionReaper reaper;

    public HungExecutionSweepJob(HungExecutionReaper reaper) {
        this.reaper = reaper;
    }

    @Scheduled(fixedDelayString = "${scriptops.reaper.interval-ms:300000}",
               initialDelayString = "${scriptops.reaper.initial-delay-ms:60000}")
    public void sweep() {
        try {
            reaper.checkHungExecutions();
        } catch (Exception e) {
            log.error("Hung execution sweep failed", e);
        }
    }
}
