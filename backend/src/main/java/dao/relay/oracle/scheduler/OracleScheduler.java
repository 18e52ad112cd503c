package dao.relay.oracle.scheduler;

import dao.relay.oracle.config.OracleProperties;
import dao.relay.oracle.config.SchedulerProperties;
import dao.relay.oracle.model.EngineOutcome;
import dao.relay.oracle.service.OracleEngine;
import dao.relay.oracle.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class OracleScheduler {

    static final int EXIT_CODE_TERMINATED = 1;

    private final OracleEngine engine;
    private final SchedulerProperties schedulerProps;
    private final OracleProperties oracleProps;
    private final Sleeper sleeper;
    private final ApplicationContext context;
    private volatile boolean terminating;

    public OracleScheduler(OracleEngine engine,
                           SchedulerProperties schedulerProps,
                           OracleProperties oracleProps,
                           Sleeper sleeper,
                           ApplicationContext context) {
        this.engine = engine;
        this.schedulerProps = schedulerProps;
        this.oracleProps = oracleProps;
        this.sleeper = sleeper;
        this.context = context;
    }

    @Scheduled(fixedDelayString = "${scheduler.poll-interval-seconds:300}", timeUnit = TimeUnit.SECONDS)
    public void poll() {
        if (!schedulerProps.isEnabled() || terminating) {
            return;
        }

        EngineOutcome outcome;
        try {
            outcome = engine.runCycle();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Oracle cycle interrupted, shutting down");
            return;
        }
        if (outcome.isTerminal()) {
            terminate(outcome);
        }
    }

    void terminate(EngineOutcome outcome) {
        terminating = true;
        log.error("Oracle terminating ({}): {}", outcome.kind(), outcome.reason());
        if (outcome.kind() == EngineOutcome.Kind.WATCHDOG_TIMEOUT) {
            try {
                sleeper.sleep(Duration.ofSeconds(oracleProps.getWatchdogGraceSeconds()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Grace period interrupted");
            }
        }
        exit(EXIT_CODE_TERMINATED);
    }

    // from a separate thread: the context waits for this scheduled task while closing
    protected void exit(int code) {
        Thread exitThread = new Thread(() -> System.exit(SpringApplication.exit(context, () -> code)), "oracle-exit");
        exitThread.start();
    }
}
