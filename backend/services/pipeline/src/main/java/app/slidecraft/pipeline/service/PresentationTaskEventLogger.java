package app.slidecraft.pipeline.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class PresentationTaskEventLogger {

    private static final Logger log = LoggerFactory.getLogger(PresentationTaskEventLogger.class);

    @EventListener
    public void onFinished(PresentationTaskFinishedEvent event) {
        if (event.error() == null) {
            log.info("Presentation task finished taskId={} status={} artifactRef={}",
                    event.taskId(), event.status(), event.artifactRef());
            return;
        }
        log.info("Presentation task finished taskId={} status={} errorKind={} errorStage={}",
                event.taskId(), event.status(), event.error().kind().code(), event.error().stage());
    }
}
