package com.launchpad.core.engine;

import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchException;
import com.launchpad.core.model.LaunchStatus;
import com.launchpad.core.persistence.LaunchRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Picks up launches left in progress by a previous process once the application is ready.
 */
@Service
public class LaunchRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(LaunchRecoveryService.class);

    private final LaunchRepository repository;
    private final LaunchEngine engine;
    private final OrchestratorProperties properties;

    public LaunchRecoveryService(LaunchRepository repository, LaunchEngine engine,
                                 OrchestratorProperties properties) {
        this.repository = repository;
        this.engine = engine;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isResumeOnStartup()) {
            log.debug("Launch recovery disabled");
            return;
        }
        recoverInProgress();
    }

    /**
     * @return how many launches were handed back to the engine
     */
    public int recoverInProgress() {
        List<Launch> stranded = repository.findByStatus(LaunchStatus.IN_PROGRESS);
        if (stranded.isEmpty()) {
            return 0;
        }
        log.info("Resuming {} in-progress launch(es)", stranded.size());
        int resumed = 0;
        for (Launch launch : stranded) {
            try {
                engine.resume(launch.id());
                resumed++;
            } catch (LaunchException e) {
                log.warn("Could not resume launch {}: {}", launch.id(), e.getMessage());
            }
        }
        return resumed;
    }
}
