package com.deepansh.memory.maintenance;

import com.deepansh.memory.model.JobType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Auto-discovers all MaintenanceJobHandler beans via Spring injection.
 * Adding a job type = implement MaintenanceJobHandler + @Component.
 */
@Component
@Slf4j
public class MaintenanceJobRegistry {

    private final Map<JobType, MaintenanceJobHandler> handlers = new EnumMap<>(JobType.class);

    public MaintenanceJobRegistry(List<MaintenanceJobHandler> handlerBeans) {
        for (MaintenanceJobHandler handler : handlerBeans) {
            MaintenanceJobHandler previous = handlers.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for job type " + handler.type() + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
            log.info("Registered maintenance handler: {} -> {}", handler.type(), handler.getClass().getSimpleName());
        }
    }

    public Optional<MaintenanceJobHandler> find(JobType type) {
        return Optional.ofNullable(handlers.get(type));
    }
}
