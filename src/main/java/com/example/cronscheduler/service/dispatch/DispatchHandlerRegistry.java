package com.example.cronscheduler.service.dispatch;

import com.example.cronscheduler.domain.enums.TargetType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for dispatch handlers.
 * <p>
 * Automatically discovers and registers all DispatchHandler beans.
 * Provides lookup by target type.
 */
@Slf4j
@Component
public class DispatchHandlerRegistry {

    private final Map<TargetType, DispatchHandler> handlers = new EnumMap<>(TargetType.class);
    private final List<DispatchHandler> handlerBeans;

    public DispatchHandlerRegistry(List<DispatchHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            var type = handler.getTargetType();
            if (handlers.containsKey(type)) {
                log.warn("Duplicate handler for target type {}: {} will override {}",
                        type, handler.getClass().getSimpleName(),
                        handlers.get(type).getClass().getSimpleName());
            }
            handlers.put(type, handler);
            log.info("Registered dispatch handler for target type {}: {}", type, handler.getClass().getSimpleName());
        }

        for (var type : TargetType.values()) {
            if (!handlers.containsKey(type)) {
                log.warn("No dispatch handler registered for target type: {}", type);
            }
        }
    }

    public Optional<DispatchHandler> getHandler(TargetType targetType) {
        return Optional.ofNullable(handlers.get(targetType));
    }

    /**
     * @throws IllegalArgumentException if no handler is registered
     */
    public DispatchHandler getHandlerOrThrow(TargetType targetType) {
        return getHandler(targetType).orElseThrow(() -> new IllegalArgumentException("No dispatch handler registered for target type: " + targetType));
    }

    public boolean hasHandler(TargetType targetType) {
        return handlers.containsKey(targetType);
    }
}
