package com.whereq.modelhub.capability;

import com.whereq.modelhub.model.ModelKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Capability table mapping every model kind to its capability
 */
@Slf4j
@Service
public class ModelCapabilities {

    @Autowired
    private List<ModelCapability> capabilities;

    private final Map<ModelKind, ModelCapability> byKind = new EnumMap<>(ModelKind.class);

    public ModelCapabilities() {
    }

    public ModelCapabilities(List<ModelCapability> capabilities) {
        this.capabilities = capabilities;
        initialize();
    }

    @PostConstruct
    public void initialize() {
        byKind.clear();
        for (ModelCapability capability : capabilities) {
            ModelCapability previous = byKind.put(capability.kind(), capability);
            if (previous != null) {
                throw new IllegalStateException("Two capabilities registered for kind " + capability.kind()
                    + ": " + previous.getClass().getSimpleName() + ", " + capability.getClass().getSimpleName());
            }
        }

        for (ModelKind kind : ModelKind.values()) {
            if (!byKind.containsKey(kind)) {
                throw new IllegalStateException("No capability registered for model kind " + kind);
            }
        }

        log.info("Model capabilities initialized: {}", byKind.keySet());
    }

    /**
     * Get the capability for a kind
     *
     * @param kind model kind
     * @return capability serving the kind
     */
    public ModelCapability forKind(ModelKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("Model kind is required");
        }
        return byKind.get(kind);
    }
}
