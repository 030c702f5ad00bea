package com.flow.core.config;

import com.flow.core.model.Resources;
import com.flow.core.scheduler.ResourceBudget;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Looks up the resource requirement of an analysis in the resolved configuration.
 *
 * <p>No defaults are applied: an analysis without an entry yields an all-zero
 * {@link Resources} so the validator can report exactly what is missing.
 */
@Service
public class ResourceCatalog {

    private final FlowProperties properties;

    public ResourceCatalog(FlowProperties properties) {
        this.properties = properties;
    }

    public Resources resourcesFor(String analysisName) {
        return resourcesFor(analysisName, Map.of());
    }

    /**
     * Resolves resources, preferring {@code overrides} (e.g. a workflow file's own
     * {@code resources:} block) over {@code flow.resources}.
     */
    public Resources resourcesFor(String analysisName, Map<String, FlowProperties.ResourceSpec> overrides) {
        FlowProperties.ResourceSpec spec = overrides.get(analysisName);
        if (spec == null) {
            spec = properties.getResources().get(analysisName);
        }
        if (spec == null) {
            return new Resources(0, 0, 0, null);
        }
        return new Resources(spec.getCpus(), spec.getMemory(), spec.getTime(),
                spec.getContainer(), spec.getExtraArgs());
    }

    public ResourceBudget newBudget() {
        return new ResourceBudget(properties.getBudget().getCpus(), properties.getBudget().getMemoryMb());
    }
}
