package com.flow.core.config;

import com.flow.core.model.Resources;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResourceCatalogTest {

    private FlowProperties properties;
    private ResourceCatalog catalog;

    @BeforeEach
    void setUp() {
        properties = new FlowProperties();
        var bwa = new FlowProperties.ResourceSpec(4, 8192, 60, "docker://bwa");
        bwa.setExtraArgs("--nv");
        properties.getResources().put("bwa", bwa);
        catalog = new ResourceCatalog(properties);
    }

    @Test
    @DisplayName("resolves configured analyses")
    void resolvesConfigured() {
        assertEquals(new Resources(4, 8192, 60, "docker://bwa", "--nv"), catalog.resourcesFor("bwa"));
    }

    @Test
    @DisplayName("applies no defaults for unknown analyses")
    void unknownAnalysis() {
        var r = catalog.resourcesFor("nope");
        assertEquals(0, r.cpus());
        assertEquals(0, r.memoryMb());
        assertEquals(0, r.timeLimitMinutes());
        assertNull(r.containerRef());
    }

    @Test
    @DisplayName("overrides win over configuration")
    void overridesWin() {
        var override = new FlowProperties.ResourceSpec(1, 10, 1, "img");
        assertEquals(new Resources(1, 10, 1, "img"), catalog.resourcesFor("bwa", Map.of("bwa", override)));
    }

    @Test
    @DisplayName("budget and timeout come from properties")
    void budgetAndTimeout() {
        properties.getBudget().setCpus(16);
        properties.getBudget().setMemoryMb(65536);

        var budget = catalog.newBudget();

        assertEquals(16, budget.maxCpus());
        assertEquals(65536, budget.maxMemoryMb());
        assertNull(properties.runTimeout());
        properties.setRunTimeoutMinutes(90);
        assertEquals(Duration.ofMinutes(90), properties.runTimeout());
    }
}
