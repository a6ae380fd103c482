package com.formulatrace.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Bounds applied to every trace, bound from "formula-trace.*" properties.
 */
@Component
@ConfigurationProperties(prefix = "formula-trace")
public class TraceProperties {

    private int maxDepth = 5;
    private int defaultDepth = 2;
    private int maxChildrenPerNode = 80;
    private int maxPrecedentFallbackRefs = 20;
    private int dependentScanBudget = 50_000;
    private boolean hostIndexEnabled = true;

    /**
     * Clamps a requested depth into [1, maxDepth]; null means defaultDepth.
     */
    public int clampDepth(Integer requested) {
        int depth = requested == null ? defaultDepth : requested;
        return Math.max(1, Math.min(depth, maxDepth));
    }

    public int getMaxDepth() { return maxDepth; }
    public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
    public int getDefaultDepth() { return defaultDepth; }
    public void setDefaultDepth(int defaultDepth) { this.defaultDepth = defaultDepth; }
    public int getMaxChildrenPerNode() { return maxChildrenPerNode; }
    public void setMaxChildrenPerNode(int maxChildrenPerNode) { this.maxChildrenPerNode = maxChildrenPerNode; }
    public int getMaxPrecedentFallbackRefs() { return maxPrecedentFallbackRefs; }
    public void setMaxPrecedentFallbackRefs(int maxPrecedentFallbackRefs) { this.maxPrecedentFallbackRefs = maxPrecedentFallbackRefs; }
    public int getDependentScanBudget() { return dependentScanBudget; }
    public void setDependentScanBudget(int dependentScanBudget) { this.dependentScanBudget = dependentScanBudget; }
    public boolean isHostIndexEnabled() { return hostIndexEnabled; }
    public void setHostIndexEnabled(boolean hostIndexEnabled) { this.hostIndexEnabled = hostIndexEnabled; }
}
