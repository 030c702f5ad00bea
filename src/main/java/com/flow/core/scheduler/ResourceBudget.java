package com.flow.core.scheduler;

import com.flow.core.model.Resources;

/**
 * Global ceiling on CPU and memory held by running tasks.
 *
 * <p>A limit of zero or less means unlimited. Instances are owned by the scheduler's
 * coordination loop and are not thread-safe.
 */
public final class ResourceBudget {

    private final int maxCpus;
    private final long maxMemoryMb;

    private int usedCpus;
    private long usedMemoryMb;

    public ResourceBudget(int maxCpus, long maxMemoryMb) {
        this.maxCpus = Math.max(0, maxCpus);
        this.maxMemoryMb = Math.max(0, maxMemoryMb);
    }

    public static ResourceBudget unlimited() {
        return new ResourceBudget(0, 0);
    }

    public int maxCpus() {
        return maxCpus;
    }

    public long maxMemoryMb() {
        return maxMemoryMb;
    }

    public int usedCpus() {
        return usedCpus;
    }

    public long usedMemoryMb() {
        return usedMemoryMb;
    }

    public boolean isUnlimited() {
        return maxCpus == 0 && maxMemoryMb == 0;
    }

    /** Whether the requirement fits next to what is currently held. */
    public boolean canAdmit(Resources r) {
        boolean cpusFit = maxCpus == 0 || usedCpus + r.cpus() <= maxCpus;
        boolean memoryFit = maxMemoryMb == 0 || usedMemoryMb + r.memoryMb() <= maxMemoryMb;
        return cpusFit && memoryFit;
    }

    public boolean tryAcquire(Resources r) {
        if (!canAdmit(r)) {
            return false;
        }
        usedCpus += r.cpus();
        usedMemoryMb += r.memoryMb();
        return true;
    }

    public void release(Resources r) {
        if (usedCpus - r.cpus() < 0 || usedMemoryMb - r.memoryMb() < 0) {
            throw new InternalSchedulingException(String.format(
                    "budget released below zero: held %d cpus / %d MB, releasing %d cpus / %d MB",
                    usedCpus, usedMemoryMb, r.cpus(), r.memoryMb()));
        }
        usedCpus -= r.cpus();
        usedMemoryMb -= r.memoryMb();
    }

    @Override
    public String toString() {
        return String.format("ResourceBudget [cpus=%d/%s, memoryMb=%d/%s]",
                usedCpus, maxCpus == 0 ? "unlimited" : maxCpus,
                usedMemoryMb, maxMemoryMb == 0 ? "unlimited" : maxMemoryMb);
    }
}
