package org.cnf.report;

/**
 * Misura tempo trascorso e variazione della memoria heap occupata a partire
 * dalla creazione della sonda.
 *
 * La variazione di memoria è indicativa: dipende dal garbage collector e può
 * essere negativa se una raccolta avviene durante la misura.
 */
public final class ResourceMeter {

    private final long startTime;
    private final long startMemory;

    private ResourceMeter() {
        this.startMemory = usedMemory();
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Avvia una nuova misura.
     */
    public static ResourceMeter start() {
        return new ResourceMeter();
    }

    public long elapsedMillis() {
        return System.currentTimeMillis() - startTime;
    }

    public long memoryDeltaBytes() {
        return usedMemory() - startMemory;
    }

    private static long usedMemory() {
        Runtime runtime = Runtime.getRuntime();
        return runtime.totalMemory() - runtime.freeMemory();
    }
}
