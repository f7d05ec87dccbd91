package dev.pekelund.menuscan.menuparser.pipeline;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "menu.extraction")
public class MenuExtractionProperties {

    /**
     * Wall-clock budget for decoding one upload (OCR, PDF or spreadsheet reading).
     */
    private Duration decodeTimeout = Duration.ofSeconds(30);

    /**
     * Items with a confidence below this value are flagged for review.
     */
    private int confidenceFloor = 60;

    /**
     * Number of threads decoding uploads concurrently.
     */
    private int workerThreads = 4;

    /**
     * Side length in pixels of the cells scored by the image region detector.
     */
    private int regionCellSize = 50;

    /**
     * Maximum distance in pixels between an item's printed name and the centre of its image.
     */
    private double matchDistance = 300;

    /**
     * How long a slot's latest result stays readable after it was published.
     */
    private Duration resultRetention = Duration.ofMinutes(30);

    /**
     * Upper bound on the number of slots whose latest result is kept.
     */
    private long maxRetainedSlots = 1000;

    public Duration getDecodeTimeout() {
        return decodeTimeout;
    }

    public void setDecodeTimeout(Duration decodeTimeout) {
        this.decodeTimeout = decodeTimeout;
    }

    public int getConfidenceFloor() {
        return confidenceFloor;
    }

    public void setConfidenceFloor(int confidenceFloor) {
        this.confidenceFloor = confidenceFloor;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getRegionCellSize() {
        return regionCellSize;
    }

    public void setRegionCellSize(int regionCellSize) {
        this.regionCellSize = regionCellSize;
    }

    public double getMatchDistance() {
        return matchDistance;
    }

    public void setMatchDistance(double matchDistance) {
        this.matchDistance = matchDistance;
    }

    public Duration getResultRetention() {
        return resultRetention;
    }

    public void setResultRetention(Duration resultRetention) {
        this.resultRetention = resultRetention;
    }

    public long getMaxRetainedSlots() {
        return maxRetainedSlots;
    }

    public void setMaxRetainedSlots(long maxRetainedSlots) {
        this.maxRetainedSlots = maxRetainedSlots;
    }
}
