package fr.lapetina.ultra.comparison.infrastructure.config;

/**
 * Root configuration object for the comparison service.
 * Designed to be populated from YAML.
 */
public class ComparisonConfig {

    private ServerConfig server = new ServerConfig();
    private ClusteringConfig clustering = new ClusteringConfig();
    private SegmentsConfig segments = new SegmentsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public ClusteringConfig getClustering() { return clustering; }
    public void setClustering(ClusteringConfig clustering) { this.clustering = clustering; }

    public SegmentsConfig getSegments() { return segments; }
    public void setSegments(SegmentsConfig segments) { this.segments = segments; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 4;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * Rest period clustering.
     */
    public static class ClusteringConfig {
        private double mileVarianceThreshold = 5.0;

        public double getMileVarianceThreshold() { return mileVarianceThreshold; }
        public void setMileVarianceThreshold(double mileVarianceThreshold) { this.mileVarianceThreshold = mileVarianceThreshold; }
    }

    /**
     * Segment ranking.
     */
    public static class SegmentsConfig {
        private int criticalSegmentLimit = 5;

        public int getCriticalSegmentLimit() { return criticalSegmentLimit; }
        public void setCriticalSegmentLimit(int criticalSegmentLimit) { this.criticalSegmentLimit = criticalSegmentLimit; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "ultra_compare";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
