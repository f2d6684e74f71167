package com.trendplatform.common.trend;

import com.trendplatform.common.model.Anomaly;

import java.util.List;

/**
 * Output of {@link AnomalyDetectionStrategy}.
 *
 * @param anomalies  flagged points in series order
 * @param halfWidth  sliding-window half width {@code w} that was used
 * @param seriesSize number of points scanned, boundaries included
 */
public record AnomalyScan(List<Anomaly> anomalies, int halfWidth, int seriesSize) {

    public double confidence() {
        return anomalies.isEmpty() ? 0.2 : 0.8;
    }

    public double strength() {
        return seriesSize == 0 ? 0.0 : (double) anomalies.size() / seriesSize;
    }
}
