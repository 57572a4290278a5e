package com.deporacle.engine.collector;

import com.deporacle.engine.model.DownloadTrend;
import com.deporacle.engine.model.PopularityData;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PopularityCollectorTest {

    @Test
    void shouldClassifyTrendAgainstMonthlyAverage() {
        // weekly average of 4000 / 4 = 1000
        assertEquals(DownloadTrend.RISING, PopularityCollector.trendOf(1101, 4000));
        assertEquals(DownloadTrend.STABLE, PopularityCollector.trendOf(1100, 4000));
        assertEquals(DownloadTrend.STABLE, PopularityCollector.trendOf(900, 4000));
        assertEquals(DownloadTrend.DECLINING, PopularityCollector.trendOf(899, 4000));
    }

    @Test
    void shouldTreatMissingMonthlyAsStable() {
        assertEquals(DownloadTrend.STABLE, PopularityCollector.trendOf(500, 0));
    }

    @Test
    void shouldCarryCounts() {
        PopularityData data = PopularityCollector.toPopularityData("chalk", 2000, 4000);

        assertEquals("chalk", data.packageName());
        assertEquals(2000, data.weeklyDownloads());
        assertEquals(4000, data.monthlyDownloads());
        assertEquals(DownloadTrend.RISING, data.trend());
    }
}
