package org.nowstart.backtester.data.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Exactly one data block is used. When several are set, API wins, then database, CSV and live.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DataSettings {

    private Duration interval;
    private String dataType;
    private ApiData apiData;
    private DatabaseData databaseData;
    private CsvData csvData;
    private LiveData liveData;

    public boolean hasSource() {
        return apiData != null || databaseData != null || csvData != null || liveData != null;
    }
}
