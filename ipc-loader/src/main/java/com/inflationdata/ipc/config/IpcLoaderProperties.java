package com.inflationdata.ipc.config;

import com.inflationdata.ipc.model.SourceMetric;
import com.inflationdata.ipc.model.TaxonomyAxis;
import com.inflationdata.ipc.model.TieBreakPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "ipc-loader")
@Data
public class IpcLoaderProperties {

    private List<Source> sources = new ArrayList<>();
    private Http http = new Http();
    private Load load = new Load();
    private Output output = new Output();
    private Run run = new Run();
    private String natureTable = "classpath:nature-classification.csv";

    public List<Source> enabledSources() {
        return sources.stream().filter(Source::isEnabled).toList();
    }

    @Data
    public static class Source {
        private String name;
        private String url;
        private TaxonomyAxis axis;
        private SourceMetric metric = SourceMetric.INCIDENCE;
        /** Higher wins when two sources fill the same slot */
        private int priority = 0;
        private boolean enabled = true;
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Load {
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate initialStartDate = LocalDate.of(2023, 12, 1);
        /** Already-loaded periods always reprocessed for upstream revisions; values below 2 are raised to 2 */
        private int revisionMonths = 2;
        private TieBreakPolicy tieBreak = TieBreakPolicy.FIRST_WINS;
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.DATABASE;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "./output";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            DATABASE, CSV, BOTH
        }
    }

    @Data
    public static class Run {
        private boolean onStartup = true;
        private boolean exitAfterRun = true;
    }
}
