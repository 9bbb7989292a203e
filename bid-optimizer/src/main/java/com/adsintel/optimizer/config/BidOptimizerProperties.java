package com.adsintel.optimizer.config;

import com.adsintel.optimizer.model.Strategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "bid-optimizer")
@Data
public class BidOptimizerProperties {

    private GoogleAds googleAds = new GoogleAds();
    private Resolver resolver = new Resolver();
    private Conversion conversion = new Conversion();
    private Optimization optimization = new Optimization();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class GoogleAds {
        private String developerToken;
        private String clientId;
        private String clientSecret;
        private String refreshToken;
        private String loginCustomerId;
        private String baseUrl = "https://googleads.googleapis.com";
        private String apiVersion = "v17";
        private String tokenUrl = "https://oauth2.googleapis.com/token";

        /**
         * Fails fast when any credential needed to talk to the Ads API is blank.
         * Called before a run touches traffic data.
         */
        public void validate() {
            List<String> missing = new ArrayList<>();
            if (isBlank(developerToken)) missing.add("GOOGLE_ADS_DEVELOPER_TOKEN");
            if (isBlank(clientId)) missing.add("GOOGLE_ADS_CLIENT_ID");
            if (isBlank(clientSecret)) missing.add("GOOGLE_ADS_CLIENT_SECRET");
            if (isBlank(refreshToken)) missing.add("GOOGLE_ADS_REFRESH_TOKEN");
            if (isBlank(loginCustomerId)) missing.add("GOOGLE_ADS_LOGIN_CUSTOMER_ID");
            if (!missing.isEmpty()) {
                throw new ConfigurationMissingException(missing);
            }
        }

        /** Customer ids are configured as "123-456-7890" in the UI but the API wants digits only. */
        public String customerId() {
            return loginCustomerId == null ? null : loginCustomerId.replace("-", "").trim();
        }

        private static boolean isBlank(String s) {
            return s == null || s.isBlank();
        }
    }

    @Data
    public static class Resolver {
        private Mode mode = Mode.DIRECT;
        private int batchSize = 50;
        private int parallelism = 1;
        private boolean adGroupFallback = false;

        public enum Mode {
            DIRECT, AD_GROUP
        }
    }

    @Data
    public static class Conversion {
        private Set<String> qualifyingKinds = new LinkedHashSet<>(List.of("registr", "purchase"));
    }

    @Data
    public static class Optimization {
        private String campaignId;
        private Strategy strategy = Strategy.CPA;
        private BigDecimal maxCpa = new BigDecimal("50");
        private BigDecimal minConversionRate = new BigDecimal("0.05");
        private int attributionWindowDays = 30;
        private boolean dryRun = true;
        private BigDecimal step = new BigDecimal("0.10");
        private BigDecimal maxChange = new BigDecimal("0.30");
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.DATABASE;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "/data/reports";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            DATABASE, CSV, BOTH
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 4 * * ?";
        private boolean runOnStartup = false;
    }
}
