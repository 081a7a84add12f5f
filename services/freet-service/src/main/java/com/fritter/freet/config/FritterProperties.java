package com.fritter.freet.config;

import com.fritter.freet.domain.DiscoverySampling;
import com.fritter.freet.domain.Freet;
import com.fritter.freet.domain.SortType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "fritter")
@Validated
public class FritterProperties {

    private FeedProperties feed = new FeedProperties();
    private AuditProperties audit = new AuditProperties();
    @Valid
    private FreetProperties freet = new FreetProperties();
    private KafkaProperties kafka = new KafkaProperties();

    @Data
    public static class FeedProperties {
        private Duration lookback = Duration.ofDays(7);
        private DiscoverySampling discoverySampling = DiscoverySampling.WITH_REPLACEMENT;
        private SortType defaultSort = SortType.HOT;
    }

    @Data
    public static class AuditProperties {
        private Duration window = Duration.ofHours(12);
        /** Downvotes a freet must exceed before reports can trigger an audit. */
        private int minDownvotes = 10;
        /** Reports must exceed downvotes divided by this. */
        private int reportDivisor = 10;
        private double failRatio = 2.0;
        private ReaperProperties reaper = new ReaperProperties();
    }

    @Data
    public static class ReaperProperties {
        private boolean enabled = false;
        private Duration interval = Duration.ofMinutes(5);
    }

    @Data
    public static class FreetProperties {
        /** Bounded by the width of the content column. */
        @Min(1)
        @Max(Freet.MAX_CONTENT_LENGTH)
        private int maxLength = Freet.MAX_CONTENT_LENGTH;
    }

    @Data
    public static class KafkaProperties {
        private String moderationTopic = "fritter.moderation-events";
    }
}
