package app.sage.core.review.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "app.review.fsrs")
public record FsrsProps(
        Double requestRetention,
        Double maximumIntervalDays,
        List<Double> weights,
        Integer againStepMinutes,
        Integer hardStepMinutes,
        Integer goodStepMinutes,
        Integer relearningStepMinutes,
        Double easyBonus
) {}
