package app.sage.core.review.config;

import app.sage.core.review.algorithm.FsrsParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FsrsProps.class)
public class ReviewEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(ReviewEngineConfig.class);

    @Bean
    public FsrsParameters fsrsParameters(FsrsProps props) {
        FsrsParameters params = toParameters(props);
        log.info("FSRS parameters requestRetention={} maximumIntervalDays={} steps={}m/{}m/{}m relearn={}m",
                params.requestRetention(),
                params.maximumIntervalDays(),
                params.againStepMinutes(),
                params.hardStepMinutes(),
                params.goodStepMinutes(),
                params.relearningStepMinutes());
        return params;
    }

    static FsrsParameters toParameters(FsrsProps props) {
        FsrsParameters d = FsrsParameters.defaults();
        if (props == null) return d;

        return new FsrsParameters(
                or(props.requestRetention(), d.requestRetention()),
                or(props.maximumIntervalDays(), d.maximumIntervalDays()),
                (props.weights() == null || props.weights().isEmpty()) ? d.weights() : props.weights(),
                or(props.againStepMinutes(), d.againStepMinutes()),
                or(props.hardStepMinutes(), d.hardStepMinutes()),
                or(props.goodStepMinutes(), d.goodStepMinutes()),
                or(props.relearningStepMinutes(), d.relearningStepMinutes()),
                or(props.easyBonus(), d.easyBonus())
        );
    }

    private static <T> T or(T value, T fallback) {
        return value == null ? fallback : value;
    }
}
