package com.prmanager.backend.global.config;

import com.prmanager.backend.modules.review.application.RandomReviewerSampler;
import com.prmanager.backend.modules.review.application.ReviewerSampler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
public class SamplingConfig {

    static final String SEED_PROPERTY = "prmanager.review.sampling-seed";

    private static final Logger log = LoggerFactory.getLogger(SamplingConfig.class);

    @Bean
    public ReviewerSampler reviewerSampler(@Value("${" + SEED_PROPERTY + ":}") String seed) {
        if (!StringUtils.hasText(seed)) {
            return RandomReviewerSampler.unseeded();
        }
        long parsed;
        try {
            parsed = Long.parseLong(seed.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(SEED_PROPERTY + " must be a whole number, was '" + seed + "'", e);
        }
        log.warn("Reviewer sampling uses fixed seed {}; assignments are reproducible", parsed);
        return RandomReviewerSampler.seeded(parsed);
    }
}
