package com.scholary.subtitle.aligner.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Registers the validated {@code alignment.*} settings as a bean. */
@Configuration
@EnableConfigurationProperties(AlignmentProperties.class)
public class AlignmentConfig {}
