package com.fyl.ranking.mixer;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MixerProperties.class)
public class RankingConfig {}
